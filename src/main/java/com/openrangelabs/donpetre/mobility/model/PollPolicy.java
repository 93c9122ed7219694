package com.openrangelabs.donpetre.mobility.model;

import java.time.Duration;

/**
 * How often and how long a vendor job is polled
 */
public record PollPolicy(Duration interval, int maxPolls, int callRetries) {
}
