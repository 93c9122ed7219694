package com.openrangelabs.donpetre.mobility.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Short-lived credentials obtained by assuming the vendor's cross-account role.
 * Held in memory only.
 */
public record TemporaryCredentials(String accessKeyId, String secretAccessKey, String sessionToken, Instant expiration) {

    public boolean expiresWithin(Duration margin, Instant now) {
        return expiration == null || !now.plus(margin).isBefore(expiration);
    }

    @Override
    public String toString() {
        return "TemporaryCredentials{accessKeyId=" + accessKeyId + ", expiration=" + expiration + '}';
    }
}
