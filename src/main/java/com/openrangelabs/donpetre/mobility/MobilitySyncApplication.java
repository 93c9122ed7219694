package com.openrangelabs.donpetre.mobility;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class MobilitySyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(MobilitySyncApplication.class, args);
    }

}
