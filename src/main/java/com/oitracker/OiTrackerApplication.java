package com.oitracker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class OiTrackerApplication {

    public static void main(String[] args) {
        SpringApplication.run(OiTrackerApplication.class, args);
    }
}
