package com.subradar;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SubRadarApplication {

    public static void main(String[] args) {
        SpringApplication.run(SubRadarApplication.class, args);
    }
}
