package com.kotsin.surge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;


/**
 * Spring Boot application hosting the signal surge detection engine.
 */
@SpringBootApplication
public class SurgeDetectorApplication {

    public static void main(String[] args) {
        SpringApplication.run(SurgeDetectorApplication.class, args);
    }
}
