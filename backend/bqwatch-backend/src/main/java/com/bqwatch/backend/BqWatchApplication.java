package com.bqwatch.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class BqWatchApplication {

    public static void main(String[] args) {
        SpringApplication.run(BqWatchApplication.class, args);
    }
}
