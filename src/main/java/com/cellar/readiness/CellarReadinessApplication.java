package com.cellar.readiness;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class CellarReadinessApplication {

    public static void main(String[] args) {
        SpringApplication.run(CellarReadinessApplication.class, args);
    }
}
