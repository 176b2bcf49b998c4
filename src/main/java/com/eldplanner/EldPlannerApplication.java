package com.eldplanner;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EldPlannerApplication {

    public static void main(String[] args) {
        SpringApplication.run(EldPlannerApplication.class, args);
    }
}
