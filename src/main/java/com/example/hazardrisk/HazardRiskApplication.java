package com.example.hazardrisk;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class HazardRiskApplication {

    public static void main(String[] args) {
        SpringApplication.run(HazardRiskApplication.class, args);
    }
}
