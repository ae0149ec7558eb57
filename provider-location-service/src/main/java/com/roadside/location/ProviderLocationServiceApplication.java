package com.roadside.location;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class ProviderLocationServiceApplication {
    public static void main(String[] args) {
        SpringApplication.run(ProviderLocationServiceApplication.class, args);
    }
}
