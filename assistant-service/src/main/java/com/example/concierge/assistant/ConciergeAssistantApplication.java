package com.example.concierge.assistant;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ConciergeAssistantApplication {

    public static void main(String[] args) {
        SpringApplication.run(ConciergeAssistantApplication.class, args);
    }
}
