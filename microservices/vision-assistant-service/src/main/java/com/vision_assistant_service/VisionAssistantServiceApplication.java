package com.vision_assistant_service;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class VisionAssistantServiceApplication {

    public static void main(String[] args) {
        System.out.println("⏳ Starting vision-assistant-service...");
        SpringApplication.run(VisionAssistantServiceApplication.class, args);
        System.out.println("✅ vision-assistant-service started.");
    }

}
