package com.planforge.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.planforge")
public class PlanForgeApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(PlanForgeApiApplication.class, args);
    }
}
