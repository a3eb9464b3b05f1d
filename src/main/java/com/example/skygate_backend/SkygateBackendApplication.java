package com.example.skygate_backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SkygateBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(SkygateBackendApplication.class, args);
    }
}
