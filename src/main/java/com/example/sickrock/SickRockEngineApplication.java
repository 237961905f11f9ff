package com.example.sickrock;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SickRockEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(SickRockEngineApplication.class, args);
    }
}
