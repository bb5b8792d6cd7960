package com.example.neonomaly.anomalyservice;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AnomalyServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(AnomalyServiceApplication.class, args);
    }
}
