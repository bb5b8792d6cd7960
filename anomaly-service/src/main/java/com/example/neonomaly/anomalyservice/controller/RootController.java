package com.example.neonomaly.anomalyservice.controller;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Map;

@RestController
public class RootController {

    @GetMapping("/")
    public Mono<Map<String, String>> root() {
        return Mono.just(Map.of("message", "Welcome to Neonomaly API"));
    }

    @GetMapping("/health")
    public Mono<Map<String, String>> health() {
        return Mono.just(Map.of("status", "healthy"));
    }
}
