package com.example.neonomaly.anomalyservice.controller;

import com.example.neonomaly.anomalyservice.model.ServiceCreateRequest;
import com.example.neonomaly.anomalyservice.model.ServiceResponse;
import com.example.neonomaly.metricstore.registry.ServiceRegistry;
import jakarta.validation.Valid;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/services")
public class ServiceController {

    private final ServiceRegistry serviceRegistry;
    private final String ownerId;

    public ServiceController(ServiceRegistry serviceRegistry, @Value("${neonomaly.owner-id:1}") String ownerId) {
        this.serviceRegistry = serviceRegistry;
        this.ownerId = ownerId;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<ServiceResponse> createService(@Valid @RequestBody ServiceCreateRequest request) {
        return Mono.fromCallable(() -> serviceRegistry.register(ownerId, request.getName(), request.getDescription()))
                .map(ServiceResponse::from);
    }

    @GetMapping
    public Flux<ServiceResponse> listServices() {
        return Flux.defer(() -> Flux.fromIterable(serviceRegistry.list(ownerId)))
                .map(ServiceResponse::from);
    }

    @GetMapping("/{serviceId}")
    public Mono<ServiceResponse> getService(@PathVariable String serviceId) {
        return Mono.fromCallable(() -> serviceRegistry.get(ownerId, serviceId))
                .map(ServiceResponse::from);
    }
}
