package com.example.neonomaly.anomalyservice.model;

import com.example.neonomaly.common.types.Service;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class ServiceResponse {
    String id;
    String name;
    String description;
    Instant createdAt;
    String ownerId;

    public static ServiceResponse from(Service service) {
        return ServiceResponse.builder()
                .id(service.getId())
                .name(service.getName())
                .description(service.getDescription())
                .createdAt(service.getCreatedAt())
                .ownerId(service.getOwnerId())
                .build();
    }
}
