package com.example.neonomaly.common.types;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

// A monitored unit owned by a single caller, e.g. "checkout-api"
@Value
@Builder
public class Service {
    String id;
    String name;
    String description;
    String ownerId;
    Instant createdAt;
}
