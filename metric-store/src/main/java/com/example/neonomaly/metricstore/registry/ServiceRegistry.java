package com.example.neonomaly.metricstore.registry;

import com.example.neonomaly.common.types.Service;
import com.example.neonomaly.metricstore.exception.ConflictException;
import com.example.neonomaly.metricstore.exception.NotFoundException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Services keyed by id and scoped to their owner. Names are unique per owner.
 */
@Slf4j
public class ServiceRegistry {

    private final ConcurrentHashMap<String, Service> servicesById = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, OwnerServices> servicesByOwner = new ConcurrentHashMap<>();
    private final Clock clock;

    public ServiceRegistry(Clock clock) {
        this.clock = clock;
    }

    public Service register(String ownerId, String name, String description) {
        Names.requireValid(name, "Service");
        OwnerServices owned = servicesByOwner.computeIfAbsent(ownerId, id -> new OwnerServices());

        synchronized (owned) {
            if (owned.byName.containsKey(name)) {
                throw new ConflictException("Service with this name already exists: " + name);
            }
            Service service = Service.builder()
                    .id(UUID.randomUUID().toString())
                    .name(name)
                    .description(description != null ? description : "")
                    .ownerId(ownerId)
                    .createdAt(clock.instant())
                    .build();
            owned.byName.put(name, service);
            owned.inOrder.add(service);
            servicesById.put(service.getId(), service);

            log.info("Registered service {} ({}) for owner {}", service.getName(), service.getId(), ownerId);
            return service;
        }
    }

    /**
     * Services of the owner, most recently created first.
     */
    public List<Service> list(String ownerId) {
        OwnerServices owned = servicesByOwner.get(ownerId);
        if (owned == null) {
            return List.of();
        }
        List<Service> services;
        synchronized (owned) {
            services = new ArrayList<>(owned.inOrder);
        }
        Collections.reverse(services);
        services.sort(Comparator.comparing(Service::getCreatedAt).reversed());
        return services;
    }

    public Optional<Service> find(String ownerId, String serviceId) {
        Service service = servicesById.get(serviceId);
        if (service == null || !service.getOwnerId().equals(ownerId)) {
            return Optional.empty();
        }
        return Optional.of(service);
    }

    public Service get(String ownerId, String serviceId) {
        return find(ownerId, serviceId).orElseThrow(() -> NotFoundException.service(serviceId));
    }

    private static final class OwnerServices {
        private final Map<String, Service> byName = new HashMap<>();
        private final List<Service> inOrder = new ArrayList<>();
    }
}
