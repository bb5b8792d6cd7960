package com.example.neonomaly.anomalyservice.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class ServiceCreateRequest {
    @NotBlank
    @Size(min = 1, max = 100)
    private String name;
    private String description;
}
