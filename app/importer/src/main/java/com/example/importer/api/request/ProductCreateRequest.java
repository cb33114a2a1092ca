package com.example.importer.api.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ProductCreateRequest(
    @NotBlank(message = "sku is required") @Size(max = 255) String sku,
    @NotBlank(message = "name is required") @Size(max = 255) String name,
    String description,
    Boolean active) {}
