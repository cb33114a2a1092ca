package com.example.importer.model;

import java.time.Instant;

public record ProductRecord(
    long id,
    String sku,
    String name,
    String description,
    boolean active,
    Instant createdAt,
    Instant updatedAt) {}
