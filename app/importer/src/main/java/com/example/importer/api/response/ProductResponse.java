package com.example.importer.api.response;

import com.example.importer.model.ProductRecord;
import java.time.Instant;

public record ProductResponse(
    long id,
    String sku,
    String name,
    String description,
    boolean active,
    Instant createdAt,
    Instant updatedAt) {

  public static ProductResponse from(ProductRecord record) {
    return new ProductResponse(
        record.id(),
        record.sku(),
        record.name(),
        record.description(),
        record.active(),
        record.createdAt(),
        record.updatedAt());
  }
}
