package com.example.importer.model;

import java.util.Optional;

public enum WebhookEventType {
  PRODUCT_CREATED("product.created"),
  PRODUCT_UPDATED("product.updated"),
  PRODUCT_DELETED("product.deleted"),
  PRODUCT_BULK_DELETED("product.bulk_deleted"),
  IMPORT_COMPLETED("import.completed"),
  IMPORT_FAILED("import.failed");

  private final String value;

  WebhookEventType(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  public static Optional<WebhookEventType> fromValue(String value) {
    for (WebhookEventType type : values()) {
      if (type.value.equals(value)) {
        return Optional.of(type);
      }
    }
    return Optional.empty();
  }
}
