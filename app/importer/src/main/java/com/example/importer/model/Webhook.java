package com.example.importer.model;

import java.time.Instant;
import java.util.List;

public record Webhook(
    long id, String url, List<String> events, boolean enabled, Instant createdAt, Instant updatedAt) {

  public Webhook {
    events = events == null ? List.of() : List.copyOf(events);
  }
}
