package com.example.importer.api.response;

import com.example.importer.model.ProgressSnapshot;
import java.time.Instant;
import java.util.UUID;

public record JobProgressResponse(
    UUID jobId,
    String status,
    String stage,
    Long totalRows,
    long processedRows,
    String errorMessage,
    long rowErrorCount,
    Instant updatedAt) {

  public static JobProgressResponse from(UUID jobId, ProgressSnapshot snapshot) {
    return new JobProgressResponse(
        jobId,
        snapshot.status().value(),
        snapshot.stage(),
        snapshot.totalRows(),
        snapshot.processedRows(),
        snapshot.errorMessage(),
        snapshot.rowErrorCount(),
        snapshot.updatedAt());
  }
}
