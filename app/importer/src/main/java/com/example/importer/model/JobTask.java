package com.example.importer.model;

import java.time.Instant;
import java.util.UUID;

/** キューに載せるタスク。1 ジョブにつき 1 メッセージ。 */
public record JobTask(
    UUID jobId,
    JobKind kind,
    String sourcePath,
    String sourceName,
    Instant enqueuedAt,
    String traceId) {}
