package com.example.importer.model;

import java.time.Instant;
import java.util.UUID;

public record JobRecord(UUID jobId, JobKind kind, String sourceName, Instant createdAt) {}
