package com.example.importer.api.response;

import java.util.UUID;

public record JobAcceptedResponse(UUID jobId, String status, String message) {}
