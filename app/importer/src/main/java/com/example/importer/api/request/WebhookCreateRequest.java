package com.example.importer.api.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;

public record WebhookCreateRequest(
    @NotBlank(message = "url is required") String url,
    @NotEmpty(message = "Events list cannot be empty") List<String> events,
    Boolean enabled) {}
