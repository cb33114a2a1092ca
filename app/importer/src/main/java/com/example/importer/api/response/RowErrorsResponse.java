package com.example.importer.api.response;

import com.example.importer.model.RowError;
import java.util.List;
import java.util.UUID;

public record RowErrorsResponse(UUID jobId, List<RowError> errors) {

  public RowErrorsResponse {
    errors = List.copyOf(errors);
  }
}
