package com.example.importer.engine;

import java.util.List;

public class CsvHeaderValidationException extends JobPermanentException {

  private static final long serialVersionUID = 1L;

  private final List<String> missingHeaders;

  public CsvHeaderValidationException(List<String> missingHeaders) {
    super("Missing required columns: " + String.join(", ", missingHeaders));
    this.missingHeaders = List.copyOf(missingHeaders);
  }

  public CsvHeaderValidationException(String message) {
    super(message);
    this.missingHeaders = List.of();
  }

  public List<String> missingHeaders() {
    return missingHeaders;
  }
}
