package com.example.importer.model;

import java.util.Locale;

public enum JobStatus {
  QUEUED,
  UPLOADING,
  PARSING,
  IMPORTING,
  PREPARING,
  DELETING,
  DONE,
  FAILED;

  public boolean isTerminal() {
    return this == DONE || this == FAILED;
  }

  /** 進捗ストアと API で使う小文字表記。 */
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static JobStatus fromValue(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("job status is required");
    }
    return valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
