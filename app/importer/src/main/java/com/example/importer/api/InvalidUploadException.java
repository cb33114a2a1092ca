package com.example.importer.api;

public class InvalidUploadException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public InvalidUploadException(String message) {
    super(message);
  }
}
