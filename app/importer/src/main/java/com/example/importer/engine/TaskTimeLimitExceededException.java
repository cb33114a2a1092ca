package com.example.importer.engine;

public class TaskTimeLimitExceededException extends JobPermanentException {

  private static final long serialVersionUID = 1L;

  public TaskTimeLimitExceededException(String message) {
    super(message);
  }
}
