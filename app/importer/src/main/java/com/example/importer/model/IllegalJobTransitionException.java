package com.example.importer.model;

public class IllegalJobTransitionException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  private final JobStatus from;
  private final JobStatus to;

  public IllegalJobTransitionException(JobKind kind, JobStatus from, JobStatus to) {
    super("illegal job transition kind=" + kind.value() + " from=" + from + " to=" + to);
    this.from = from;
    this.to = to;
  }

  public JobStatus from() {
    return from;
  }

  public JobStatus to() {
    return to;
  }
}
