package com.example.importer.job;

import java.util.UUID;

/** 未知のジョブ、または進捗 TTL が切れたジョブ(404)。 */
public class JobNotFoundException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public JobNotFoundException(UUID jobId) {
    super("Job " + jobId + " not found");
  }
}
