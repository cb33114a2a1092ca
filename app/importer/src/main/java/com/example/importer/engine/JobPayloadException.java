package com.example.importer.engine;

/** タスク本文や入力ファイルが壊れている。 */
public class JobPayloadException extends JobPermanentException {

  private static final long serialVersionUID = 1L;

  public JobPayloadException(String message) {
    super(message);
  }

  public JobPayloadException(String message, Throwable cause) {
    super(message, cause);
  }
}
