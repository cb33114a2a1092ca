package com.example.importer.engine;

/** 再実行しても結果が変わらない失敗。リトライを消費せずに即 FAILED とする。 */
public class JobPermanentException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public JobPermanentException(String message) {
    super(message);
  }

  public JobPermanentException(String message, Throwable cause) {
    super(message, cause);
  }
}
