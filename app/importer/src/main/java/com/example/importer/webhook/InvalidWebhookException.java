package com.example.importer.webhook;

/** URL / 購読イベント / ページ指定が不正な場合に投げる。 */
public class InvalidWebhookException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public InvalidWebhookException(String message) {
    super(message);
  }
}
