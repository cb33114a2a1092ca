package com.example.importer.webhook;

public class WebhookNotFoundException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public WebhookNotFoundException(long webhookId) {
    super("webhook not found id=" + webhookId);
  }
}
