package com.example.importer.model;

public enum WebhookDeliveryStatus {
  PENDING,
  SUCCESS,
  FAILED
}
