package com.example.importer.api.request;

import java.util.List;

/** 省略した項目は現在値を維持する。 */
public record WebhookUpdateRequest(String url, List<String> events, Boolean enabled) {}
