package com.example.importer.api.request;

import jakarta.validation.constraints.Size;

/** 省略した項目は現在値を維持する。 */
public record ProductUpdateRequest(
    @Size(max = 255) String sku, @Size(max = 255) String name, String description, Boolean active) {}
