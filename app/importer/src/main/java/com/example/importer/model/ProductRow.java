package com.example.importer.model;

/** upsert 対象の 1 商品。sku は大文字小文字を区別しないキーとして扱う。 */
public record ProductRow(String sku, String name, String description, boolean active) {}
