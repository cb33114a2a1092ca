package com.example.importer.model;

public record RowError(long rowNumber, String message) {}
