package com.example.importer.progress;

@FunctionalInterface
public interface ProgressSubscription extends AutoCloseable {

  @Override
  void close();
}
