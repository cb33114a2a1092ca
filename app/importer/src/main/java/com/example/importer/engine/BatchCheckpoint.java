package com.example.importer.engine;

/**
 * バッチのコミット後に呼ぶ。キューの ack 期限を延長し、時間制限を超えていれば
 * {@link TaskTimeLimitExceededException} を投げる。
 */
@FunctionalInterface
public interface BatchCheckpoint {

  BatchCheckpoint NONE = () -> {};

  void afterBatch();
}
