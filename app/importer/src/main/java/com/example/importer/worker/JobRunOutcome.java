package com.example.importer.worker;

public enum JobRunOutcome {
  COMPLETED,
  /** 同じジョブを別ワーカーが実行中。 */
  LOCKED
}
