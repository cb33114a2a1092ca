package com.example.importer.engine;

import com.example.importer.model.JobKind;
import com.example.importer.model.JobTask;
import com.example.importer.progress.JobProgressTracker;

public interface JobEngine {

  JobKind kind();

  /**
   * タスクを最後まで実行し DONE を記録する。途中から再実行されても同じ結果になること。
   */
  void run(JobTask task, JobProgressTracker tracker, BatchCheckpoint checkpoint);
}
