package com.example.importer.nats;

import com.example.importer.model.JobQueue;
import com.example.importer.model.JobTask;

public interface JobTaskPublisher {

  /** ジョブ ID を重複排除キーとしてワークロードのキューへ投入する。 */
  void publish(JobTask task);

  /** リトライを使い切ったタスクを dead-letter subject へ退避する。 */
  void publishDeadLetter(JobTask task, JobQueue queue, String errorMessage);
}
