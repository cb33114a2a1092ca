/*
 * どこで: Importer NATS 基盤
 * 何を: NATS 無効時の publisher を提供する
 * なぜ: ローカルテストで NATS なしでも API とジョブ登録を起動可能にするため
 */
package com.example.importer.nats;

import com.example.importer.model.JobQueue;
import com.example.importer.model.JobTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "false")
public class NoopJobTaskPublisher implements JobTaskPublisher {

  private static final Logger logger = LoggerFactory.getLogger(NoopJobTaskPublisher.class);

  @Override
  public void publish(JobTask task) {
    // ワーカーへは届かない。ジョブは QUEUED/UPLOADING のまま TTL で消える
    logger.warn("nats disabled; job task not dispatched jobId={} kind={}", task.jobId(), task.kind());
  }

  @Override
  public void publishDeadLetter(JobTask task, JobQueue queue, String errorMessage) {
    logger.warn(
        "nats disabled; dead letter not published jobId={} queue={}", task.jobId(), queue.value());
  }
}
