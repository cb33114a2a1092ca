/*
 * どこで: Importer ワーカー
 * 何を: キューから受け取ったタスク 1 件を実行し、結果に応じて ack / nak(遅延付き) / term する
 * なぜ: 終端が確定するまで ack せず、一時障害だけを上限付きで再配信させるため
 */
package com.example.importer.worker;

import com.example.common.TraceIds;
import com.example.importer.config.JobQueueProperties;
import com.example.importer.config.JobWorkerProperties;
import com.example.importer.engine.JobPermanentException;
import com.example.importer.metrics.ImporterMetrics;
import com.example.importer.model.IllegalJobTransitionException;
import com.example.importer.model.JobTask;
import com.example.importer.progress.JobProgressTracker;
import com.example.importer.progress.JobProgressTrackerFactory;
import com.example.importer.repository.JobRepository;
import com.example.importer.repository.RedisJobLockRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import io.nats.client.Message;
import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class JobTaskHandler {

  private static final Logger logger = LoggerFactory.getLogger(JobTaskHandler.class);
  private static final String MDC_JOB_ID = "job_id";

  private final ObjectMapper objectMapper;
  private final JobRepository jobRepository;
  private final JobProgressTrackerFactory trackerFactory;
  private final JobTaskExecutor executor;
  private final JobOutcomeService outcomeService;
  private final RedisJobLockRepository lockRepository;
  private final JobWorkerProperties properties;
  private final JobQueueProperties queueProperties;
  private final ImporterMetrics metrics;

  public void handle(Message message) {
    final JobTask task;
    try {
      task = objectMapper.readValue(message.getData(), JobTask.class);
    } catch (IOException ex) {
      // payload 破損は再配信で回復しないため恒久的に TERM する
      logger.warn("failed to parse job task payload subject={}", message.getSubject(), ex);
      termSilently(message);
      return;
    }
    if (task.jobId() == null || task.kind() == null) {
      logger.warn("job task without jobId or kind subject={}", message.getSubject());
      termSilently(message);
      return;
    }
    MDC.put(MDC_JOB_ID, task.jobId().toString());
    MDC.put(TraceIds.MDC_KEY, TraceIds.orNew(task.traceId()));
    try {
      process(message, task);
    } finally {
      MDC.remove(MDC_JOB_ID);
      MDC.remove(TraceIds.MDC_KEY);
    }
  }

  private void process(Message message, JobTask task) {
    JobProgressTracker tracker = null;
    try {
      if (jobRepository.findById(task.jobId()).isEmpty()) {
        logger.warn("job task for unknown job; dropping jobId={}", task.jobId());
        termSilently(message);
        return;
      }
      tracker = trackerFactory.open(task.jobId(), task.kind());
      if (tracker.isTerminal()) {
        // 前回実行で終端済み。再実行しない
        logger.info("job already terminal; ack redelivery status={}", tracker.current().status());
        ackSilently(message);
        return;
      }
      final JobRunOutcome outcome =
          executor.execute(task, tracker, () -> inProgressSilently(message));
      if (outcome == JobRunOutcome.LOCKED) {
        nakLocked(message, task);
        return;
      }
      outcomeService.completed(task, tracker.current());
      ackSilently(message);
    } catch (JobPermanentException | IllegalJobTransitionException ex) {
      logger.warn("permanent failure while running job kind={}", task.kind(), ex);
      failPermanently(message, task, tracker, describe(ex));
    } catch (RuntimeException ex) {
      handleTransientFailure(message, task, tracker, ex, executionAttempt(message, task));
    }
  }

  private void nakLocked(Message message, JobTask task) {
    Duration delay = properties.lockRetryDelay();
    try {
      lockRepository.recordLockedDelivery(task.jobId(), queueProperties.maxAge());
      // 前の実行者が落ちた場合はロックが切れる頃に再配信させる
      final Duration remaining = lockRepository.remainingTtl(task.jobId());
      if (remaining.compareTo(delay) > 0) {
        delay = remaining;
      }
    } catch (RuntimeException ex) {
      logger.warn("failed to record locked delivery jobId={}", task.jobId(), ex);
    }
    nakWithDelaySilently(message, delay);
  }

  /** ロック待ちで差し戻した配信を除いた、実際にエンジンを動かした試行回数。 */
  @VisibleForTesting
  int executionAttempt(Message message, JobTask task) {
    final int delivered = deliveredCount(message);
    try {
      final long locked = lockRepository.lockedDeliveries(task.jobId());
      return (int) Math.max(1L, delivered - locked);
    } catch (RuntimeException ex) {
      logger.warn("failed to read locked deliveries; using delivered count", ex);
      return delivered;
    }
  }

  private void failPermanently(
      Message message, JobTask task, JobProgressTracker tracker, String error) {
    try {
      outcomeService.failed(task, tracker, error);
    } catch (RuntimeException ex) {
      // FAILED を書けなくても再実行で結果は変わらないため TERM する
      logger.error("failed to record job failure jobId={}", task.jobId(), ex);
    }
    termSilently(message);
  }

  @VisibleForTesting
  void handleTransientFailure(
      Message message, JobTask task, JobProgressTracker tracker, RuntimeException ex, int attempt) {
    if (attempt < properties.maxAttempts()) {
      final Duration backoff = computeBackoffDuration(attempt);
      metrics.recordJobOutcome(task.kind(), "retry");
      logger.warn(
          "temporary failure while running job attempt={} maxAttempts={} retryIn={}",
          attempt,
          properties.maxAttempts(),
          backoff,
          ex);
      nakWithDelaySilently(message, backoff);
      return;
    }
    try {
      outcomeService.deadLettered(task, tracker, describe(ex), attempt, streamSequence(message));
      logger.warn("job moved to DLQ after {} attempts", attempt, ex);
      termSilently(message);
    } catch (RuntimeException dlqFailure) {
      // DLQ に残せなかった場合は再配信に倒してデータロスを避ける
      logger.error("failed to dead-letter job; redelivering", dlqFailure);
      nakWithDelaySilently(message, computeBackoffDuration(attempt));
    }
  }

  @VisibleForTesting
  Duration computeBackoffDuration(int attempt) {
    double baseMillis = properties.backoffBase().toMillis();
    double exp = baseMillis * Math.pow(properties.backoffExponentBase(), (attempt - 1));
    double capped = Math.min(exp, properties.backoffMax().toMillis());
    double jitterMin = properties.backoffJitterMin();
    double jitterMax = properties.backoffJitterMax();
    double jitter = jitterMin + ThreadLocalRandom.current().nextDouble() * (jitterMax - jitterMin);
    long backoffMillis = (long) Math.ceil(capped * jitter);
    long minMillis = properties.backoffMin().toMillis();
    return Duration.ofMillis(Math.max(minMillis, backoffMillis));
  }

  static String describe(RuntimeException ex) {
    final String message = ex.getMessage();
    return ex.getClass().getSimpleName() + ": " + (message == null ? "" : message);
  }

  private int deliveredCount(Message message) {
    try {
      return (int) Math.min(Integer.MAX_VALUE, message.metaData().deliveredCount());
    } catch (IllegalStateException ex) {
      // JetStream 以外のメッセージは初回扱い
      return 1;
    }
  }

  private Long streamSequence(Message message) {
    try {
      return message.metaData().streamSequence();
    } catch (IllegalStateException ex) {
      return null;
    }
  }

  private void inProgressSilently(Message message) {
    try {
      // ack-wait を延長し、処理中のタスクが再配信されないようにする
      message.inProgress();
    } catch (IllegalStateException ex) {
      logger.warn("failed to extend ack deadline", ex);
    }
  }

  private void ackSilently(Message message) {
    try {
      message.ack();
    } catch (IllegalStateException ex) {
      logger.warn("failed to ack job task", ex);
    }
  }

  private void nakWithDelaySilently(Message message, Duration delay) {
    try {
      message.nakWithDelay(delay);
    } catch (IllegalStateException ex) {
      logger.warn("failed to nack job task", ex);
    }
  }

  private void termSilently(Message message) {
    try {
      message.term();
    } catch (IllegalStateException ex) {
      logger.warn("failed to term job task", ex);
    }
  }
}
