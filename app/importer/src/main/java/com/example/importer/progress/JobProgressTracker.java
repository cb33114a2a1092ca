/*
 * どこで: Importer 進捗ストア
 * 何を: 1 ジョブ実行中の進捗を状態遷移表に従って保存し、間引きながら配信する
 * なぜ: 再配信時も状態を巻き戻さず、processed_rows を単調非減少に保つため
 */
package com.example.importer.progress;

import com.example.importer.model.JobKind;
import com.example.importer.model.JobStatus;
import com.example.importer.model.JobTransitions;
import com.example.importer.model.ProgressSnapshot;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class JobProgressTracker {

  private static final Logger logger = LoggerFactory.getLogger(JobProgressTracker.class);

  private final UUID jobId;
  private final JobKind kind;
  private final ProgressStore progressStore;
  private final Clock clock;
  private final Duration publishInterval;
  private ProgressSnapshot current;
  private Instant lastPublishedAt;

  JobProgressTracker(
      UUID jobId,
      JobKind kind,
      ProgressSnapshot initial,
      ProgressStore progressStore,
      Clock clock,
      Duration publishInterval) {
    this.jobId = jobId;
    this.kind = kind;
    this.current = initial;
    this.progressStore = progressStore;
    this.clock = clock;
    this.publishInterval = publishInterval;
  }

  public UUID jobId() {
    return jobId;
  }

  public JobKind kind() {
    return kind;
  }

  public synchronized ProgressSnapshot current() {
    return current;
  }

  public synchronized boolean isTerminal() {
    return current.isTerminal();
  }

  synchronized void start() {
    persist(current, true);
  }

  /**
   * 状態を前進させる。再配信で既に通過した状態への遷移は書き込まずに無視する。
   *
   * @throws com.example.importer.model.IllegalJobTransitionException 遷移表に無い遷移
   */
  public synchronized void transition(JobStatus next, String stage) {
    final JobStatus from = current.status();
    if (from == next && !from.isTerminal()) {
      persist(current.withStage(stage), false);
      return;
    }
    if (JobTransitions.isBehind(kind, from, next)) {
      logger.debug("skip stale transition jobId={} from={} to={}", jobId, from, next);
      return;
    }
    JobTransitions.check(kind, from, next);
    persist(current.withStatus(next, stage), true);
  }

  /** 総行数が確定したら記録する。前回試行で確定済みならその値を維持する。 */
  public synchronized void knownTotal(long totalRows) {
    if (current.isTerminal() || current.totalRows() != null) {
      return;
    }
    persist(current.withTotalRows(Math.max(0L, totalRows)), false);
  }

  public synchronized void advance(long processedRows, String stage) {
    if (current.isTerminal()) {
      return;
    }
    long capped = processedRows;
    if (current.totalRows() != null) {
      capped = Math.min(capped, current.totalRows());
    }
    persist(current.withProcessedRows(Math.max(current.processedRows(), capped), stage), false);
  }

  public synchronized void rowErrors(long rowErrorCount) {
    if (current.isTerminal() || rowErrorCount <= current.rowErrorCount()) {
      return;
    }
    // 次の advance でまとめて保存する
    current = current.withRowErrorCount(rowErrorCount);
  }

  public synchronized void complete(String stage) {
    transition(JobStatus.DONE, stage);
  }

  /**
   * FAILED を記録する。
   *
   * @return 今回の呼び出しで FAILED になった場合 true。既に終端なら false
   */
  public synchronized boolean fail(String errorMessage) {
    if (current.isTerminal()) {
      return false;
    }
    persist(current.withFailure(errorMessage), true);
    return true;
  }

  private void persist(ProgressSnapshot snapshot, boolean forcePublish) {
    final Instant updatedAt = progressStore.setProgress(jobId, snapshot);
    current = snapshot.withUpdatedAt(updatedAt);
    final Instant now = Instant.now(clock);
    if (forcePublish || current.isTerminal() || shouldPublish(now)) {
      publish(now);
    }
  }

  private boolean shouldPublish(Instant now) {
    return lastPublishedAt == null
        || Duration.between(lastPublishedAt, now).compareTo(publishInterval) >= 0;
  }

  private void publish(Instant now) {
    try {
      progressStore.publishUpdate(jobId, current.toPayload(jobId));
      lastPublishedAt = now;
    } catch (RuntimeException ex) {
      // 配信はベストエフォート。保存済みスナップショットが読者の正となる
      logger.warn("progress publish failed jobId={} status={}", jobId, current.status(), ex);
    }
  }
}
