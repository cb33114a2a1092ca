/*
 * どこで: Importer ワーカー
 * 何を: ジョブロックを取り、エンジンを別スレッドでソフト/ハード時間制限付きで実行する
 * なぜ: 同一ジョブの並行実行を防ぎ、止まらないタスクがワーカーを占有し続けないようにするため
 */
package com.example.importer.worker;

import com.example.importer.config.JobQueueProperties;
import com.example.importer.config.JobWorkerProperties;
import com.example.importer.engine.BatchCheckpoint;
import com.example.importer.engine.JobEngine;
import com.example.importer.engine.JobPayloadException;
import com.example.importer.engine.TaskTimeLimitExceededException;
import com.example.importer.model.JobKind;
import com.example.importer.model.JobTask;
import com.example.importer.progress.JobProgressTracker;
import com.example.importer.repository.RedisJobLockRepository;
import com.google.common.annotations.VisibleForTesting;
import jakarta.annotation.PreDestroy;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

@Component
public class JobTaskExecutor {

  private static final Logger logger = LoggerFactory.getLogger(JobTaskExecutor.class);
  private static final String HOSTNAME_ENV = "HOSTNAME";
  private static final String DEFAULT_HOSTNAME = "unknown-host";

  private final Map<JobKind, JobEngine> engines;
  private final RedisJobLockRepository lockRepository;
  private final JobWorkerProperties properties;
  private final Duration lockTtl;
  private final Clock clock;
  private final ExecutorService executorService;
  private final String workerId;

  public JobTaskExecutor(
      List<JobEngine> engines,
      RedisJobLockRepository lockRepository,
      JobWorkerProperties properties,
      JobQueueProperties queueProperties,
      Clock clock) {
    this.engines = new EnumMap<>(JobKind.class);
    for (JobEngine engine : engines) {
      if (this.engines.put(engine.kind(), engine) != null) {
        throw new IllegalStateException("duplicate job engine kind=" + engine.kind());
      }
    }
    this.lockRepository = lockRepository;
    this.properties = properties;
    // ロックは ack-wait と同じ寿命にし、バッチごとに in-progress と一緒に延長する。
    // クラッシュ時は再配信とほぼ同時にロックも切れる
    this.lockTtl = queueProperties.ackWait();
    this.clock = clock;
    final AtomicInteger threadCounter = new AtomicInteger();
    this.executorService =
        Executors.newCachedThreadPool(
            runnable -> {
              final Thread thread =
                  new Thread(runnable, "job-engine-" + threadCounter.incrementAndGet());
              thread.setDaemon(true);
              return thread;
            });
    this.workerId = resolveWorkerId();
  }

  public JobRunOutcome execute(JobTask task, JobProgressTracker tracker, Runnable heartbeat) {
    final JobEngine engine = engines.get(task.kind());
    if (engine == null) {
      throw new JobPayloadException("no engine for job kind=" + task.kind());
    }
    if (!lockRepository.tryAcquire(task.jobId(), workerId, lockTtl)) {
      logger.info("job is locked by another worker jobId={}", task.jobId());
      return JobRunOutcome.LOCKED;
    }
    try {
      runWithTimeLimits(engine, task, tracker, heartbeat);
      return JobRunOutcome.COMPLETED;
    } finally {
      releaseLock(task);
    }
  }

  private void runWithTimeLimits(
      JobEngine engine, JobTask task, JobProgressTracker tracker, Runnable heartbeat) {
    final Instant softDeadline = Instant.now(clock).plus(properties.softTimeLimit());
    final BatchCheckpoint checkpoint =
        () -> {
          if (Thread.currentThread().isInterrupted()) {
            throw new TaskTimeLimitExceededException(
                "Hard time limit exceeded after " + properties.hardTimeLimit());
          }
          if (!Instant.now(clock).isBefore(softDeadline)) {
            throw new TaskTimeLimitExceededException(
                "Soft time limit exceeded after " + properties.softTimeLimit());
          }
          renewLock(task);
          heartbeat.run();
        };
    final Map<String, String> mdc = MDC.getCopyOfContextMap();
    final Future<?> future =
        executorService.submit(
            () -> {
              if (mdc != null) {
                MDC.setContextMap(mdc);
              }
              try {
                engine.run(task, tracker, checkpoint);
              } finally {
                MDC.clear();
              }
            });
    try {
      future.get(properties.hardTimeLimit().toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException ex) {
      future.cancel(true);
      throw new TaskTimeLimitExceededException(
          "Hard time limit exceeded after " + properties.hardTimeLimit());
    } catch (ExecutionException ex) {
      final Throwable cause = ex.getCause();
      if (cause instanceof RuntimeException runtimeException) {
        throw runtimeException;
      }
      if (cause instanceof Error error) {
        throw error;
      }
      throw new IllegalStateException("job engine failed jobId=" + task.jobId(), cause);
    } catch (InterruptedException ex) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw new IllegalStateException("interrupted while waiting for job jobId=" + task.jobId(), ex);
    }
  }

  private void renewLock(JobTask task) {
    try {
      if (!lockRepository.renew(task.jobId(), workerId, lockTtl)) {
        logger.warn("job lock was lost while running jobId={}", task.jobId());
      }
    } catch (RuntimeException ex) {
      // 書き込みは冪等なので、延長に失敗しても処理は続ける
      logger.warn("failed to renew job lock jobId={}", task.jobId(), ex);
    }
  }

  private void releaseLock(JobTask task) {
    try {
      lockRepository.release(task.jobId(), workerId);
    } catch (RuntimeException ex) {
      // ロックは TTL で自然解放される
      logger.warn("failed to release job lock jobId={}", task.jobId(), ex);
    }
  }

  @PreDestroy
  public void shutdown() {
    executorService.shutdownNow();
  }

  @VisibleForTesting
  Duration lockTtl() {
    return lockTtl;
  }

  @VisibleForTesting
  String workerId() {
    return workerId;
  }

  private static String resolveWorkerId() {
    return resolveHostname() + ":" + ProcessHandle.current().pid();
  }

  private static String resolveHostname() {
    final String env = System.getenv(HOSTNAME_ENV);
    if (env != null && !env.isBlank()) {
      return env;
    }
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException | SecurityException ex) {
      logger.warn("failed to resolve hostname; fallback to {}", DEFAULT_HOSTNAME, ex);
      return DEFAULT_HOSTNAME;
    }
  }
}
