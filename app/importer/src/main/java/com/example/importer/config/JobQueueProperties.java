/*
 * どこで: Importer アプリの設定バインド
 * 何を: ジョブキュー(JetStream stream / consumer)の設定を保持する
 * なぜ: メッセージ TTL、再配信猶予、prefetch 相当の並列度を環境で調整し起動時に検証するため
 */
package com.example.importer.config;

import com.example.importer.model.JobKind;
import com.example.importer.model.JobQueue;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.Duration;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "importer.queue")
@Validated
public record JobQueueProperties(
    @NotBlank String stream,
    @NotBlank String subjectPrefix,
    @NotNull Duration maxAge,
    @NotNull Duration duplicateWindow,
    @NotBlank String deadLetterStream,
    @NotNull Duration deadLetterMaxAge,
    @NotBlank String durablePrefix,
    @NotNull Duration ackWait,
    @NotNull @Positive Integer maxDeliver,
    @NotNull Duration fetchTimeout,
    @PositiveOrZero int importConcurrency,
    @PositiveOrZero int bulkDeleteConcurrency,
    @PositiveOrZero int defaultConcurrency,
    Map<JobKind, JobQueue> routes) {

  public JobQueueProperties {
    routes = routes == null ? Map.of() : Map.copyOf(routes);
  }

  /** 専用キューの無い種別は default キューへ流す。 */
  public JobQueue route(JobKind kind) {
    return routes.getOrDefault(kind, JobQueue.DEFAULT);
  }

  public String subject(JobQueue queue) {
    return subjectPrefix + "." + queue.value();
  }

  public String deadLetterSubject(JobQueue queue) {
    return subjectPrefix + ".dead." + queue.value();
  }

  public String durable(JobQueue queue) {
    return durablePrefix + "-" + queue.value();
  }

  public int concurrency(JobQueue queue) {
    return switch (queue) {
      case IMPORT -> importConcurrency;
      case BULK_DELETE -> bulkDeleteConcurrency;
      case DEFAULT -> defaultConcurrency;
    };
  }

  @AssertTrue(message = "importer.queue.max-age must be positive")
  public boolean isMaxAgePositive() {
    return isPositiveDuration(maxAge);
  }

  @AssertTrue(message = "importer.queue.ack-wait must be positive")
  public boolean isAckWaitPositive() {
    // ack-wait はバッチ間の in-progress 通知より長い必要がある
    return isPositiveDuration(ackWait);
  }

  @AssertTrue(message = "importer.queue.duplicate-window must be positive")
  public boolean isDuplicateWindowPositive() {
    return isPositiveDuration(duplicateWindow);
  }

  @AssertTrue(message = "importer.queue.fetch-timeout must be positive")
  public boolean isFetchTimeoutPositive() {
    return isPositiveDuration(fetchTimeout);
  }

  private boolean isPositiveDuration(Duration duration) {
    // null は @NotNull で検出する前提。
    return duration != null && !duration.isZero() && !duration.isNegative();
  }
}
