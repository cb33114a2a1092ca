/*
 * どこで: Importer ワーカー
 * 何を: ジョブ終端時の後処理(FAILED 記録、DLQ 退避、一時ファイル削除、Webhook イベント)をまとめる
 * なぜ: 成功・恒久失敗・リトライ枯渇・advisory の各経路で同じ終端処理を通すため
 */
package com.example.importer.worker;

import com.example.importer.config.JobQueueProperties;
import com.example.importer.config.JobWorkerProperties;
import com.example.importer.job.UploadStorage;
import com.example.importer.metrics.ImporterMetrics;
import com.example.importer.model.JobKind;
import com.example.importer.model.JobStatus;
import com.example.importer.model.JobTask;
import com.example.importer.model.ProgressSnapshot;
import com.example.importer.model.WebhookEventType;
import com.example.importer.nats.JobTaskPublisher;
import com.example.importer.progress.JobProgressTracker;
import com.example.importer.progress.JobProgressTrackerFactory;
import com.example.importer.repository.JobTaskDlqRepository;
import com.example.importer.webhook.WebhookEventPublisher;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class JobOutcomeService {

  private static final Logger logger = LoggerFactory.getLogger(JobOutcomeService.class);

  private final JobProgressTrackerFactory trackerFactory;
  private final JobTaskDlqRepository dlqRepository;
  private final JobTaskPublisher taskPublisher;
  private final WebhookEventPublisher webhookEventPublisher;
  private final UploadStorage uploadStorage;
  private final JobQueueProperties queueProperties;
  private final JobWorkerProperties properties;
  private final ImporterMetrics metrics;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  public void completed(JobTask task, ProgressSnapshot snapshot) {
    metrics.recordJobOutcome(task.kind(), "done");
    final Map<String, Object> data = new LinkedHashMap<>();
    data.put("job_id", task.jobId().toString());
    data.put("status", JobStatus.DONE.value());
    if (task.kind() == JobKind.IMPORT) {
      uploadStorage.release(task.sourcePath());
      data.put("processed_rows", snapshot.processedRows());
      data.put("total_rows", snapshot.totalRows());
      webhookEventPublisher.publish(WebhookEventType.IMPORT_COMPLETED, data);
    } else {
      data.put("deleted_count", snapshot.processedRows());
      data.put("total_products", snapshot.totalRows());
      webhookEventPublisher.publish(WebhookEventType.PRODUCT_BULK_DELETED, data);
    }
  }

  /**
   * FAILED を記録する。既に終端のジョブには何もしない。
   *
   * @param tracker 実行中の tracker。未取得なら null
   */
  public void failed(JobTask task, JobProgressTracker tracker, String errorMessage) {
    final String message = truncateError(errorMessage);
    final JobProgressTracker target =
        tracker != null ? tracker : trackerFactory.open(task.jobId(), task.kind());
    if (!target.fail(message)) {
      logger.info("job already terminal; failure not recorded jobId={}", task.jobId());
      return;
    }
    metrics.recordJobOutcome(task.kind(), "failed");
    logger.warn("job failed jobId={} kind={} error={}", task.jobId(), task.kind(), message);
    if (task.kind() == JobKind.IMPORT) {
      uploadStorage.release(task.sourcePath());
      final Map<String, Object> data = new LinkedHashMap<>();
      data.put("job_id", task.jobId().toString());
      data.put("status", JobStatus.FAILED.value());
      data.put("error_message", message);
      data.put("processed_rows", target.current().processedRows());
      webhookEventPublisher.publish(WebhookEventType.IMPORT_FAILED, data);
    }
  }

  /**
   * DLQ へ退避してから FAILED を記録する。DLQ 登録に失敗した場合は例外をそのまま投げる。
   */
  public void deadLettered(
      JobTask task,
      JobProgressTracker tracker,
      String errorMessage,
      int deliveredCount,
      Long streamSeq) {
    final String message = truncateError(errorMessage);
    final boolean inserted =
        dlqRepository.insert(
            task.jobId(),
            task.kind(),
            toJson(task),
            message,
            deliveredCount,
            streamSeq,
            Instant.now(clock));
    if (inserted) {
      metrics.recordJobOutcome(task.kind(), "dead_lettered");
      try {
        taskPublisher.publishDeadLetter(task, queueProperties.route(task.kind()), message);
      } catch (RuntimeException ex) {
        // DLQ テーブルが正。dead subject は運用向けの複製
        logger.warn("failed to publish dead letter jobId={}", task.jobId(), ex);
        metrics.recordDependencyError("dead_letter_publish");
      }
    }
    failed(task, tracker, message);
  }

  private String toJson(JobTask task) {
    try {
      return objectMapper.writeValueAsString(task);
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("job task is not serializable jobId=" + task.jobId(), ex);
    }
  }

  private String truncateError(String message) {
    if (message == null) {
      return "unknown error";
    }
    final int maxLength = properties.errorMessageMaxLength();
    if (message.length() <= maxLength) {
      return message;
    }
    return message.substring(0, maxLength);
  }
}
