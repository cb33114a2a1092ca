/*
 * どこで: Importer ドメインモデル
 * 何を: 進捗ストアに保存するジョブ進捗のスナップショット
 * なぜ: 遅れて接続した購読者が最新状態を 1 回の読み取りで復元できるようにするため
 */
package com.example.importer.model;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

public record ProgressSnapshot(
    JobStatus status,
    String stage,
    Long totalRows,
    long processedRows,
    String errorMessage,
    long rowErrorCount,
    Instant updatedAt) {

  public static ProgressSnapshot initial(String stage) {
    return new ProgressSnapshot(JobStatus.QUEUED, stage, null, 0L, null, 0L, null);
  }

  public boolean isTerminal() {
    return status.isTerminal();
  }

  public ProgressSnapshot withStatus(JobStatus nextStatus, String nextStage) {
    return new ProgressSnapshot(
        nextStatus, nextStage, totalRows, processedRows, errorMessage, rowErrorCount, updatedAt);
  }

  public ProgressSnapshot withStage(String nextStage) {
    return withStatus(status, nextStage);
  }

  public ProgressSnapshot withTotalRows(long total) {
    return new ProgressSnapshot(
        status, stage, total, Math.min(processedRows, total), errorMessage, rowErrorCount, updatedAt);
  }

  public ProgressSnapshot withProcessedRows(long processed, String nextStage) {
    return new ProgressSnapshot(
        status, nextStage, totalRows, processed, errorMessage, rowErrorCount, updatedAt);
  }

  public ProgressSnapshot withRowErrorCount(long count) {
    return new ProgressSnapshot(
        status, stage, totalRows, processedRows, errorMessage, count, updatedAt);
  }

  public ProgressSnapshot withFailure(String message) {
    return new ProgressSnapshot(
        JobStatus.FAILED, "failed", totalRows, processedRows, message, rowErrorCount, updatedAt);
  }

  public ProgressSnapshot withUpdatedAt(Instant instant) {
    return new ProgressSnapshot(
        status, stage, totalRows, processedRows, errorMessage, rowErrorCount, instant);
  }

  /** pub/sub と SSE で配信する JSON 形状。 */
  public Map<String, Object> toPayload(UUID jobId) {
    final Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("job_id", jobId.toString());
    payload.put("status", status.value());
    payload.put("stage", stage);
    payload.put("total_rows", totalRows);
    payload.put("processed_rows", processedRows);
    payload.put("error_message", errorMessage);
    payload.put("row_error_count", rowErrorCount);
    if (updatedAt != null) {
      payload.put("updated_at", updatedAt.toString());
    }
    return payload;
  }
}
