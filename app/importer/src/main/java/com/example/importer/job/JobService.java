/*
 * どこで: Importer ジョブ受付
 * 何を: 取込/一括削除ジョブを登録してキューへ投入し、進捗と行エラーを参照させる
 * なぜ: HTTP 層からジョブ記録・初期スナップショット・タスク投入の順序を 1 箇所で保証するため
 */
package com.example.importer.job;

import com.example.common.TraceIds;
import com.example.importer.model.JobKind;
import com.example.importer.model.JobRecord;
import com.example.importer.model.JobStatus;
import com.example.importer.model.JobTask;
import com.example.importer.model.ProgressSnapshot;
import com.example.importer.model.RowError;
import com.example.importer.nats.JobTaskPublisher;
import com.example.importer.progress.JobProgressTracker;
import com.example.importer.progress.JobProgressTrackerFactory;
import com.example.importer.progress.ProgressStore;
import com.example.importer.repository.ImportRowErrorRepository;
import com.example.importer.repository.JobRepository;
import java.io.InputStream;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class JobService {

  private static final Logger logger = LoggerFactory.getLogger(JobService.class);
  static final int MAX_ROW_ERRORS = 1000;

  private final JobRepository jobRepository;
  private final JobProgressTrackerFactory trackerFactory;
  private final ProgressStore progressStore;
  private final UploadStorage uploadStorage;
  private final JobTaskPublisher taskPublisher;
  private final ImportRowErrorRepository rowErrorRepository;
  private final Clock clock;

  public JobRecord startImport(String fileName, InputStream content) {
    final JobRecord job = register(JobKind.IMPORT, fileName);
    final JobProgressTracker tracker = trackerFactory.create(job.jobId(), job.kind());
    tracker.transition(JobStatus.UPLOADING, "storing_file");
    final Path stored;
    try {
      stored = uploadStorage.store(job.jobId(), content);
    } catch (RuntimeException ex) {
      tracker.fail("Upload failed: " + ex.getMessage());
      throw ex;
    }
    tracker.transition(JobStatus.UPLOADING, "stored");
    enqueue(job, tracker, stored.toString());
    return job;
  }

  public JobRecord startBulkDelete() {
    final JobRecord job = register(JobKind.BULK_DELETE, null);
    final JobProgressTracker tracker = trackerFactory.create(job.jobId(), job.kind());
    enqueue(job, tracker, null);
    return job;
  }

  /** @throws JobNotFoundException ジョブが無いかスナップショットが失効している場合 */
  public ProgressSnapshot snapshot(UUID jobId) {
    return progressStore.getProgress(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
  }

  public List<RowError> rowErrors(UUID jobId, int limit) {
    if (jobRepository.findById(jobId).isEmpty()) {
      throw new JobNotFoundException(jobId);
    }
    return rowErrorRepository.findByJobId(jobId, Math.max(1, Math.min(limit, MAX_ROW_ERRORS)));
  }

  private JobRecord register(JobKind kind, String sourceName) {
    final JobRecord job = new JobRecord(UUID.randomUUID(), kind, sourceName, Instant.now(clock));
    jobRepository.insert(job);
    return job;
  }

  private void enqueue(JobRecord job, JobProgressTracker tracker, String sourcePath) {
    final JobTask task =
        new JobTask(
            job.jobId(),
            job.kind(),
            sourcePath,
            job.sourceName(),
            Instant.now(clock),
            TraceIds.currentOrNew());
    try {
      taskPublisher.publish(task);
    } catch (RuntimeException ex) {
      // キューに載らなかったジョブは誰も処理しないため、この場で終端させる
      uploadStorage.release(sourcePath);
      tracker.fail("Failed to enqueue job: " + ex.getMessage());
      logger.error("failed to enqueue job jobId={} kind={}", job.jobId(), job.kind(), ex);
      throw ex;
    }
    logger.info(
        "job enqueued jobId={} kind={} sourceName={}", job.jobId(), job.kind(), job.sourceName());
  }
}
