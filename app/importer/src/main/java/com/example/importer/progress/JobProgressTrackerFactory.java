package com.example.importer.progress;

import com.example.importer.config.ProgressProperties;
import com.example.importer.model.JobKind;
import com.example.importer.model.ProgressSnapshot;
import java.time.Clock;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class JobProgressTrackerFactory {

  static final String QUEUED_STAGE = "queued";

  private final ProgressStore progressStore;
  private final ProgressProperties properties;
  private final Clock clock;

  /** 新規ジョブの QUEUED スナップショットを書き込んで tracker を返す。 */
  public JobProgressTracker create(UUID jobId, JobKind kind) {
    final JobProgressTracker tracker = newTracker(jobId, kind, ProgressSnapshot.initial(QUEUED_STAGE));
    tracker.start();
    return tracker;
  }

  /** 保存済みスナップショットから再開する。TTL 切れの場合は QUEUED から始める。 */
  public JobProgressTracker open(UUID jobId, JobKind kind) {
    final ProgressSnapshot snapshot =
        progressStore
            .getProgress(jobId)
            .orElseGet(() -> ProgressSnapshot.initial(QUEUED_STAGE));
    return newTracker(jobId, kind, snapshot);
  }

  private JobProgressTracker newTracker(UUID jobId, JobKind kind, ProgressSnapshot snapshot) {
    return new JobProgressTracker(
        jobId, kind, snapshot, progressStore, clock, properties.publishInterval());
  }
}
