package com.example.importer.worker;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.importer.job.UploadStorage;
import com.example.importer.metrics.ImporterMetrics;
import com.example.importer.model.JobKind;
import com.example.importer.model.JobQueue;
import com.example.importer.model.JobStatus;
import com.example.importer.model.JobTask;
import com.example.importer.model.ProgressSnapshot;
import com.example.importer.model.WebhookEventType;
import com.example.importer.nats.JobTaskPublisher;
import com.example.importer.progress.InMemoryProgressStore;
import com.example.importer.progress.JobProgressTracker;
import com.example.importer.progress.JobProgressTrackerFactory;
import com.example.importer.repository.JobTaskDlqRepository;
import com.example.importer.support.TestFixtures;
import com.example.importer.webhook.WebhookEventPublisher;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class JobOutcomeServiceTest {

  private static final Instant NOW = Instant.parse("2026-01-12T00:00:00Z");
  private static final UUID JOB_ID = UUID.fromString("00000000-0000-0000-0000-0000000000dd");
  private static final JobTask IMPORT_TASK =
      new JobTask(JOB_ID, JobKind.IMPORT, "/tmp/uploads/job.csv", "products.csv", NOW, "trace-1");
  private static final JobTask DELETE_TASK =
      new JobTask(JOB_ID, JobKind.BULK_DELETE, null, null, NOW, "trace-1");

  @Mock private JobTaskDlqRepository dlqRepository;
  @Mock private JobTaskPublisher taskPublisher;
  @Mock private WebhookEventPublisher webhookEventPublisher;
  @Mock private UploadStorage uploadStorage;

  private InMemoryProgressStore store;
  private JobProgressTrackerFactory trackerFactory;
  private JobOutcomeService service;

  @BeforeEach
  void setUp() {
    final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    store = new InMemoryProgressStore(clock);
    trackerFactory = new JobProgressTrackerFactory(store, TestFixtures.progressProperties(), clock);
    service =
        new JobOutcomeService(
            trackerFactory,
            dlqRepository,
            taskPublisher,
            webhookEventPublisher,
            uploadStorage,
            TestFixtures.queueProperties(),
            TestFixtures.workerProperties(),
            new ImporterMetrics(new SimpleMeterRegistry()),
            TestFixtures.objectMapper(),
            clock);
  }

  @Test
  @SuppressWarnings("unchecked")
  void completedImportReleasesFileAndPublishesEvent() {
    final ProgressSnapshot snapshot =
        new ProgressSnapshot(JobStatus.DONE, "completed", 3L, 3L, null, 1L, NOW);

    service.completed(IMPORT_TASK, snapshot);

    verify(uploadStorage).release("/tmp/uploads/job.csv");
    final ArgumentCaptor<Map<String, Object>> data = ArgumentCaptor.forClass(Map.class);
    verify(webhookEventPublisher).publish(eq(WebhookEventType.IMPORT_COMPLETED), data.capture());
    assertThat(data.getValue())
        .containsEntry("job_id", JOB_ID.toString())
        .containsEntry("status", "done")
        .containsEntry("processed_rows", 3L)
        .containsEntry("total_rows", 3L);
  }

  @Test
  @SuppressWarnings("unchecked")
  void completedBulkDeletePublishesDeletedCount() {
    final ProgressSnapshot snapshot =
        new ProgressSnapshot(JobStatus.DONE, "completed", 7L, 7L, null, 0L, NOW);

    service.completed(DELETE_TASK, snapshot);

    final ArgumentCaptor<Map<String, Object>> data = ArgumentCaptor.forClass(Map.class);
    verify(webhookEventPublisher).publish(eq(WebhookEventType.PRODUCT_BULK_DELETED), data.capture());
    assertThat(data.getValue()).containsEntry("deleted_count", 7L).containsEntry("total_products", 7L);
    verify(uploadStorage, never()).release(anyString());
  }

  @Test
  void failedIsRecordedOnceAndPublishesImportFailed() {
    final JobProgressTracker tracker = trackerFactory.create(JOB_ID, JobKind.IMPORT);

    service.failed(IMPORT_TASK, tracker, "JobPayloadException: CSV file not found");
    service.failed(IMPORT_TASK, null, "second failure");

    assertThat(store.getProgress(JOB_ID))
        .get()
        .satisfies(
            snapshot -> {
              assertThat(snapshot.status()).isEqualTo(JobStatus.FAILED);
              assertThat(snapshot.errorMessage()).isEqualTo("JobPayloadException: CSV file not found");
            });
    verify(webhookEventPublisher, times(1)).publish(eq(WebhookEventType.IMPORT_FAILED), any());
    verify(uploadStorage, times(1)).release("/tmp/uploads/job.csv");
  }

  @Test
  void failedBulkDeleteHasNoWebhookEvent() {
    trackerFactory.create(JOB_ID, JobKind.BULK_DELETE);

    service.failed(DELETE_TASK, null, "IllegalStateException: db down");

    assertThat(store.getProgress(JOB_ID)).map(ProgressSnapshot::status).contains(JobStatus.FAILED);
    verify(webhookEventPublisher, never()).publish(any(), any());
  }

  @Test
  void longErrorMessagesAreTruncated() {
    final JobProgressTracker tracker = trackerFactory.create(JOB_ID, JobKind.IMPORT);

    service.failed(IMPORT_TASK, tracker, "x".repeat(5000));

    assertThat(tracker.current().errorMessage()).hasSize(1000);
  }

  @Test
  void deadLetteredWritesDlqThenPublishesThenFails() {
    final JobProgressTracker tracker = trackerFactory.create(JOB_ID, JobKind.IMPORT);
    when(dlqRepository.insert(
            eq(JOB_ID),
            eq(JobKind.IMPORT),
            anyString(),
            eq("IllegalStateException: db down"),
            eq(3),
            eq(42L),
            eq(NOW)))
        .thenReturn(true);

    service.deadLettered(IMPORT_TASK, tracker, "IllegalStateException: db down", 3, 42L);

    verify(taskPublisher)
        .publishDeadLetter(IMPORT_TASK, JobQueue.IMPORT, "IllegalStateException: db down");
    assertThat(tracker.current().status()).isEqualTo(JobStatus.FAILED);
  }

  @Test
  void deadLetterPublishFailureStillFailsJob() {
    final JobProgressTracker tracker = trackerFactory.create(JOB_ID, JobKind.IMPORT);
    when(dlqRepository.insert(any(), any(), anyString(), anyString(), anyInt(), any(), any()))
        .thenReturn(true);
    doThrow(new IllegalStateException("nats down"))
        .when(taskPublisher)
        .publishDeadLetter(any(), any(), anyString());

    service.deadLettered(IMPORT_TASK, tracker, "IllegalStateException: db down", 3, 42L);

    assertThat(tracker.current().status()).isEqualTo(JobStatus.FAILED);
  }

  @Test
  void duplicateDeadLetterIsNotRepublished() {
    trackerFactory.create(JOB_ID, JobKind.IMPORT);
    when(dlqRepository.insert(any(), any(), anyString(), anyString(), anyInt(), any(), any()))
        .thenReturn(false);

    service.deadLettered(IMPORT_TASK, null, "Max deliveries exceeded", 5, 9L);

    verify(taskPublisher, never()).publishDeadLetter(any(), any(), anyString());
    assertThat(store.getProgress(JOB_ID)).map(ProgressSnapshot::status).contains(JobStatus.FAILED);
  }
}
