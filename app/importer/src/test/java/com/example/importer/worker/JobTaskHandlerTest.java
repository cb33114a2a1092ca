package com.example.importer.worker;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.importer.engine.CsvHeaderValidationException;
import com.example.importer.metrics.ImporterMetrics;
import com.example.importer.model.JobKind;
import com.example.importer.model.JobRecord;
import com.example.importer.model.JobStatus;
import com.example.importer.model.JobTask;
import com.example.importer.model.ProgressSnapshot;
import com.example.importer.progress.InMemoryProgressStore;
import com.example.importer.progress.JobProgressTracker;
import com.example.importer.progress.JobProgressTrackerFactory;
import com.example.importer.repository.JobRepository;
import com.example.importer.repository.RedisJobLockRepository;
import com.example.importer.support.TestFixtures;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.nats.client.Message;
import io.nats.client.impl.NatsJetStreamMetaData;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class JobTaskHandlerTest {

  private static final Instant NOW = Instant.parse("2026-01-12T00:00:00Z");
  private static final UUID JOB_ID = UUID.fromString("00000000-0000-0000-0000-0000000000cc");
  private static final JobTask TASK =
      new JobTask(JOB_ID, JobKind.IMPORT, "/tmp/uploads/job.csv", "products.csv", NOW, "trace-1");

  @Mock private JobRepository jobRepository;
  @Mock private JobTaskExecutor executor;
  @Mock private JobOutcomeService outcomeService;
  @Mock private RedisJobLockRepository lockRepository;
  @Mock private Message message;
  @Mock private NatsJetStreamMetaData metaData;

  private final ObjectMapper objectMapper = TestFixtures.objectMapper();
  private InMemoryProgressStore store;
  private JobProgressTrackerFactory trackerFactory;
  private JobTaskHandler handler;

  @BeforeEach
  void setUp() {
    final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    store = new InMemoryProgressStore(clock);
    trackerFactory = new JobProgressTrackerFactory(store, TestFixtures.progressProperties(), clock);
    handler =
        new JobTaskHandler(
            objectMapper,
            jobRepository,
            trackerFactory,
            executor,
            outcomeService,
            lockRepository,
            TestFixtures.workerProperties(),
            TestFixtures.queueProperties(),
            new ImporterMetrics(new SimpleMeterRegistry()));
  }

  @Test
  void completedJobIsAckedAfterOutcomeIsRecorded() throws Exception {
    givenDelivery(1);
    givenKnownJob();
    when(executor.execute(eq(TASK), any(), any())).thenReturn(JobRunOutcome.COMPLETED);

    handler.handle(message);

    verify(outcomeService).completed(eq(TASK), any(ProgressSnapshot.class));
    verify(message).ack();
    verify(message, never()).term();
  }

  @Test
  void malformedPayloadIsTerminatedWithoutRetry() {
    when(message.getData()).thenReturn("{not json".getBytes(StandardCharsets.UTF_8));

    handler.handle(message);

    verify(message).term();
    verify(message, never()).ack();
    verifyNoInteractions(jobRepository, executor, outcomeService);
  }

  @Test
  void taskForUnknownJobIsTerminated() throws Exception {
    givenDelivery(1);
    when(jobRepository.findById(JOB_ID)).thenReturn(Optional.empty());

    handler.handle(message);

    verify(message).term();
    verifyNoInteractions(executor);
  }

  @Test
  void redeliveryOfTerminalJobIsAckedWithoutRunning() throws Exception {
    givenDelivery(2);
    givenKnownJob();
    store.put(JOB_ID, new ProgressSnapshot(JobStatus.DONE, "completed", 3L, 3L, null, 0L, NOW));

    handler.handle(message);

    verify(message).ack();
    verifyNoInteractions(executor, outcomeService);
  }

  @Test
  void permanentFailureMarksJobFailedAndTerminates() throws Exception {
    givenDelivery(1);
    givenKnownJob();
    when(executor.execute(eq(TASK), any(), any()))
        .thenThrow(new CsvHeaderValidationException(List.of("sku")));

    handler.handle(message);

    verify(outcomeService)
        .failed(
            eq(TASK),
            any(JobProgressTracker.class),
            eq("CsvHeaderValidationException: Missing required columns: sku"));
    verify(message).term();
    verify(message, never()).nakWithDelay(any(Duration.class));
  }

  @Test
  void transientFailureIsRetriedWithBackoff() throws Exception {
    givenDelivery(1);
    givenKnownJob();
    when(executor.execute(eq(TASK), any(), any())).thenThrow(new IllegalStateException("db down"));

    handler.handle(message);

    verify(message)
        .nakWithDelay(
            argThat(
                (Duration delay) ->
                    delay.compareTo(Duration.ofSeconds(1)) >= 0
                        && delay.compareTo(Duration.ofSeconds(2)) <= 0));
    verify(outcomeService, never()).deadLettered(any(), any(), anyString(), anyInt(), any());
  }

  @Test
  void exhaustedRetriesAreDeadLetteredThenTerminated() throws Exception {
    givenDelivery(3);
    when(metaData.streamSequence()).thenReturn(42L);
    givenKnownJob();
    when(executor.execute(eq(TASK), any(), any())).thenThrow(new IllegalStateException("db down"));

    handler.handle(message);

    verify(outcomeService)
        .deadLettered(
            eq(TASK), any(JobProgressTracker.class), eq("IllegalStateException: db down"), eq(3), eq(42L));
    verify(message).term();
    verify(message, never()).nakWithDelay(any(Duration.class));
  }

  @Test
  void deadLetterFailureFallsBackToRedelivery() throws Exception {
    givenDelivery(3);
    when(metaData.streamSequence()).thenReturn(42L);
    givenKnownJob();
    when(executor.execute(eq(TASK), any(), any())).thenThrow(new IllegalStateException("db down"));
    doThrow(new IllegalStateException("dlq unavailable"))
        .when(outcomeService)
        .deadLettered(any(), any(), anyString(), anyInt(), any());

    handler.handle(message);

    verify(message).nakWithDelay(any(Duration.class));
    verify(message, never()).term();
  }

  @Test
  void lockedJobIsRedeliveredAfterLockRetryDelay() throws Exception {
    givenDelivery(1);
    givenKnownJob();
    when(executor.execute(eq(TASK), any(), any())).thenReturn(JobRunOutcome.LOCKED);
    when(lockRepository.remainingTtl(JOB_ID)).thenReturn(Duration.ofSeconds(5));

    handler.handle(message);

    verify(message).nakWithDelay(Duration.ofSeconds(30));
    verify(lockRepository).recordLockedDelivery(JOB_ID, TestFixtures.queueProperties().maxAge());
    verifyNoInteractions(outcomeService);
  }

  @Test
  void lockedJobWaitsUntilStaleLockExpires() throws Exception {
    givenDelivery(2);
    givenKnownJob();
    when(executor.execute(eq(TASK), any(), any())).thenReturn(JobRunOutcome.LOCKED);
    when(lockRepository.remainingTtl(JOB_ID)).thenReturn(Duration.ofMinutes(4));

    handler.handle(message);

    verify(message).nakWithDelay(Duration.ofMinutes(4));
    verify(message, never()).term();
  }

  @Test
  void lockedDeliveriesDoNotCountAsAttempts() throws Exception {
    // 配信 1 はクラッシュ、配信 2,3 はロック待ち。配信 4 が 2 回目の実行試行
    givenDelivery(4);
    givenKnownJob();
    when(lockRepository.lockedDeliveries(JOB_ID)).thenReturn(2L);
    when(executor.execute(eq(TASK), any(), any())).thenThrow(new IllegalStateException("db down"));

    handler.handle(message);

    verify(message)
        .nakWithDelay(
            argThat(
                (Duration delay) ->
                    delay.compareTo(Duration.ofSeconds(2)) >= 0
                        && delay.compareTo(Duration.ofSeconds(4)) <= 0));
    verify(outcomeService, never()).deadLettered(any(), any(), anyString(), anyInt(), any());
    verify(message, never()).term();
  }

  @Test
  void unreadableLockedCountFallsBackToDeliveredCount() {
    lenient().when(message.metaData()).thenReturn(metaData);
    when(metaData.deliveredCount()).thenReturn(3L);
    when(lockRepository.lockedDeliveries(JOB_ID)).thenThrow(new IllegalStateException("redis down"));

    assertThat(handler.executionAttempt(message, TASK)).isEqualTo(3);
  }

  @Test
  void backoffGrowsExponentiallyWithinJitterAndCap() {
    for (int i = 0; i < 50; i++) {
      assertThat(handler.computeBackoffDuration(1)).isBetween(Duration.ofSeconds(1), Duration.ofSeconds(2));
      assertThat(handler.computeBackoffDuration(3)).isBetween(Duration.ofSeconds(4), Duration.ofSeconds(8));
      assertThat(handler.computeBackoffDuration(20))
          .isBetween(Duration.ofSeconds(300), Duration.ofSeconds(600));
    }
  }

  @Test
  void describeUsesExceptionTypeAndMessage() {
    assertThat(JobTaskHandler.describe(new IllegalArgumentException("bad")))
        .isEqualTo("IllegalArgumentException: bad");
    assertThat(JobTaskHandler.describe(new NullPointerException()))
        .isEqualTo("NullPointerException: ");
  }

  private void givenDelivery(long deliveredCount) throws Exception {
    when(message.getData()).thenReturn(objectMapper.writeValueAsBytes(TASK));
    lenient().when(message.metaData()).thenReturn(metaData);
    lenient().when(metaData.deliveredCount()).thenReturn(deliveredCount);
  }

  private void givenKnownJob() {
    when(jobRepository.findById(JOB_ID))
        .thenReturn(Optional.of(new JobRecord(JOB_ID, JobKind.IMPORT, "products.csv", NOW)));
  }
}
