/*
 * どこで: Importer NATS 購読テスト
 * 何を: MaxDeliver advisory から元タスクを復元して DLQ 退避し、ack/nak することを検証する
 * なぜ: ワーカー側のリトライ判定に届かなかったタスクも終端することを保証するため
 */
package com.example.importer.nats;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.importer.config.JobAdvisoryProperties;
import com.example.importer.model.JobKind;
import com.example.importer.model.JobTask;
import com.example.importer.support.TestFixtures;
import com.example.importer.worker.JobOutcomeService;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.nats.client.Connection;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.Message;
import io.nats.client.api.MessageInfo;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
class JobMaxDeliverAdvisorySubscriberTest {

  private static final long STREAM_SEQ = 42L;
  private static final Instant NOW = Instant.parse("2026-01-12T00:00:00Z");
  private static final JobTask TASK =
      new JobTask(
          UUID.fromString("00000000-0000-0000-0000-0000000000ff"),
          JobKind.IMPORT,
          "/tmp/uploads/job.csv",
          "products.csv",
          NOW,
          "trace-1");

  @Mock private Connection connection;
  @Mock private JetStreamManagement jetStreamManagement;
  @Mock private JobStreamManager streamManager;
  @Mock private JobOutcomeService outcomeService;

  private final ObjectMapper objectMapper = TestFixtures.objectMapper();
  private JobMaxDeliverAdvisorySubscriber subscriber;

  @BeforeEach
  void setUp() {
    subscriber =
        new JobMaxDeliverAdvisorySubscriber(
            connection,
            jetStreamManagement,
            streamManager,
            TestFixtures.queueProperties(),
            new JobAdvisoryProperties(
                true,
                "$JS.EVENT.ADVISORY.CONSUMER.MAX_DELIVERIES.catalog-jobs.*",
                "catalog-jobs-advisory",
                "catalog-jobs-advisory-dlq"),
            outcomeService,
            objectMapper);
  }

  @Test
  void deadLettersOriginalTaskAndAcks() throws Exception {
    final Message message = advisory("{\"stream_seq\": %d, \"deliveries\": 5}".formatted(STREAM_SEQ));
    givenStoredTask();

    subscriber.handleMessage(message);

    verify(outcomeService)
        .deadLettered(TASK, null, JobMaxDeliverAdvisorySubscriber.MAX_DELIVERIES_ERROR, 5, STREAM_SEQ);
    verify(message).ack();
    verify(message, never()).nak();
  }

  @Test
  void deliveriesDefaultsToMaxDeliver() throws Exception {
    final Message message = advisory("{\"stream_seq\": %d}".formatted(STREAM_SEQ));
    givenStoredTask();

    subscriber.handleMessage(message);

    verify(outcomeService)
        .deadLettered(TASK, null, JobMaxDeliverAdvisorySubscriber.MAX_DELIVERIES_ERROR, 5, STREAM_SEQ);
  }

  @Test
  void ackWhenStreamSeqMissing() {
    final Message message = advisory("{\"stream\": \"catalog-jobs\"}");

    subscriber.handleMessage(message);

    verifyNoInteractions(jetStreamManagement, outcomeService);
    verify(message).ack();
  }

  @Test
  void ackWhenOriginalMessageIsGone() throws Exception {
    final Message message = advisory("{\"stream_seq\": %d}".formatted(STREAM_SEQ));
    when(jetStreamManagement.getMessage("catalog-jobs", STREAM_SEQ))
        .thenThrow(JetStreamApiException.class);

    subscriber.handleMessage(message);

    verifyNoInteractions(outcomeService);
    verify(message).ack();
  }

  @Test
  void ackWhenPayloadIsNotJson() {
    final Message message = advisory("not-json");

    subscriber.handleMessage(message);

    verify(message).ack();
    verify(message, never()).nak();
  }

  @Test
  void nakWhenDatabaseIsUnavailable() throws Exception {
    final Message message = advisory("{\"stream_seq\": %d}".formatted(STREAM_SEQ));
    givenStoredTask();
    doThrow(new DataAccessResourceFailureException("db down"))
        .when(outcomeService)
        .deadLettered(any(), any(), anyString(), anyInt(), any());

    subscriber.handleMessage(message);

    verify(message).nak();
    verify(message, never()).ack();
  }

  private Message advisory(String payload) {
    final Message message = mock(Message.class);
    when(message.getData()).thenReturn(payload.getBytes(StandardCharsets.UTF_8));
    return message;
  }

  private void givenStoredTask() throws Exception {
    final MessageInfo info = mock(MessageInfo.class);
    when(info.getData()).thenReturn(objectMapper.writeValueAsBytes(TASK));
    when(jetStreamManagement.getMessage("catalog-jobs", STREAM_SEQ)).thenReturn(info);
  }
}
