package com.example.importer.progress;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.importer.model.JobStatus;
import com.example.importer.model.ProgressSnapshot;
import com.example.importer.support.TestFixtures;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.data.redis.listener.Topic;

class RedisProgressStoreTest {

  private static final UUID JOB_ID = UUID.fromString("00000000-0000-0000-0000-000000000401");
  private static final Instant NOW = Instant.parse("2026-01-12T00:00:00Z");
  private static final String HASH_KEY = "import_progress:hash:" + JOB_ID;
  private static final String CHANNEL = "import_progress:channel:" + JOB_ID;

  private StringRedisTemplate redisTemplate;
  private HashOperations<String, Object, Object> hashOps;
  private RedisMessageListenerContainer listenerContainer;
  private RedisProgressStore store;

  @SuppressWarnings("unchecked")
  @BeforeEach
  void setUp() {
    redisTemplate = Mockito.mock(StringRedisTemplate.class);
    hashOps = Mockito.mock(HashOperations.class);
    listenerContainer = Mockito.mock(RedisMessageListenerContainer.class);
    when(redisTemplate.opsForHash()).thenReturn(hashOps);
    store =
        new RedisProgressStore(
            redisTemplate,
            listenerContainer,
            TestFixtures.objectMapper(),
            TestFixtures.progressProperties(),
            Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @SuppressWarnings("unchecked")
  @Test
  void setProgressWritesEveryFieldAndRefreshesTtl() {
    final Instant updatedAt =
        store.setProgress(
            JOB_ID, new ProgressSnapshot(JobStatus.IMPORTING, "batch_1", null, 5L, null, 2L, null));

    assertThat(updatedAt).isEqualTo(NOW);
    final ArgumentCaptor<Map<String, String>> fieldsCaptor = ArgumentCaptor.forClass(Map.class);
    verify(hashOps).putAll(eq(HASH_KEY), fieldsCaptor.capture());
    assertThat(fieldsCaptor.getValue())
        .containsEntry("status", "importing")
        .containsEntry("stage", "batch_1")
        .containsEntry("total_rows", "")
        .containsEntry("processed_rows", "5")
        .containsEntry("error_message", "")
        .containsEntry("row_error_count", "2")
        .containsEntry("updated_at", "2026-01-12T00:00:00Z");
    verify(redisTemplate).expire(HASH_KEY, Duration.ofHours(1));
  }

  @Test
  void getProgressReadsStoredSnapshot() {
    when(hashOps.entries(HASH_KEY))
        .thenReturn(
            Map.of(
                "status", "failed",
                "stage", "importing",
                "total_rows", "10",
                "processed_rows", "4",
                "error_message", "boom",
                "row_error_count", "",
                "updated_at", "2026-01-12T00:00:00Z"));

    final Optional<ProgressSnapshot> snapshot = store.getProgress(JOB_ID);

    assertThat(snapshot)
        .contains(new ProgressSnapshot(JobStatus.FAILED, "importing", 10L, 4L, "boom", 0L, NOW));
  }

  @Test
  void getProgressIsEmptyWhenHashIsMissing() {
    when(hashOps.entries(HASH_KEY)).thenReturn(Map.of());

    assertThat(store.getProgress(JOB_ID)).isEmpty();
  }

  @Test
  void corruptSnapshotIsReportedAsIllegalState() {
    when(hashOps.entries(HASH_KEY)).thenReturn(Map.of("status", "importing", "total_rows", "ten"));

    assertThatThrownBy(() -> store.getProgress(JOB_ID))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining(JOB_ID.toString());
  }

  @Test
  void publishUpdateAddsJobIdAndTimestamp() {
    when(redisTemplate.convertAndSend(eq(CHANNEL), any(String.class))).thenReturn(3L);

    final long receivers = store.publishUpdate(JOB_ID, Map.of("status", "parsing"));

    assertThat(receivers).isEqualTo(3L);
    final ArgumentCaptor<String> messageCaptor = ArgumentCaptor.forClass(String.class);
    verify(redisTemplate).convertAndSend(eq(CHANNEL), messageCaptor.capture());
    assertThat(messageCaptor.getValue())
        .contains("\"status\":\"parsing\"")
        .contains("\"job_id\":\"" + JOB_ID + "\"")
        .contains("\"updated_at\":\"2026-01-12T00:00:00Z\"");
  }

  @Test
  void subscribeForwardsChannelMessagesUntilClosed() {
    final List<String> received = new ArrayList<>();

    final ProgressSubscription subscription = store.subscribe(JOB_ID, received::add);

    final ArgumentCaptor<MessageListener> listenerCaptor =
        ArgumentCaptor.forClass(MessageListener.class);
    final ArgumentCaptor<Topic> topicCaptor = ArgumentCaptor.forClass(Topic.class);
    verify(listenerContainer).addMessageListener(listenerCaptor.capture(), topicCaptor.capture());
    assertThat(topicCaptor.getValue().getTopic()).isEqualTo(CHANNEL);

    final Message message = Mockito.mock(Message.class);
    when(message.getBody()).thenReturn("{\"status\":\"done\"}".getBytes(StandardCharsets.UTF_8));
    listenerCaptor.getValue().onMessage(message, null);
    assertThat(received).containsExactly("{\"status\":\"done\"}");

    subscription.close();
    verify(listenerContainer)
        .removeMessageListener(listenerCaptor.getValue(), topicCaptor.getValue());
  }
}
