/*
 * どこで: Importer 進捗ストア
 * 何を: 進捗スナップショットを Redis ハッシュへ、差分を Redis pub/sub チャネルへ書き込む
 * なぜ: 遅れて来た読者はハッシュから、接続中の読者はチャネルから同じ進捗を得られるようにするため
 */
package com.example.importer.progress;

import com.example.importer.config.ProgressProperties;
import com.example.importer.model.JobStatus;
import com.example.importer.model.ProgressSnapshot;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.stereotype.Component;

@Component
public class RedisProgressStore implements ProgressStore {

  static final String FIELD_STATUS = "status";
  static final String FIELD_STAGE = "stage";
  static final String FIELD_TOTAL_ROWS = "total_rows";
  static final String FIELD_PROCESSED_ROWS = "processed_rows";
  static final String FIELD_ERROR_MESSAGE = "error_message";
  static final String FIELD_ROW_ERROR_COUNT = "row_error_count";
  static final String FIELD_UPDATED_AT = "updated_at";

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "StringRedisTemplate は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final StringRedisTemplate redisTemplate;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "リスナーコンテナは Spring 管理の共有コンポーネントのため")
  private final RedisMessageListenerContainer listenerContainer;

  private final ObjectMapper objectMapper;
  private final ProgressProperties properties;
  private final Clock clock;

  public RedisProgressStore(
      StringRedisTemplate redisTemplate,
      RedisMessageListenerContainer listenerContainer,
      ObjectMapper objectMapper,
      ProgressProperties properties,
      Clock clock) {
    this.redisTemplate = redisTemplate;
    this.listenerContainer = listenerContainer;
    this.objectMapper = objectMapper;
    this.properties = properties;
    this.clock = clock;
  }

  @Override
  public Instant setProgress(UUID jobId, ProgressSnapshot snapshot) {
    final Instant updatedAt = Instant.now(clock);
    final String key = hashKey(jobId);
    // null 列は空文字で上書きし、前回の値(error_message 等)が残らないようにする
    final Map<String, String> fields = new LinkedHashMap<>();
    fields.put(FIELD_STATUS, snapshot.status().value());
    fields.put(FIELD_STAGE, emptyIfNull(snapshot.stage()));
    fields.put(
        FIELD_TOTAL_ROWS, snapshot.totalRows() == null ? "" : String.valueOf(snapshot.totalRows()));
    fields.put(FIELD_PROCESSED_ROWS, String.valueOf(snapshot.processedRows()));
    fields.put(FIELD_ERROR_MESSAGE, emptyIfNull(snapshot.errorMessage()));
    fields.put(FIELD_ROW_ERROR_COUNT, String.valueOf(snapshot.rowErrorCount()));
    fields.put(FIELD_UPDATED_AT, updatedAt.toString());
    redisTemplate.opsForHash().putAll(key, fields);
    redisTemplate.expire(key, properties.ttl());
    return updatedAt;
  }

  @Override
  public Optional<ProgressSnapshot> getProgress(UUID jobId) {
    final Map<Object, Object> fields = redisTemplate.opsForHash().entries(hashKey(jobId));
    if (fields == null || fields.isEmpty()) {
      return Optional.empty();
    }
    final String status = stringValue(fields.get(FIELD_STATUS));
    if (status == null) {
      return Optional.empty();
    }
    try {
      return Optional.of(
          new ProgressSnapshot(
              JobStatus.fromValue(status),
              stringValue(fields.get(FIELD_STAGE)),
              longValue(fields.get(FIELD_TOTAL_ROWS)),
              longValueOrZero(fields.get(FIELD_PROCESSED_ROWS)),
              stringValue(fields.get(FIELD_ERROR_MESSAGE)),
              longValueOrZero(fields.get(FIELD_ROW_ERROR_COUNT)),
              instantValue(fields.get(FIELD_UPDATED_AT))));
    } catch (IllegalArgumentException | DateTimeException ex) {
      throw new IllegalStateException("corrupt progress snapshot jobId=" + jobId, ex);
    }
  }

  @Override
  public long publishUpdate(UUID jobId, Map<String, Object> delta) {
    final Map<String, Object> message = new LinkedHashMap<>(delta);
    message.putIfAbsent("job_id", jobId.toString());
    message.putIfAbsent(FIELD_UPDATED_AT, Instant.now(clock).toString());
    final String json;
    try {
      json = objectMapper.writeValueAsString(message);
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("progress update is not serializable jobId=" + jobId, ex);
    }
    final Long receivers = redisTemplate.convertAndSend(channel(jobId), json);
    return receivers == null ? 0L : receivers;
  }

  @Override
  public ProgressSubscription subscribe(UUID jobId, Consumer<String> listener) {
    final ChannelTopic topic = new ChannelTopic(channel(jobId));
    final MessageListener messageListener =
        (message, pattern) -> listener.accept(new String(message.getBody(), StandardCharsets.UTF_8));
    listenerContainer.addMessageListener(messageListener, topic);
    return () -> listenerContainer.removeMessageListener(messageListener, topic);
  }

  @VisibleForTesting
  String hashKey(UUID jobId) {
    return properties.keyPrefix() + ":hash:" + jobId;
  }

  @VisibleForTesting
  String channel(UUID jobId) {
    return properties.keyPrefix() + ":channel:" + jobId;
  }

  private static String emptyIfNull(String value) {
    return value == null ? "" : value;
  }

  private static String stringValue(Object value) {
    if (value == null) {
      return null;
    }
    final String text = value.toString();
    return text.isEmpty() ? null : text;
  }

  private static Long longValue(Object value) {
    final String text = stringValue(value);
    return text == null ? null : Long.valueOf(text);
  }

  private static long longValueOrZero(Object value) {
    final Long parsed = longValue(value);
    return parsed == null ? 0L : parsed;
  }

  private static Instant instantValue(Object value) {
    final String text = stringValue(value);
    return text == null ? null : Instant.parse(text);
  }
}
