/*
 * どこで: Importer データアクセス
 * 何を: webhooks テーブルの登録/取得/更新/削除を担う
 * なぜ: イベント種別で購読中の送信先を引けるようにするため
 */
package com.example.importer.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.importer.model.Webhook;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class WebhookRepository {

  private static final TypeReference<List<String>> EVENT_LIST = new TypeReference<>() {};
  private static final String SELECT_COLUMNS =
      "SELECT id, url, events::text AS events_text, enabled, created_at, updated_at FROM webhooks";

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final ObjectMapper objectMapper;

  public long insert(String url, List<String> events, boolean enabled, Instant now) {
    final String sql =
        """
        INSERT INTO webhooks (url, events, enabled, created_at, updated_at)
        VALUES (:url, :events::jsonb, :enabled, :now, :now)
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("url", url)
            .addValue("events", writeEvents(events))
            .addValue("enabled", enabled)
            .addValue("now", toTimestamp(now));
    final KeyHolder keyHolder = new GeneratedKeyHolder();
    jdbcTemplate.update(sql, params, keyHolder, new String[] {"id"});
    final Number key = keyHolder.getKey();
    if (key == null) {
      throw new IllegalStateException("webhook id was not generated");
    }
    return key.longValue();
  }

  public int update(long id, String url, List<String> events, boolean enabled, Instant now) {
    final String sql =
        """
        UPDATE webhooks
        SET url = :url,
            events = :events::jsonb,
            enabled = :enabled,
            updated_at = :now
        WHERE id = :id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("url", url)
            .addValue("events", writeEvents(events))
            .addValue("enabled", enabled)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  public int delete(long id) {
    return jdbcTemplate.update(
        "DELETE FROM webhooks WHERE id = :id", new MapSqlParameterSource("id", id));
  }

  public Optional<Webhook> findById(long id) {
    return jdbcTemplate
        .query(SELECT_COLUMNS + " WHERE id = :id", new MapSqlParameterSource("id", id), this::mapRow)
        .stream()
        .findFirst();
  }

  public List<Webhook> findAll() {
    return jdbcTemplate.query(
        SELECT_COLUMNS + " ORDER BY id", new MapSqlParameterSource(), this::mapRow);
  }

  /** events 配列に eventType を含む有効な webhook。 */
  public List<Webhook> findEnabledByEvent(String eventType) {
    final String sql =
        SELECT_COLUMNS + " WHERE enabled = TRUE AND jsonb_exists(events, :eventType) ORDER BY id";
    return jdbcTemplate.query(sql, new MapSqlParameterSource("eventType", eventType), this::mapRow);
  }

  private String writeEvents(List<String> events) {
    try {
      return objectMapper.writeValueAsString(events);
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("webhook events are not serializable", ex);
    }
  }

  private Webhook mapRow(ResultSet rs, int rowNum) throws SQLException {
    final List<String> events;
    try {
      events = objectMapper.readValue(rs.getString("events_text"), EVENT_LIST);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("corrupt webhook events id=" + rs.getLong("id"), ex);
    }
    return new Webhook(
        rs.getLong("id"),
        rs.getString("url"),
        events,
        rs.getBoolean("enabled"),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("updated_at")));
  }
}
