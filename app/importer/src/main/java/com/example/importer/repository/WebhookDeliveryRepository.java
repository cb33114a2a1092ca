/*
 * どこで: Importer データアクセス
 * 何を: webhook_deliveries の登録/claim/確定/履歴参照を担う
 * なぜ: 複数ワーカーが同じ配信を二重送信しないよう SKIP LOCKED + lease で取り合うため
 */
package com.example.importer.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.importer.model.WebhookDelivery;
import com.example.importer.model.WebhookDeliveryStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class WebhookDeliveryRepository {

  private static final String DELIVERY_COLUMNS =
      """
      id, webhook_id, event_type, payload_json::text AS payload_json_text, status,
      response_code, response_body, response_time_ms, error_message, attempted_at, completed_at
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public void insertPending(long webhookId, String eventType, String payloadJson, Instant now) {
    final String sql =
        """
        INSERT INTO webhook_deliveries (
          webhook_id,
          event_type,
          payload_json,
          status,
          attempted_at
        ) VALUES (
          :webhookId,
          :eventType,
          :payloadJson::jsonb,
          'PENDING',
          :now
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("webhookId", webhookId)
            .addValue("eventType", eventType)
            .addValue("payloadJson", payloadJson)
            .addValue("now", toTimestamp(now));
    jdbcTemplate.update(sql, params);
  }

  /** 未 claim の PENDING を lease 付きで確保し、送信先 URL と一緒に返す。 */
  public List<ClaimedDelivery> claimPending(
      int limit, Instant now, Instant leaseUntil, String lockedBy) {
    final String sql =
        """
        WITH cte AS (
          SELECT id
          FROM webhook_deliveries
          WHERE status = 'PENDING'
            AND locked_by IS NULL
          ORDER BY attempted_at, id
          LIMIT :limit
          FOR UPDATE SKIP LOCKED
        )
        UPDATE webhook_deliveries d
        SET locked_by = :lockedBy,
            lease_until = :leaseUntil,
            attempted_at = :now
        FROM cte, webhooks w
        WHERE d.id = cte.id
          AND w.id = d.webhook_id
        RETURNING d.id, d.webhook_id, w.url, d.event_type, d.payload_json::text AS payload_json_text
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("limit", limit)
            .addValue("now", toTimestamp(now))
            .addValue("leaseUntil", toTimestamp(leaseUntil))
            .addValue("lockedBy", lockedBy);
    return jdbcTemplate.query(
        sql,
        params,
        (rs, rowNum) ->
            new ClaimedDelivery(
                rs.getLong("id"),
                rs.getLong("webhook_id"),
                rs.getString("url"),
                rs.getString("event_type"),
                rs.getString("payload_json_text")));
  }

  /** 送信結果で PENDING を 1 度だけ確定する。lock を失っていれば 0 を返す。 */
  public int complete(
      long deliveryId,
      WebhookDeliveryStatus status,
      Integer responseCode,
      String responseBody,
      Integer responseTimeMs,
      String errorMessage,
      Instant completedAt,
      String lockedBy) {
    final String sql =
        """
        UPDATE webhook_deliveries
        SET status = :status,
            response_code = :responseCode,
            response_body = :responseBody,
            response_time_ms = :responseTimeMs,
            error_message = :errorMessage,
            completed_at = :completedAt,
            locked_by = NULL,
            lease_until = NULL
        WHERE id = :id
          AND status = 'PENDING'
          AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", deliveryId)
            .addValue("status", status.name())
            .addValue("responseCode", responseCode)
            .addValue("responseBody", responseBody)
            .addValue("responseTimeMs", responseTimeMs)
            .addValue("errorMessage", errorMessage)
            .addValue("completedAt", toTimestamp(completedAt))
            .addValue("lockedBy", lockedBy);
    return jdbcTemplate.update(sql, params);
  }

  /** lease が切れた claim 済み配信は再送せず FAILED で確定する。 */
  public int failExpiredLeases(Instant now, String errorMessage) {
    final String sql =
        """
        UPDATE webhook_deliveries
        SET status = 'FAILED',
            error_message = :errorMessage,
            completed_at = :now,
            locked_by = NULL,
            lease_until = NULL
        WHERE status = 'PENDING'
          AND lease_until IS NOT NULL
          AND lease_until <= :now
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("now", toTimestamp(now))
            .addValue("errorMessage", errorMessage);
    return jdbcTemplate.update(sql, params);
  }

  public List<WebhookDelivery> findByWebhookId(long webhookId, int limit, long offset) {
    final String sql =
        "SELECT "
            + DELIVERY_COLUMNS
            + """
            FROM webhook_deliveries
            WHERE webhook_id = :webhookId
            ORDER BY attempted_at DESC, id DESC
            LIMIT :limit OFFSET :offset
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("webhookId", webhookId)
            .addValue("limit", limit)
            .addValue("offset", offset);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  private WebhookDelivery mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new WebhookDelivery(
        rs.getLong("id"),
        rs.getLong("webhook_id"),
        rs.getString("event_type"),
        rs.getString("payload_json_text"),
        WebhookDeliveryStatus.valueOf(rs.getString("status")),
        (Integer) rs.getObject("response_code"),
        rs.getString("response_body"),
        (Integer) rs.getObject("response_time_ms"),
        rs.getString("error_message"),
        toInstant(rs.getTimestamp("attempted_at")),
        toInstant(rs.getTimestamp("completed_at")));
  }

  public record ClaimedDelivery(
      long id, long webhookId, String url, String eventType, String payloadJson) {}
}
