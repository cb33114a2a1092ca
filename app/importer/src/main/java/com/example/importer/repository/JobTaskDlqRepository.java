/*
 * どこで: Importer データアクセス
 * 何を: リトライを使い切ったタスクを job_task_dlq に保存する
 * なぜ: 失敗したジョブの元タスクと最終エラーを運用で調査・再投入できるようにするため
 */
package com.example.importer.repository;

import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.importer.model.JobKind;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class JobTaskDlqRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /**
   * @return 新規登録なら true。同じジョブが既に登録済みなら false
   */
  public boolean insert(
      UUID jobId,
      JobKind kind,
      String payloadJson,
      String errorMessage,
      int deliveredCount,
      Long streamSeq,
      Instant createdAt) {
    final String sql =
        """
        INSERT INTO job_task_dlq (
          job_id,
          kind,
          payload_json,
          error_message,
          delivered_count,
          stream_seq,
          created_at
        ) VALUES (
          :jobId,
          :kind,
          :payloadJson::jsonb,
          :errorMessage,
          :deliveredCount,
          :streamSeq,
          :createdAt
        )
        ON CONFLICT (job_id) DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("jobId", jobId)
            .addValue("kind", kind.name())
            .addValue("payloadJson", payloadJson)
            .addValue("errorMessage", errorMessage)
            .addValue("deliveredCount", deliveredCount)
            .addValue("streamSeq", streamSeq)
            .addValue("createdAt", toTimestamp(createdAt));
    return jdbcTemplate.update(sql, params) > 0;
  }

  public Optional<String> findErrorMessage(UUID jobId) {
    final String sql = "SELECT error_message FROM job_task_dlq WHERE job_id = :jobId";
    return jdbcTemplate
        .query(sql, new MapSqlParameterSource("jobId", jobId), (rs, rowNum) -> rs.getString(1))
        .stream()
        .findFirst();
  }
}
