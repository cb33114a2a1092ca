/*
 * どこで: Importer データアクセス
 * 何を: jobs テーブルの登録と参照を担う
 * なぜ: ジョブ ID を不変の記録として残し、進捗 TTL 切れ後も存在確認できるようにするため
 */
package com.example.importer.repository;

import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.importer.model.JobKind;
import com.example.importer.model.JobRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class JobRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public void insert(JobRecord record) {
    final String sql =
        """
        INSERT INTO jobs (job_id, kind, source_name, created_at)
        VALUES (:jobId, :kind, :sourceName, :createdAt)
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("jobId", record.jobId())
            .addValue("kind", record.kind().name())
            .addValue("sourceName", record.sourceName())
            .addValue("createdAt", toTimestamp(record.createdAt()));
    jdbcTemplate.update(sql, params);
  }

  public Optional<JobRecord> findById(UUID jobId) {
    final String sql =
        """
        SELECT job_id, kind, source_name, created_at
        FROM jobs
        WHERE job_id = :jobId
        """;
    final List<JobRecord> rows =
        jdbcTemplate.query(sql, new MapSqlParameterSource("jobId", jobId), this::mapRow);
    return rows.stream().findFirst();
  }

  /**
   * 一括削除の対象上限 id を確定する。既に確定済みならその値を返し、candidate は捨てる。
   *
   * @return このジョブに記録された上限 id
   */
  public long captureDeleteMaxId(UUID jobId, long candidate) {
    final String sql =
        """
        UPDATE jobs
        SET delete_max_id = COALESCE(delete_max_id, :candidate)
        WHERE job_id = :jobId
        RETURNING delete_max_id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("jobId", jobId).addValue("candidate", candidate);
    final List<Long> stored = jdbcTemplate.queryForList(sql, params, Long.class);
    if (stored.isEmpty()) {
      throw new IllegalStateException("job row not found jobId=" + jobId);
    }
    return stored.get(0);
  }

  private JobRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new JobRecord(
        rs.getObject("job_id", UUID.class),
        JobKind.valueOf(rs.getString("kind")),
        rs.getString("source_name"),
        rs.getTimestamp("created_at").toInstant());
  }
}
