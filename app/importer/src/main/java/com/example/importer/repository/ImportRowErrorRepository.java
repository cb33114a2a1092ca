package com.example.importer.repository;

import com.example.importer.model.RowError;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class ImportRowErrorRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /** 再配信で同じ行を再登録しても重複しない。 */
  public void insertAll(UUID jobId, List<RowError> errors) {
    if (errors.isEmpty()) {
      return;
    }
    final String sql =
        """
        INSERT INTO import_row_errors (job_id, row_number, message)
        VALUES (:jobId, :rowNumber, :message)
        ON CONFLICT (job_id, row_number) DO NOTHING
        """;
    final MapSqlParameterSource[] batch =
        errors.stream()
            .map(
                error ->
                    new MapSqlParameterSource()
                        .addValue("jobId", jobId)
                        .addValue("rowNumber", error.rowNumber())
                        .addValue("message", error.message()))
            .toArray(MapSqlParameterSource[]::new);
    jdbcTemplate.batchUpdate(sql, batch);
  }

  public List<RowError> findByJobId(UUID jobId, int limit) {
    final String sql =
        """
        SELECT row_number, message
        FROM import_row_errors
        WHERE job_id = :jobId
        ORDER BY row_number
        LIMIT :limit
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("jobId", jobId).addValue("limit", limit);
    return jdbcTemplate.query(
        sql, params, (rs, rowNum) -> new RowError(rs.getLong("row_number"), rs.getString("message")));
  }
}
