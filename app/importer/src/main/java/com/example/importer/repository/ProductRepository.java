/*
 * どこで: Importer データアクセス
 * 何を: products テーブルへの共有 upsert / delete プリミティブと参照クエリを提供する
 * なぜ: CSV 取込・一括削除・単票 CRUD が同じ冪等な書き込み経路だけを通るようにするため
 */
package com.example.importer.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.importer.model.ProductFilter;
import com.example.importer.model.ProductRecord;
import com.example.importer.model.ProductRow;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class ProductRepository {

  private static final String SELECT_COLUMNS =
      "SELECT id, sku, name, description, active, created_at, updated_at FROM products";

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /**
   * lower(sku) をキーに条件付き upsert する。値が同じ行は更新しない(updated_at も動かさない)。
   * 同一バッチ内で sku が重複した場合は後勝ち。
   *
   * @return 実際に挿入/更新された行数
   */
  public int upsertAll(Collection<ProductRow> rows, Instant now) {
    if (rows.isEmpty()) {
      return 0;
    }
    final String sql =
        """
        INSERT INTO products (sku, name, description, active, created_at, updated_at)
        VALUES (:sku, :name, :description, :active, :now, :now)
        ON CONFLICT ((lower(sku))) DO UPDATE
        SET name = EXCLUDED.name,
            description = EXCLUDED.description,
            active = EXCLUDED.active,
            updated_at = EXCLUDED.updated_at
        WHERE (products.name, products.description, products.active)
          IS DISTINCT FROM (EXCLUDED.name, EXCLUDED.description, EXCLUDED.active)
        """;
    final Collection<ProductRow> deduplicated = lastOccurrenceBySku(rows);
    final MapSqlParameterSource[] batch =
        deduplicated.stream()
            .map(
                row ->
                    new MapSqlParameterSource()
                        .addValue("sku", row.sku())
                        .addValue("name", row.name())
                        .addValue("description", row.description())
                        .addValue("active", row.active())
                        .addValue("now", toTimestamp(now)))
            .toArray(MapSqlParameterSource[]::new);
    int affected = 0;
    for (int count : jdbcTemplate.batchUpdate(sql, batch)) {
      affected += Math.max(0, count);
    }
    return affected;
  }

  public int deleteByIds(Collection<Long> ids) {
    if (ids.isEmpty()) {
      return 0;
    }
    final String sql = "DELETE FROM products WHERE id IN (:ids)";
    return jdbcTemplate.update(sql, new MapSqlParameterSource("ids", ids));
  }

  /** id 昇順で最大 limit 件を削除する。maxId より後に作られた行は対象外。 */
  public int deleteBatch(int limit, long maxId) {
    final String sql =
        """
        DELETE FROM products
        WHERE id IN (
          SELECT id
          FROM products
          WHERE id <= :maxId
          ORDER BY id
          LIMIT :limit
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("maxId", maxId).addValue("limit", limit);
    return jdbcTemplate.update(sql, params);
  }

  public long count() {
    final Long count =
        jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM products", new MapSqlParameterSource(), Long.class);
    return count == null ? 0L : count;
  }

  public long maxId() {
    final Long maxId =
        jdbcTemplate.queryForObject(
            "SELECT COALESCE(MAX(id), 0) FROM products", new MapSqlParameterSource(), Long.class);
    return maxId == null ? 0L : maxId;
  }

  public Optional<ProductRecord> findById(long id) {
    final List<ProductRecord> rows =
        jdbcTemplate.query(
            SELECT_COLUMNS + " WHERE id = :id", new MapSqlParameterSource("id", id), this::mapRow);
    return rows.stream().findFirst();
  }

  public Optional<ProductRecord> findBySku(String sku) {
    final List<ProductRecord> rows =
        jdbcTemplate.query(
            SELECT_COLUMNS + " WHERE lower(sku) = lower(:sku)",
            new MapSqlParameterSource("sku", sku),
            this::mapRow);
    return rows.stream().findFirst();
  }

  public List<ProductRecord> findPage(ProductFilter filter, int limit, long offset) {
    final MapSqlParameterSource params = filterParams(filter);
    params.addValue("limit", limit).addValue("offset", offset);
    return jdbcTemplate.query(
        SELECT_COLUMNS + whereClause(filter) + " ORDER BY id LIMIT :limit OFFSET :offset",
        params,
        this::mapRow);
  }

  public long count(ProductFilter filter) {
    final Long count =
        jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM products" + whereClause(filter), filterParams(filter), Long.class);
    return count == null ? 0L : count;
  }

  private static String whereClause(ProductFilter filter) {
    final List<String> conditions = new ArrayList<>();
    if (filter.sku() != null) {
      conditions.add("sku ILIKE :sku");
    }
    if (filter.name() != null) {
      conditions.add("name ILIKE :name");
    }
    if (filter.description() != null) {
      conditions.add("description ILIKE :description");
    }
    if (filter.active() != null) {
      conditions.add("active = :active");
    }
    return conditions.isEmpty() ? "" : " WHERE " + String.join(" AND ", conditions);
  }

  private static MapSqlParameterSource filterParams(ProductFilter filter) {
    return new MapSqlParameterSource()
        .addValue("sku", containsPattern(filter.sku()))
        .addValue("name", containsPattern(filter.name()))
        .addValue("description", containsPattern(filter.description()))
        .addValue("active", filter.active());
  }

  private static String containsPattern(String value) {
    if (value == null) {
      return null;
    }
    // LIKE のメタ文字はリテラルとして扱う
    final String escaped =
        value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    return "%" + escaped + "%";
  }

  private static Collection<ProductRow> lastOccurrenceBySku(Collection<ProductRow> rows) {
    final Map<String, ProductRow> bySku = new LinkedHashMap<>();
    for (ProductRow row : rows) {
      final String key = row.sku().toLowerCase(Locale.ROOT);
      bySku.remove(key);
      bySku.put(key, row);
    }
    return bySku.values();
  }

  private ProductRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new ProductRecord(
        rs.getLong("id"),
        rs.getString("sku"),
        rs.getString("name"),
        rs.getString("description"),
        rs.getBoolean("active"),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("updated_at")));
  }
}
