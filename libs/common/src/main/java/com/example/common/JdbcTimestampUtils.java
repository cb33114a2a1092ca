/*
 * どこで: 共通ユーティリティ
 * 何を: JDBC の Timestamp と Instant を相互に明示変換する
 * なぜ: PostgreSQL JDBC の型推論に依存せず、nullable 列を一箇所で扱うため
 */
package com.example.common;

import java.sql.Timestamp;
import java.time.Instant;

public final class JdbcTimestampUtils {
  private JdbcTimestampUtils() {}

  // Instant は UTC のまま Timestamp.from で渡す
  public static Timestamp toTimestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  public static Instant toInstant(Timestamp timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }
}
