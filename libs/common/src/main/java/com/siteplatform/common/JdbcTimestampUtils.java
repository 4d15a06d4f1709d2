/*
 * どこで: 共通ユーティリティ
 * 何を: JDBC で扱う Instant/LocalDate を明示的に SQL 型へ相互変換する
 * なぜ: PostgreSQL JDBC が java.time 型の推論に失敗するケースを回避するため
 */
package com.siteplatform.common;

import java.sql.Date;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;

public final class JdbcTimestampUtils {
  private JdbcTimestampUtils() {}

  // Instant は UTC のまま Timestamp へ渡す
  public static Timestamp toTimestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  public static Instant toInstant(Timestamp timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }

  public static Date toSqlDate(LocalDate date) {
    return date == null ? null : Date.valueOf(date);
  }

  public static LocalDate toLocalDate(Date date) {
    return date == null ? null : date.toLocalDate();
  }
}
