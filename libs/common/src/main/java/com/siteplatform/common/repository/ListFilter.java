/*
 * どこで: 共通データアクセス
 * 何を: 一覧取得の等値条件とページング指定を保持する
 * なぜ: クエリパラメータを列名の許可リストで検証してから SQL へ渡すため
 */
package com.siteplatform.common.repository;

import com.siteplatform.common.api.ValidationErrors;
import java.util.LinkedHashMap;
import java.util.Map;

public record ListFilter(Map<String, String> criteria, int limit, int offset) {

  public static final int DEFAULT_LIMIT = 100;
  public static final int MAX_LIMIT = 500;

  static final String PARAM_LIMIT = "limit";
  static final String PARAM_OFFSET = "offset";

  public ListFilter {
    criteria = criteria == null ? Map.of() : Map.copyOf(criteria);
  }

  public static ListFilter all() {
    return new ListFilter(Map.of(), DEFAULT_LIMIT, 0);
  }

  public static ListFilter where(String field, String value) {
    return new ListFilter(Map.of(field, value), DEFAULT_LIMIT, 0);
  }

  /**
   * 役割: HTTP クエリパラメータから一覧条件を組み立てる。
   * 動作: limit/offset はページングとして解釈し、残りを等値条件として保持する。
   *       範囲外の limit/offset は ValidationException とする。
   */
  public static ListFilter fromQueryParameters(Map<String, String> parameters) {
    final Map<String, String> criteria = new LinkedHashMap<>(parameters);
    final String rawLimit = criteria.remove(PARAM_LIMIT);
    final String rawOffset = criteria.remove(PARAM_OFFSET);
    final ValidationErrors errors = new ValidationErrors();
    final int limit = parseInt(rawLimit, DEFAULT_LIMIT, PARAM_LIMIT, errors);
    final int offset = parseInt(rawOffset, 0, PARAM_OFFSET, errors);
    errors.check(limit >= 1 && limit <= MAX_LIMIT, PARAM_LIMIT, "limit must be between 1 and " + MAX_LIMIT);
    errors.check(offset >= 0, PARAM_OFFSET, "offset must not be negative");
    errors.throwIfAny();
    return new ListFilter(criteria, limit, offset);
  }

  private static int parseInt(String raw, int fallback, String field, ValidationErrors errors) {
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    try {
      return Integer.parseInt(raw.trim());
    } catch (NumberFormatException ex) {
      errors.reject(field, field + " must be an integer");
      return fallback;
    }
  }
}
