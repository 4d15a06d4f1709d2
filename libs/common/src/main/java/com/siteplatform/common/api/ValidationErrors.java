/*
 * どこで: 共通 API 入力検証
 * 何を: バージョン別 DTO 検証関数が使うエラー蓄積器
 * なぜ: 宣言的フレームワークに頼らず、検証ルールを純粋関数として明示するため
 */
package com.siteplatform.common.api;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class ValidationErrors {

  private final Map<String, List<String>> errors = new LinkedHashMap<>();

  public ValidationErrors reject(String field, String message) {
    errors.computeIfAbsent(field, ignored -> new ArrayList<>()).add(message);
    return this;
  }

  public ValidationErrors check(boolean valid, String field, String message) {
    if (!valid) {
      reject(field, message);
    }
    return this;
  }

  public ValidationErrors requireText(String field, String value, int maxLength) {
    if (value == null || value.isBlank()) {
      return reject(field, field + " is required");
    }
    return check(value.length() <= maxLength, field, field + " must be at most " + maxLength + " characters");
  }

  public ValidationErrors optionalText(String field, String value, int maxLength) {
    if (value == null) {
      return this;
    }
    return check(value.length() <= maxLength, field, field + " must be at most " + maxLength + " characters");
  }

  public ValidationErrors requireNonNull(String field, Object value) {
    return check(value != null, field, field + " is required");
  }

  public ValidationErrors nonNegative(String field, BigDecimal value) {
    return check(value == null || value.signum() >= 0, field, field + " must not be negative");
  }

  public ValidationErrors nonNegative(String field, Integer value) {
    return check(value == null || value >= 0, field, field + " must not be negative");
  }

  /** NUMERIC(precision, scale) 列に丸めや桁あふれなく収まるかを検査する。 */
  public ValidationErrors decimal(String field, BigDecimal value, int precision, int scale) {
    if (value == null) {
      return this;
    }
    final BigDecimal normalized = value.stripTrailingZeros();
    if (Math.max(normalized.scale(), 0) > scale) {
      return reject(field, field + " must have at most " + scale + " decimal places");
    }
    final int integerDigits = Math.max(normalized.precision() - normalized.scale(), 0);
    return check(
        integerDigits <= precision - scale,
        field,
        field + " must have at most " + (precision - scale) + " integer digits");
  }

  public boolean isEmpty() {
    return errors.isEmpty();
  }

  public Map<String, List<String>> asMap() {
    return Map.copyOf(errors);
  }

  public void throwIfAny() {
    if (!errors.isEmpty()) {
      throw new ValidationException(errors);
    }
  }
}
