/*
 * どこで: 共通 API エラー
 * 何を: フィールド単位の入力エラーを保持する例外
 * なぜ: 400 応答の errors マップへそのまま変換するため
 */
package com.siteplatform.common.api;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class ValidationException extends RuntimeException {

  private final Map<String, List<String>> errors;

  public ValidationException(Map<String, List<String>> errors) {
    super("request validation failed");
    this.errors = copy(errors);
  }

  public ValidationException(String field, String message) {
    this(Map.of(field, List.of(message)));
  }

  public Map<String, List<String>> errors() {
    return errors;
  }

  private static Map<String, List<String>> copy(Map<String, List<String>> source) {
    final Map<String, List<String>> copied = new LinkedHashMap<>();
    source.forEach((field, messages) -> copied.put(field, List.copyOf(messages)));
    return Map.copyOf(copied);
  }
}
