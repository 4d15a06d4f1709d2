/*
 * どこで: 共通 API エラー
 * 何を: RFC7807 形式のエラー応答本文を定義する
 * なぜ: type/title/status/detail/traceId/errors を全ホストで統一するため
 */
package com.siteplatform.common.api;

import com.siteplatform.common.TraceIds;
import java.util.List;
import java.util.Map;

public record ApiErrorResponse(
    String type,
    String title,
    int status,
    String detail,
    String traceId,
    Map<String, List<String>> errors) {

  public ApiErrorResponse {
    errors = errors == null ? Map.of() : Map.copyOf(errors);
  }

  public static ApiErrorResponse of(ApiErrorKind kind, String detail) {
    return of(kind, detail, Map.of());
  }

  public static ApiErrorResponse of(
      ApiErrorKind kind, String detail, Map<String, List<String>> errors) {
    return new ApiErrorResponse(
        kind.type(), kind.title(), kind.status().value(), detail, TraceIds.currentOrNew(), errors);
  }
}
