/*
 * どこで: 共通セキュリティ
 * 何を: 未認証アクセスを 401 の標準エラー本文へ変換する
 * なぜ: フィルタ段階で拒否した場合も、コントローラ例外と同じエラー契約を返すため
 */
package com.siteplatform.common.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.siteplatform.common.TraceIds;
import com.siteplatform.common.api.ApiErrorKind;
import com.siteplatform.common.api.ApiErrorResponse;
import com.siteplatform.common.config.RequestIdFilter;
import com.siteplatform.common.dispatch.ApiMetrics;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Map;
import org.springframework.http.MediaType;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;

public class ApiAuthenticationEntryPoint implements AuthenticationEntryPoint {

  private final ObjectMapper objectMapper;
  private final ApiMetrics apiMetrics;

  public ApiAuthenticationEntryPoint(ObjectMapper objectMapper, ApiMetrics apiMetrics) {
    this.objectMapper = objectMapper;
    this.apiMetrics = apiMetrics;
  }

  @Override
  public void commence(
      HttpServletRequest request,
      HttpServletResponse response,
      AuthenticationException authException)
      throws IOException {
    final String traceId = TraceIds.currentOrNew();
    final ApiErrorKind kind = ApiErrorKind.UNAUTHORIZED;
    final ApiErrorResponse body =
        new ApiErrorResponse(
            kind.type(),
            kind.title(),
            kind.status().value(),
            "a valid bearer token is required",
            traceId,
            Map.of());
    apiMetrics.recordError(kind);
    response.setStatus(kind.status().value());
    response.setContentType(MediaType.APPLICATION_JSON_VALUE);
    response.setHeader("WWW-Authenticate", "Bearer");
    response.setHeader(RequestIdFilter.HEADER_REQUEST_ID, traceId);
    objectMapper.writeValue(response.getOutputStream(), body);
  }
}
