/*
 * どこで: 共通 Web 設定 (サーブレットフィルタ)
 * 何を: X-Request-Id とリクエスト基本情報を MDC へ載せ、応答ヘッダへ返す
 * なぜ: 認証やハンドラ解決より前に失敗した応答 (401/405/415) でも traceId を揃えるため
 */
package com.siteplatform.common.config;

import com.siteplatform.common.TraceIds;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestIdFilter extends OncePerRequestFilter {

  public static final String HEADER_REQUEST_ID = "X-Request-Id";

  static final String MDC_HTTP_METHOD = "http_method";
  static final String MDC_HTTP_PATH = "http_path";
  static final String MDC_CLIENT_IP = "client_ip";

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    final String requestId = resolveRequestId(request);
    MDC.put(TraceIds.MDC_KEY, requestId);
    MDC.put(MDC_HTTP_METHOD, request.getMethod());
    MDC.put(MDC_HTTP_PATH, request.getRequestURI());
    final String clientIp = resolveClientIp(request);
    if (clientIp != null) {
      MDC.put(MDC_CLIENT_IP, clientIp);
    }
    response.setHeader(HEADER_REQUEST_ID, requestId);
    try {
      filterChain.doFilter(request, response);
    } finally {
      MDC.remove(TraceIds.MDC_KEY);
      MDC.remove(MDC_HTTP_METHOD);
      MDC.remove(MDC_HTTP_PATH);
      MDC.remove(MDC_CLIENT_IP);
    }
  }

  private String resolveRequestId(HttpServletRequest request) {
    final String requestId = request.getHeader(HEADER_REQUEST_ID);
    if (requestId != null && !requestId.isBlank()) {
      return requestId;
    }
    return TraceIds.newTraceId();
  }

  private String resolveClientIp(HttpServletRequest request) {
    final String xForwardedFor = request.getHeader("X-Forwarded-For");
    if (xForwardedFor == null || xForwardedFor.isBlank()) {
      return request.getRemoteAddr();
    }
    final int commaIndex = xForwardedFor.indexOf(',');
    if (commaIndex < 0) {
      return xForwardedFor.trim();
    }
    return xForwardedFor.substring(0, commaIndex).trim();
  }
}
