package com.siteplatform.common;

import java.util.UUID;
import org.slf4j.MDC;

public final class TraceIds {

  public static final String MDC_KEY = "request_id";

  private TraceIds() {}

  public static String newTraceId() {
    return UUID.randomUUID().toString();
  }

  // MDC にリクエスト ID があればそれを使い、無ければ新規採番する
  public static String currentOrNew() {
    final String current = MDC.get(MDC_KEY);
    if (current == null || current.isBlank()) {
      return newTraceId();
    }
    return current;
  }
}
