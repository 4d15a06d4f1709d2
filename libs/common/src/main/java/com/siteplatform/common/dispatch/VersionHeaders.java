package com.siteplatform.common.dispatch;

import org.springframework.http.HttpHeaders;

public final class VersionHeaders {

  public static final String API_VERSION = "X-Api-Version";
  public static final String DEPRECATION = "Deprecation";
  public static final String WARNING = "Warning";

  private VersionHeaders() {}

  public static HttpHeaders of(String resource, ResolvedVersion<?> resolved) {
    final HttpHeaders headers = new HttpHeaders();
    headers.set(API_VERSION, resolved.version().toString());
    if (resolved.deprecated()) {
      headers.set(DEPRECATION, "true");
      headers.set(
          WARNING,
          "299 - \"API version " + resolved.version() + " of " + resource + " is deprecated\"");
    }
    return headers;
  }
}
