/*
 * どこで: 共通 API エラー
 * 何を: 内部エラー種別と HTTP ステータスの固定対応表を定義する
 * なぜ: 全ホストで同じ失敗契約を返し、クライアントの分岐を type で行えるようにするため
 */
package com.siteplatform.common.api;

import org.springframework.http.HttpStatus;

public enum ApiErrorKind {
  NOT_FOUND(HttpStatus.NOT_FOUND, "not-found"),
  VALIDATION(HttpStatus.BAD_REQUEST, "validation"),
  MALFORMED_REQUEST(HttpStatus.BAD_REQUEST, "malformed-request"),
  UNSUPPORTED_VERSION(HttpStatus.BAD_REQUEST, "unsupported-version"),
  BUSINESS_RULE(HttpStatus.CONFLICT, "business-rule"),
  UNAUTHORIZED(HttpStatus.UNAUTHORIZED, "unauthorized"),
  METHOD_NOT_ALLOWED(HttpStatus.METHOD_NOT_ALLOWED, "method-not-allowed"),
  UNSUPPORTED_MEDIA_TYPE(HttpStatus.UNSUPPORTED_MEDIA_TYPE, "unsupported-media-type"),
  INTERNAL(HttpStatus.INTERNAL_SERVER_ERROR, "internal");

  private static final String TYPE_PREFIX = "urn:site-platform:problem:";

  private final HttpStatus status;
  private final String slug;

  ApiErrorKind(HttpStatus status, String slug) {
    this.status = status;
    this.slug = slug;
  }

  public HttpStatus status() {
    return status;
  }

  public String type() {
    return TYPE_PREFIX + slug;
  }

  public String title() {
    return status.getReasonPhrase();
  }
}
