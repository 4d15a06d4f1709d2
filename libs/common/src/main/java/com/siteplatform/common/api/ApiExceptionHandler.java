/*
 * どこで: 共通 API 層
 * 何を: 例外を RFC7807 形式のエラー応答へ変換する
 * なぜ: 全ホストで固定のエラー契約を保ち、内部情報を外へ漏らさないため
 */
package com.siteplatform.common.api;

import com.fasterxml.jackson.databind.JsonMappingException;
import com.siteplatform.common.dispatch.ApiMetrics;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

@RestControllerAdvice
@RequiredArgsConstructor
public class ApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);
  private static final String INTERNAL_DETAIL = "an unexpected error occurred";

  private final ApiMetrics apiMetrics;

  @ExceptionHandler(NotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleNotFound(NotFoundException ex) {
    return respond(ApiErrorKind.NOT_FOUND, ex.getMessage(), Map.of());
  }

  @ExceptionHandler(NoResourceFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleNoResource(NoResourceFoundException ex) {
    return respond(ApiErrorKind.NOT_FOUND, "no route for /" + ex.getResourcePath(), Map.of());
  }

  @ExceptionHandler(ValidationException.class)
  public ResponseEntity<ApiErrorResponse> handleValidation(ValidationException ex) {
    return respond(ApiErrorKind.VALIDATION, ex.getMessage(), ex.errors());
  }

  @ExceptionHandler(UnsupportedVersionException.class)
  public ResponseEntity<ApiErrorResponse> handleUnsupportedVersion(UnsupportedVersionException ex) {
    return respond(ApiErrorKind.UNSUPPORTED_VERSION, ex.getMessage(), Map.of());
  }

  @ExceptionHandler(BusinessRuleException.class)
  public ResponseEntity<ApiErrorResponse> handleBusinessRule(BusinessRuleException ex) {
    return respond(ApiErrorKind.BUSINESS_RULE, ex.getMessage(), Map.of());
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
    // JSON パーサの内部文言は露出せず、短文へ正規化する。
    final String rawMessage = Optional.ofNullable(ex.getMessage()).orElse("");
    if (rawMessage.contains("Required request body is missing")) {
      return respond(ApiErrorKind.MALFORMED_REQUEST, "request body is required", Map.of());
    }
    if (ex.getCause() instanceof JsonMappingException mapping && !mapping.getPath().isEmpty()) {
      final String field = JsonPaths.describe(mapping);
      return respond(
          ApiErrorKind.VALIDATION,
          "request validation failed",
          Map.of(field, List.of(field + " has an invalid value")));
    }
    return respond(ApiErrorKind.MALFORMED_REQUEST, "request body is invalid", Map.of());
  }

  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ResponseEntity<ApiErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
    return respond(
        ApiErrorKind.VALIDATION,
        "request validation failed",
        Map.of(ex.getName(), List.of(ex.getName() + " has an invalid value")));
  }

  @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
  public ResponseEntity<ApiErrorResponse> handleMethodNotSupported(
      HttpRequestMethodNotSupportedException ex) {
    return respond(
        ApiErrorKind.METHOD_NOT_ALLOWED, ex.getMethod() + " is not supported here", Map.of());
  }

  @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
  public ResponseEntity<ApiErrorResponse> handleMediaTypeNotSupported(
      HttpMediaTypeNotSupportedException ex) {
    final String supported =
        ex.getSupportedMediaTypes().stream().map(Object::toString).collect(Collectors.joining(", "));
    return respond(
        ApiErrorKind.UNSUPPORTED_MEDIA_TYPE, "supported content types: " + supported, Map.of());
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiErrorResponse> handleUnexpected(Exception ex) {
    logger.error("unhandled exception while serving request", ex);
    return respond(ApiErrorKind.INTERNAL, INTERNAL_DETAIL, Map.of());
  }

  private ResponseEntity<ApiErrorResponse> respond(
      ApiErrorKind kind, String detail, Map<String, List<String>> errors) {
    apiMetrics.recordError(kind);
    if (kind != ApiErrorKind.INTERNAL) {
      logger.info("request rejected kind={} detail={}", kind, detail);
    }
    return ResponseEntity.status(kind.status()).body(ApiErrorResponse.of(kind, detail, errors));
  }
}
