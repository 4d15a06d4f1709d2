/*
 * どこで: 共通 API エラー
 * 何を: 入力は妥当だが業務ルールに違反した状態 (409) を表す
 * なぜ: 不正な状態遷移や一意制約違反を入力エラーと区別するため
 */
package com.siteplatform.common.api;

public class BusinessRuleException extends RuntimeException {

  public BusinessRuleException(String message) {
    super(message);
  }

  public BusinessRuleException(String message, Throwable cause) {
    super(message, cause);
  }
}
