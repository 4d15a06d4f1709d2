/*
 * どこで: 共通セキュリティ
 * 何を: 設定済みトークン一覧と照合して主体を返す
 * なぜ: 外部 IdP を持たない環境でも同じ認証境界でテスト・運用できるようにするため
 */
package com.siteplatform.common.security;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Optional;

public class StaticBearerTokenVerifier implements BearerTokenVerifier {

  private final ApiSecurityProperties properties;

  public StaticBearerTokenVerifier(ApiSecurityProperties properties) {
    this.properties = properties;
  }

  @Override
  public Optional<AuthenticatedPrincipal> verify(String token) {
    if (token == null || token.isBlank()) {
      return Optional.empty();
    }
    final byte[] actual = token.getBytes(StandardCharsets.UTF_8);
    // 一致位置による応答時間差を出さないよう、全件を定数時間比較する
    AuthenticatedPrincipal matched = null;
    for (ApiSecurityProperties.TokenGrant grant : properties.tokens()) {
      final byte[] expected = grant.token().getBytes(StandardCharsets.UTF_8);
      if (MessageDigest.isEqual(expected, actual) && matched == null) {
        matched = new AuthenticatedPrincipal(grant.subject(), grant.roles());
      }
    }
    return Optional.ofNullable(matched);
  }
}
