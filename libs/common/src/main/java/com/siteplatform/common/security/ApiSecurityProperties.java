/*
 * どこで: 共通セキュリティ設定
 * 何を: Bearer トークンとそれに対応する主体/ロールの設定を保持する
 * なぜ: 外部認証基盤の代わりに、環境ごとの静的トークンで API 呼び出しを検証するため
 */
package com.siteplatform.common.security;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "site.security")
@Validated
public record ApiSecurityProperties(@Valid List<TokenGrant> tokens) {

  public ApiSecurityProperties {
    tokens = tokens == null ? List.of() : List.copyOf(tokens);
  }

  public record TokenGrant(@NotBlank String token, @NotBlank String subject, List<String> roles) {

    public TokenGrant {
      roles = roles == null ? List.of() : List.copyOf(roles);
    }
  }
}
