package com.siteplatform.common.security;

import java.util.List;

/** 認証基盤が返す識別クレーム。 */
public record AuthenticatedPrincipal(String subject, List<String> roles) {

  public AuthenticatedPrincipal {
    roles = roles == null ? List.of() : List.copyOf(roles);
  }
}
