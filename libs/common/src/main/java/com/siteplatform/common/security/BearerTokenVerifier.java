package com.siteplatform.common.security;

import java.util.Optional;

/** Bearer トークンを受理/拒否し、受理時に識別クレームを返す外部認証基盤の境界。 */
public interface BearerTokenVerifier {

  Optional<AuthenticatedPrincipal> verify(String token);
}
