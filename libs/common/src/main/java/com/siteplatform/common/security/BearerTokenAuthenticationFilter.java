package com.siteplatform.common.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

public class BearerTokenAuthenticationFilter extends OncePerRequestFilter {

  private static final Logger logger =
      LoggerFactory.getLogger(BearerTokenAuthenticationFilter.class);
  private static final String BEARER_PREFIX = "Bearer ";
  private static final String API_PATH_PREFIX = "/api/";

  private final BearerTokenVerifier verifier;

  public BearerTokenAuthenticationFilter(BearerTokenVerifier verifier) {
    this.verifier = verifier;
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    final String uri = request.getRequestURI();
    return uri == null || !uri.startsWith(API_PATH_PREFIX);
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    final String token = extractToken(request.getHeader(HttpHeaders.AUTHORIZATION));
    if (token != null) {
      final Optional<AuthenticatedPrincipal> principal = verifier.verify(token);
      if (principal.isPresent()) {
        final UsernamePasswordAuthenticationToken authentication =
            new UsernamePasswordAuthenticationToken(
                principal.get().subject(), "N/A", toAuthorities(principal.get().roles()));
        SecurityContextHolder.getContext().setAuthentication(authentication);
        logger.debug(
            "bearer authentication established for path={} subject={}",
            request.getRequestURI(),
            principal.get().subject());
      } else {
        logger.warn("bearer token rejected on path={}", request.getRequestURI());
      }
    }
    filterChain.doFilter(request, response);
  }

  private String extractToken(String authorization) {
    if (authorization == null || !authorization.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
      return null;
    }
    final String token = authorization.substring(BEARER_PREFIX.length()).trim();
    return token.isEmpty() ? null : token;
  }

  private List<SimpleGrantedAuthority> toAuthorities(List<String> roles) {
    return roles.stream()
        .filter(role -> role != null && !role.isBlank())
        .map(role -> role.startsWith("ROLE_") ? role : "ROLE_" + role.trim())
        .map(SimpleGrantedAuthority::new)
        .toList();
  }
}
