package com.siteplatform.common.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.servlet.HandlerMapping;

class RequestMdcInterceptorTest {

  private final RequestMdcInterceptor interceptor = new RequestMdcInterceptor();

  @AfterEach
  void cleanup() {
    MDC.clear();
    SecurityContextHolder.clearContext();
  }

  @Test
  void putAndRemoveMdcValuesAroundRequestLifecycle() {
    final MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/v2/projects/7");
    request.setAttribute(
        HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE,
        Map.of("version", "2", "resource", "projects", "id", "7"));
    SecurityContextHolder.getContext()
        .setAuthentication(
            new UsernamePasswordAuthenticationToken(
                "site-manager", "N/A", List.of(new SimpleGrantedAuthority("ROLE_USER"))));
    final MockHttpServletResponse response = new MockHttpServletResponse();
    MDC.put("request_id", "req-1");

    interceptor.preHandle(request, response, new Object());

    assertThat(MDC.get("api_resource")).isEqualTo("projects");
    assertThat(MDC.get("api_version")).isEqualTo("2");
    assertThat(MDC.get("user_id")).isEqualTo("site-manager");

    interceptor.afterCompletion(request, response, new Object(), null);

    assertThat(MDC.get("api_resource")).isNull();
    assertThat(MDC.get("user_id")).isNull();
    // リクエスト ID はフィルタの管轄なので残る
    assertThat(MDC.get("request_id")).isEqualTo("req-1");
  }

  @Test
  void skipsAnonymousUser() {
    final MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/projects");
    final MockHttpServletResponse response = new MockHttpServletResponse();

    interceptor.preHandle(request, response, new Object());

    assertThat(MDC.get("user_id")).isNull();
    assertThat(MDC.get("api_resource")).isNull();
  }
}
