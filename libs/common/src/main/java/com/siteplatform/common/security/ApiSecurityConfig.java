package com.siteplatform.common.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.siteplatform.common.config.CorsProperties;
import com.siteplatform.common.dispatch.ApiMetrics;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.core.userdetails.UserDetailsService;
import org.springframework.security.core.userdetails.UsernameNotFoundException;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.access.intercept.AuthorizationFilter;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsConfigurationSource;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;

@Configuration
public class ApiSecurityConfig {

  @Bean
  BearerTokenVerifier bearerTokenVerifier(ApiSecurityProperties properties) {
    return new StaticBearerTokenVerifier(properties);
  }

  // 認証は bearer トークンのみ。既定のインメモリユーザー生成を止める
  @Bean
  UserDetailsService userDetailsService() {
    return username -> {
      throw new UsernameNotFoundException("password login is not supported");
    };
  }

  @Bean
  BearerTokenAuthenticationFilter bearerTokenAuthenticationFilter(BearerTokenVerifier verifier) {
    return new BearerTokenAuthenticationFilter(verifier);
  }

  @Bean
  ApiAuthenticationEntryPoint apiAuthenticationEntryPoint(
      ObjectMapper objectMapper, ApiMetrics apiMetrics) {
    return new ApiAuthenticationEntryPoint(objectMapper, apiMetrics);
  }

  @Bean
  CorsConfigurationSource corsConfigurationSource(CorsProperties properties) {
    final CorsConfiguration configuration = new CorsConfiguration();
    configuration.setAllowedOrigins(properties.allowedOrigins());
    configuration.setAllowedMethods(properties.allowedMethods());
    configuration.addAllowedHeader("*");
    configuration.addExposedHeader("X-Api-Version");
    configuration.addExposedHeader("Deprecation");
    configuration.addExposedHeader("Warning");
    configuration.addExposedHeader("X-Request-Id");
    final UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
    source.registerCorsConfiguration("/api/**", configuration);
    return source;
  }

  @Bean
  SecurityFilterChain securityFilterChain(
      HttpSecurity http,
      BearerTokenAuthenticationFilter bearerTokenAuthenticationFilter,
      ApiAuthenticationEntryPoint apiAuthenticationEntryPoint,
      CorsConfigurationSource corsConfigurationSource)
      throws Exception {
    http.csrf(csrf -> csrf.disable())
        .cors(cors -> cors.configurationSource(corsConfigurationSource))
        .sessionManagement(
            session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .addFilterBefore(bearerTokenAuthenticationFilter, AuthorizationFilter.class)
        .exceptionHandling(handling -> handling.authenticationEntryPoint(apiAuthenticationEntryPoint))
        .authorizeHttpRequests(
            auth ->
                auth.requestMatchers(
                        "/",
                        "/error",
                        "/actuator/health",
                        "/actuator/health/**",
                        "/actuator/info")
                    .permitAll()
                    .anyRequest()
                    .authenticated());
    return http.build();
  }
}
