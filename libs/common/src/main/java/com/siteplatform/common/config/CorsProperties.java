package com.siteplatform.common.config;

import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "site.cors")
public record CorsProperties(List<String> allowedOrigins, List<String> allowedMethods) {

  public CorsProperties {
    allowedOrigins = allowedOrigins == null ? List.of() : List.copyOf(allowedOrigins);
    allowedMethods =
        allowedMethods == null || allowedMethods.isEmpty()
            ? List.of("GET", "POST", "PUT", "DELETE")
            : List.copyOf(allowedMethods);
  }
}
