/*
 * どこで: Common 共通設定
 * 何を: Clock と共通設定プロパティを DI 可能にする
 * なぜ: 各ホストで同一の時刻注入と設定バインドを使うため
 */
package com.siteplatform.common.config;

import com.siteplatform.common.security.ApiSecurityProperties;
import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({
  ApiVersioningProperties.class,
  CorsProperties.class,
  ApiSecurityProperties.class
})
public class PlatformCommonConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
