/*
 * どこで: Materials テスト基盤
 * 何を: Testcontainers(Postgres) と DataSource/Flyway の共通設定を提供する
 * なぜ: リポジトリと API の統合テストで同じ実 DB 構成を使うため
 */
package com.siteplatform.materials;

import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;

public abstract class AbstractPostgresContainerTest {

  // JVM 内のテスト全体で共通の Postgres コンテナを使い回す
  static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16-alpine");

  static {
    // @DynamicPropertySource が拡張より先に評価されても接続先が起動済みになるよう明示起動する
    POSTGRES.start();
  }

  @DynamicPropertySource
  static void registerProperties(DynamicPropertyRegistry registry) {
    registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
    registry.add("spring.datasource.username", POSTGRES::getUsername);
    registry.add("spring.datasource.password", POSTGRES::getPassword);

    registry.add("spring.datasource.hikari.schema", () -> "materials");

    registry.add("spring.flyway.enabled", () -> "true");
    registry.add("spring.flyway.locations", () -> "classpath:db/migration,classpath:db/common");
    registry.add("spring.flyway.default-schema", () -> "materials");
    registry.add("spring.flyway.schemas", () -> "materials");
    registry.add("spring.flyway.create-schemas", () -> "true");
    registry.add("spring.flyway.table", () -> "flyway_schema_history_materials");
  }
}
