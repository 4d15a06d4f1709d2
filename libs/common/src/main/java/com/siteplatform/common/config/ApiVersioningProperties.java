/*
 * どこで: 共通設定バインド
 * 何を: 既定 API バージョンと (resource, version) のライフサイクル設定を保持する
 * なぜ: バージョン解決の既定値と非推奨/削除を、デプロイごとに明示・検証できるようにするため
 */
package com.siteplatform.common.config;

import com.siteplatform.common.version.ApiVersion;
import com.siteplatform.common.version.VersionState;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import java.util.Optional;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "site.api")
@Validated
public record ApiVersioningProperties(String defaultVersion, @Valid List<LifecycleEntry> lifecycle) {

  public ApiVersioningProperties {
    defaultVersion = defaultVersion == null || defaultVersion.isBlank() ? null : defaultVersion.trim();
    lifecycle = lifecycle == null ? List.of() : List.copyOf(lifecycle);
  }

  @AssertTrue(message = "site.api.default-version must look like 1 or 1.0")
  public boolean isDefaultVersionWellFormed() {
    return defaultVersion == null || ApiVersion.tryParse(defaultVersion).isPresent();
  }

  /** 未設定なら空。空の場合は各リソースの最新 ACTIVE バージョンを既定とする。 */
  public Optional<ApiVersion> resolvedDefaultVersion() {
    return Optional.ofNullable(defaultVersion).flatMap(ApiVersion::tryParse);
  }

  public record LifecycleEntry(
      @NotBlank String resource, @NotBlank String version, @NotNull VersionState state) {

    @AssertTrue(message = "site.api.lifecycle[].version must look like 1 or 1.0")
    public boolean isVersionWellFormed() {
      // null/空白は @NotBlank で検出する前提。
      return version == null || version.isBlank() || ApiVersion.tryParse(version).isPresent();
    }
  }
}
