/*
 * どこで: VersionRegistry の単体テスト
 * 何を: 登録・既定バージョン・非推奨/削除・ライフサイクル永続化の挙動を検証する
 * なぜ: バージョン解決が決定的で、逆方向の遷移が起動時に拒否されることを保証するため
 */
package com.siteplatform.common.dispatch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.siteplatform.common.api.NotFoundException;
import com.siteplatform.common.api.UnsupportedVersionException;
import com.siteplatform.common.config.ApiVersioningProperties;
import com.siteplatform.common.config.ApiVersioningProperties.LifecycleEntry;
import com.siteplatform.common.repository.ListFilter;
import com.siteplatform.common.version.ApiVersion;
import com.siteplatform.common.version.VersionKey;
import com.siteplatform.common.version.VersionLifecycleStore;
import com.siteplatform.common.version.VersionState;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class VersionRegistryTest {

  private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-02-01T00:00:00Z"), ZoneOffset.UTC);
  private static final ApiVersion V1 = new ApiVersion(1, 0);
  private static final ApiVersion V2 = new ApiVersion(2, 0);

  private VersionLifecycleStore store;
  private SimpleMeterRegistry meterRegistry;
  private ApiMetrics apiMetrics;

  @BeforeEach
  void setUp() {
    store = mock(VersionLifecycleStore.class);
    when(store.loadAll()).thenReturn(Map.of());
    meterRegistry = new SimpleMeterRegistry();
    apiMetrics = new ApiMetrics(meterRegistry);
  }

  @Test
  void explicitVersionResolvesToItsHandler() {
    final FakeResource v1 = new FakeResource("notes", V1);
    final FakeResource v2 = new FakeResource("notes", V2);
    final VersionRegistry registry = registry(List.of(v1, v2), properties(null));

    final ResolvedVersion<?> resolved = registry.resolve("notes", "2");

    assertThat(resolved.handler()).isSameAs(v2);
    assertThat(resolved.version()).isEqualTo(V2);
    assertThat(resolved.deprecated()).isFalse();
    assertThat(
            meterRegistry
                .get("site.api.dispatch")
                .tag("resource", "notes")
                .tag("outcome", ApiMetrics.OUTCOME_RESOLVED)
                .counter()
                .count())
        .isEqualTo(1.0);
  }

  @Test
  void missingTokenUsesLatestActiveWhenNoDefaultConfigured() {
    final VersionRegistry registry =
        registry(
            List.of(new FakeResource("notes", V1), new FakeResource("notes", V2)),
            properties(null));

    assertThat(registry.resolve("notes", null).version()).isEqualTo(V2);
    assertThat(registry.resolve("notes", " ").version()).isEqualTo(V2);
  }

  @Test
  void missingTokenUsesConfiguredDefault() {
    final VersionRegistry registry =
        registry(
            List.of(new FakeResource("notes", V1), new FakeResource("notes", V2)),
            properties("1"));

    assertThat(registry.resolve("notes", null).version()).isEqualTo(V1);
  }

  @Test
  void latestActiveSkipsDeprecatedVersions() {
    final VersionRegistry registry =
        registry(
            List.of(new FakeResource("notes", V1), new FakeResource("notes", V2)),
            properties(null, new LifecycleEntry("notes", "2.0", VersionState.DEPRECATED)));

    assertThat(registry.defaultFor("notes")).isEqualTo(V1);
  }

  @Test
  void deprecatedVersionResolvesAndIsFlagged() {
    final FakeResource v1 = new FakeResource("notes", V1);
    final VersionRegistry registry =
        registry(
            List.of(v1, new FakeResource("notes", V2)),
            properties(null, new LifecycleEntry("notes", "1", VersionState.DEPRECATED)));

    final ResolvedVersion<?> resolved = registry.resolve("notes", "1.0");

    assertThat(resolved.handler()).isSameAs(v1);
    assertThat(resolved.deprecated()).isTrue();
    verify(store).save(eq(new VersionKey("notes", V1)), eq(VersionState.DEPRECATED), any());
  }

  @Test
  void removedUnregisteredAndGarbledTokensAreUnsupported() {
    final VersionRegistry registry =
        registry(
            List.of(new FakeResource("notes", V1), new FakeResource("notes", V2)),
            properties(null, new LifecycleEntry("notes", "1.0", VersionState.REMOVED)));

    assertThatThrownBy(() -> registry.resolve("notes", "1"))
        .isInstanceOf(UnsupportedVersionException.class);
    assertThatThrownBy(() -> registry.resolve("notes", "3"))
        .isInstanceOf(UnsupportedVersionException.class);
    assertThatThrownBy(() -> registry.resolve("notes", "two"))
        .isInstanceOf(UnsupportedVersionException.class);
  }

  @Test
  void unsupportedTokensDoNotGrowMeterCount() {
    final VersionRegistry registry = registry(List.of(new FakeResource("notes", V1)), properties(null));

    for (int i = 0; i < 500; i++) {
      final String token = "garbage" + i;
      assertThatThrownBy(() -> registry.resolve("notes", token))
          .isInstanceOf(UnsupportedVersionException.class);
    }

    assertThat(meterRegistry.getMeters()).hasSize(1);
    assertThat(
            meterRegistry
                .get("site.api.dispatch")
                .tag("version", "invalid")
                .counter()
                .count())
        .isEqualTo(500.0);
  }

  @Test
  void unknownResourceIsNotFound() {
    final VersionRegistry registry = registry(List.of(new FakeResource("notes", V1)), properties(null));

    assertThatThrownBy(() -> registry.resolve("widgets", "1"))
        .isInstanceOf(NotFoundException.class);
  }

  @Test
  void duplicateRegistrationFailsAtStartup() {
    assertThatThrownBy(
            () ->
                registry(
                    List.of(new FakeResource("notes", V1), new FakeResource("notes", new ApiVersion(1, 0))),
                    properties(null)))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("duplicate handler for notes@1.0");
  }

  @Test
  void backwardTransitionFromPersistedStateFailsAtStartup() {
    when(store.loadAll()).thenReturn(Map.of(new VersionKey("notes", V1), VersionState.DEPRECATED));

    assertThatThrownBy(
            () ->
                registry(
                    List.of(new FakeResource("notes", V1)),
                    properties(null, new LifecycleEntry("notes", "1.0", VersionState.ACTIVE))))
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  void persistedStateSurvivesWhenConfigurationIsSilent() {
    when(store.loadAll()).thenReturn(Map.of(new VersionKey("notes", V1), VersionState.DEPRECATED));

    final VersionRegistry registry =
        registry(List.of(new FakeResource("notes", V1)), properties(null));

    assertThat(registry.state("notes", V1)).isEqualTo(VersionState.DEPRECATED);
    verify(store, never()).save(eq(new VersionKey("notes", V1)), any(), any());
  }

  @Test
  void lifecycleForUnregisteredVersionFailsAtStartup() {
    assertThatThrownBy(
            () ->
                registry(
                    List.of(new FakeResource("notes", V1)),
                    properties(null, new LifecycleEntry("notes", "4.0", VersionState.DEPRECATED))))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("notes@4.0");
  }

  @Test
  void defaultVersionMustBeResolvableForEveryResource() {
    assertThatThrownBy(
            () ->
                registry(
                    List.of(new FakeResource("notes", V1), new FakeResource("tasks", V2)),
                    properties("1.0")))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("tasks");
  }

  private VersionRegistry registry(List<VersionedResource<?>> resources, ApiVersioningProperties properties) {
    return new VersionRegistry(resources, properties, store, apiMetrics, CLOCK);
  }

  private static ApiVersioningProperties properties(String defaultVersion, LifecycleEntry... entries) {
    return new ApiVersioningProperties(defaultVersion, List.of(entries));
  }

  private static final class FakeResource implements VersionedResource<String> {

    private final String resource;
    private final ApiVersion version;

    FakeResource(String resource, ApiVersion version) {
      this.resource = resource;
      this.version = version;
    }

    @Override
    public String resource() {
      return resource;
    }

    @Override
    public ApiVersion version() {
      return version;
    }

    @Override
    public Class<String> dtoType() {
      return String.class;
    }

    @Override
    public long idOf(String dto) {
      return 0L;
    }

    @Override
    public String get(long id) {
      return resource + "@" + version + "#" + id;
    }

    @Override
    public List<String> list(ListFilter filter) {
      return List.of();
    }

    @Override
    public String create(String dto) {
      return dto;
    }

    @Override
    public String update(long id, String dto) {
      return dto;
    }

    @Override
    public void delete(long id) {}
  }
}
