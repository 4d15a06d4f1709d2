/*
 * どこで: 共通ディスパッチ層
 * 何を: (resource, version) から VersionedResource を一意に解決する
 * なぜ: バージョン指定の有無・未登録・非推奨/削除を 1 か所で決定的に扱うため
 */
package com.siteplatform.common.dispatch;

import com.siteplatform.common.api.NotFoundException;
import com.siteplatform.common.api.UnsupportedVersionException;
import com.siteplatform.common.config.ApiVersioningProperties;
import com.siteplatform.common.version.ApiVersion;
import com.siteplatform.common.version.VersionKey;
import com.siteplatform.common.version.VersionLifecycleStore;
import com.siteplatform.common.version.VersionState;
import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class VersionRegistry {

  private static final Logger logger = LoggerFactory.getLogger(VersionRegistry.class);

  private final Map<String, NavigableMap<ApiVersion, VersionedResource<?>>> handlers;
  private final Map<VersionKey, VersionState> states;
  private final Optional<ApiVersion> defaultVersion;
  private final ApiMetrics apiMetrics;

  public VersionRegistry(
      List<VersionedResource<?>> resources,
      ApiVersioningProperties properties,
      VersionLifecycleStore lifecycleStore,
      ApiMetrics apiMetrics,
      Clock clock) {
    this.apiMetrics = apiMetrics;
    this.handlers = indexHandlers(resources);
    this.states = applyLifecycle(properties, lifecycleStore, Instant.now(clock));
    this.defaultVersion = properties.resolvedDefaultVersion();
    verifyDefaultVersion();
    logger.info(
        "api version registry ready resources={} states={} default_version={}",
        handlers.keySet(),
        states,
        defaultVersion.map(ApiVersion::toString).orElse("latest-active"));
  }

  /**
   * 役割: リクエストのリソース名とバージョントークンから処理系を選ぶ。
   *
   * 期待動作:
   * - トークン無し/空白は既定バージョン (設定値、未設定なら最新 ACTIVE) を使う。
   * - 解釈不能・未登録・REMOVED は UnsupportedVersionException とする。
   * - DEPRECATED は通常どおり解決し、呼び出し側が注記を付ける。
   * - このホストが扱わないリソースは NotFoundException とする。
   */
  public ResolvedVersion<?> resolve(String resource, String versionToken) {
    final NavigableMap<ApiVersion, VersionedResource<?>> versions = handlers.get(resource);
    if (versions == null) {
      throw new NotFoundException("resource not found: " + resource);
    }
    final boolean explicit = versionToken != null && !versionToken.isBlank();
    final Optional<ApiVersion> requested =
        explicit ? ApiVersion.tryParse(versionToken) : Optional.of(defaultFor(resource));
    final ResolvedVersion<?> resolved =
        requested.flatMap(version -> lookup(resource, version, versions)).orElse(null);
    if (resolved == null) {
      apiMetrics.recordUnsupported(resource);
      throw new UnsupportedVersionException(resource, explicit ? versionToken : "<default>");
    }
    apiMetrics.recordDispatch(
        resource,
        resolved.version().toString(),
        resolved.deprecated() ? ApiMetrics.OUTCOME_DEPRECATED : ApiMetrics.OUTCOME_RESOLVED);
    return resolved;
  }

  public List<ApiVersion> registeredVersions(String resource) {
    final NavigableMap<ApiVersion, VersionedResource<?>> versions = handlers.get(resource);
    return versions == null ? List.of() : List.copyOf(versions.keySet());
  }

  public VersionState state(String resource, ApiVersion version) {
    final VersionState state = states.get(new VersionKey(resource, version));
    if (state == null) {
      throw new IllegalArgumentException("not registered: " + resource + "@" + version);
    }
    return state;
  }

  public ApiVersion defaultFor(String resource) {
    if (defaultVersion.isPresent()) {
      return defaultVersion.get();
    }
    final NavigableMap<ApiVersion, VersionedResource<?>> versions = handlers.get(resource);
    if (versions == null) {
      throw new NotFoundException("resource not found: " + resource);
    }
    // 最新の ACTIVE を優先し、全て非推奨なら最新の DEPRECATED へフォールバックする
    return latestIn(resource, versions, VersionState.ACTIVE)
        .or(() -> latestIn(resource, versions, VersionState.DEPRECATED))
        .orElseThrow(() -> new UnsupportedVersionException(resource, "<default>"));
  }

  private Optional<ResolvedVersion<?>> lookup(
      String resource, ApiVersion version, NavigableMap<ApiVersion, VersionedResource<?>> versions) {
    final VersionedResource<?> handler = versions.get(version);
    if (handler == null) {
      return Optional.empty();
    }
    final VersionState state = states.get(new VersionKey(resource, version));
    if (!state.isResolvable()) {
      return Optional.empty();
    }
    return Optional.of(toResolved(handler, version, state));
  }

  private static <D> ResolvedVersion<D> toResolved(
      VersionedResource<D> handler, ApiVersion version, VersionState state) {
    return new ResolvedVersion<>(handler, version, state);
  }

  private Optional<ApiVersion> latestIn(
      String resource,
      NavigableMap<ApiVersion, VersionedResource<?>> versions,
      VersionState wanted) {
    return versions.descendingKeySet().stream()
        .filter(version -> states.get(new VersionKey(resource, version)) == wanted)
        .findFirst();
  }

  private static Map<String, NavigableMap<ApiVersion, VersionedResource<?>>> indexHandlers(
      List<VersionedResource<?>> resources) {
    final Map<String, NavigableMap<ApiVersion, VersionedResource<?>>> index = new HashMap<>();
    for (VersionedResource<?> resource : resources) {
      final NavigableMap<ApiVersion, VersionedResource<?>> versions =
          index.computeIfAbsent(resource.resource(), ignored -> new TreeMap<>());
      final VersionedResource<?> previous = versions.putIfAbsent(resource.version(), resource);
      if (previous != null) {
        throw new IllegalStateException(
            "duplicate handler for "
                + resource.resource()
                + "@"
                + resource.version()
                + ": "
                + previous.getClass().getName()
                + " and "
                + resource.getClass().getName());
      }
    }
    final Map<String, NavigableMap<ApiVersion, VersionedResource<?>>> frozen = new HashMap<>();
    index.forEach((name, versions) -> frozen.put(name, Collections.unmodifiableNavigableMap(versions)));
    return Map.copyOf(frozen);
  }

  private Map<VersionKey, VersionState> applyLifecycle(
      ApiVersioningProperties properties, VersionLifecycleStore lifecycleStore, Instant now) {
    final Map<VersionKey, VersionState> persisted = lifecycleStore.loadAll();
    final Map<VersionKey, VersionState> configured = new HashMap<>();
    for (ApiVersioningProperties.LifecycleEntry entry : properties.lifecycle()) {
      final VersionKey key = new VersionKey(entry.resource(), ApiVersion.of(entry.version()));
      if (!isRegistered(key)) {
        throw new IllegalStateException("lifecycle configured for unregistered version: " + key);
      }
      configured.put(key, entry.state());
    }
    final Map<VersionKey, VersionState> effective = new HashMap<>();
    handlers.forEach(
        (resource, versions) ->
            versions
                .keySet()
                .forEach(
                    version -> {
                      final VersionKey key = new VersionKey(resource, version);
                      final VersionState current = persisted.getOrDefault(key, VersionState.ACTIVE);
                      final VersionState target = configured.getOrDefault(key, current);
                      // 逆方向の遷移は IllegalStateException となり、起動を中断する
                      final VersionState next = current.transitionTo(target);
                      if (next != current || !persisted.containsKey(key)) {
                        lifecycleStore.save(key, next, now);
                        logger.info("api version lifecycle applied key={} {} -> {}", key, current, next);
                      }
                      effective.put(key, next);
                    }));
    return Map.copyOf(effective);
  }

  private boolean isRegistered(VersionKey key) {
    final NavigableMap<ApiVersion, VersionedResource<?>> versions = handlers.get(key.resource());
    return versions != null && versions.containsKey(key.version());
  }

  private void verifyDefaultVersion() {
    if (defaultVersion.isEmpty()) {
      return;
    }
    final ApiVersion version = defaultVersion.get();
    handlers.forEach(
        (resource, versions) -> {
          final VersionState state = states.get(new VersionKey(resource, version));
          if (state == null || !state.isResolvable()) {
            throw new IllegalStateException(
                "site.api.default-version " + version + " is not resolvable for " + resource);
          }
        });
  }
}
