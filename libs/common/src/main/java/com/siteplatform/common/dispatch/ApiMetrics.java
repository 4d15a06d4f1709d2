/*
 * どこで: 共通ディスパッチ層
 * 何を: バージョン解決の結果とエラー種別をメトリクスとして記録する
 * なぜ: 非推奨バージョンの利用状況や未対応バージョン要求を運用で把握するため
 */
package com.siteplatform.common.dispatch;

import com.siteplatform.common.api.ApiErrorKind;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class ApiMetrics {

  static final String METRIC_DISPATCH_TOTAL = "site.api.dispatch";
  static final String METRIC_ERROR_TOTAL = "site.api.errors";

  public static final String OUTCOME_RESOLVED = "resolved";
  public static final String OUTCOME_DEPRECATED = "deprecated";
  public static final String OUTCOME_UNSUPPORTED = "unsupported";

  // 未対応トークンはクライアント入力そのものなので固定値に丸める
  static final String VERSION_UNSUPPORTED = "invalid";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();

  public ApiMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  public void recordDispatch(String resource, String version, String outcome) {
    final String safeVersion = version == null ? "default" : version;
    counter(
            METRIC_DISPATCH_TOTAL,
            "Versioned request dispatch outcomes",
            Tags.of("resource", resource, "version", safeVersion, "outcome", outcome))
        .increment();
  }

  public void recordUnsupported(String resource) {
    recordDispatch(resource, VERSION_UNSUPPORTED, OUTCOME_UNSUPPORTED);
  }

  public void recordError(ApiErrorKind kind) {
    counter(METRIC_ERROR_TOTAL, "API error responses by kind", Tags.of("kind", kind.name()))
        .increment();
  }

  private Counter counter(String name, String description, Tags tags) {
    final StringBuilder key = new StringBuilder(name);
    tags.forEach(tag -> key.append('|').append(tag.getKey()).append('=').append(tag.getValue()));
    return counters.computeIfAbsent(
        key.toString(),
        ignored ->
            Counter.builder(name).description(description).tags(tags).register(meterRegistry));
  }
}
