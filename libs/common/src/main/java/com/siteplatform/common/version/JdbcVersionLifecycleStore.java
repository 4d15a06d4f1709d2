/*
 * どこで: API バージョニングのデータアクセス
 * 何を: api_version_lifecycle テーブルの参照/更新を行う
 * なぜ: 設定から戻しても DEPRECATED/REMOVED が復活しないよう、適用済み状態を記録するため
 */
package com.siteplatform.common.version;

import static com.siteplatform.common.JdbcTimestampUtils.toTimestamp;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class JdbcVersionLifecycleStore implements VersionLifecycleStore {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  @Override
  public Map<VersionKey, VersionState> loadAll() {
    final String sql =
        """
        SELECT resource, version, state
        FROM api_version_lifecycle
        ORDER BY resource, version
        """;
    final Map<VersionKey, VersionState> states = new LinkedHashMap<>();
    jdbcTemplate.query(
        sql,
        new MapSqlParameterSource(),
        rs -> {
          final VersionKey key =
              new VersionKey(rs.getString("resource"), ApiVersion.of(rs.getString("version")));
          states.put(key, VersionState.valueOf(rs.getString("state")));
        });
    return states;
  }

  @Override
  public void save(VersionKey key, VersionState state, Instant changedAt) {
    final String sql =
        """
        INSERT INTO api_version_lifecycle (resource, version, state, changed_at)
        VALUES (:resource, :version, :state, :changedAt)
        ON CONFLICT (resource, version)
        DO UPDATE SET
          state = EXCLUDED.state,
          changed_at = EXCLUDED.changed_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("resource", key.resource())
            .addValue("version", key.version().toString())
            .addValue("state", state.name())
            .addValue("changedAt", toTimestamp(changedAt));
    jdbcTemplate.update(sql, params);
  }
}
