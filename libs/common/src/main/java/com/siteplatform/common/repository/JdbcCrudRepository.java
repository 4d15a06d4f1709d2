/*
 * どこで: 共通データアクセス
 * 何を: NamedParameterJdbcTemplate 上に汎用 CRUD を一度だけ実装する
 * なぜ: 各ホストのリポジトリを列定義と行マッピングだけに絞るため
 */
package com.siteplatform.common.repository;

import static com.siteplatform.common.JdbcTimestampUtils.toTimestamp;

import com.siteplatform.common.api.ValidationErrors;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

public abstract class JdbcCrudRepository<E> implements CrudRepository<E> {

  private static final String FILTER_PARAM_PREFIX = "filter_";

  protected final NamedParameterJdbcTemplate jdbcTemplate;
  protected final Clock clock;

  protected JdbcCrudRepository(NamedParameterJdbcTemplate jdbcTemplate, Clock clock) {
    this.jdbcTemplate = jdbcTemplate;
    this.clock = clock;
  }

  protected abstract String tableName();

  /** id/created_at/updated_at を除いたドメイン列。{@link #bind} のパラメータ名と一致させる。 */
  protected abstract List<String> columns();

  protected abstract MapSqlParameterSource bind(E entity);

  protected abstract E mapRow(ResultSet rs, int rowNum) throws SQLException;

  /** クエリパラメータ名から許可列への対応。未登録の名前は 400 になる。 */
  protected Map<String, FilterField> filterFields() {
    return Map.of();
  }

  @Override
  public Optional<E> get(long id) {
    final String sql = "SELECT * FROM " + tableName() + " WHERE id = :id";
    return jdbcTemplate
        .query(sql, new MapSqlParameterSource("id", id), this::mapRow)
        .stream()
        .findFirst();
  }

  @Override
  public List<E> list(ListFilter filter) {
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("limit", filter.limit())
            .addValue("offset", filter.offset());
    final String where = buildWhere(filter, params);
    final String sql =
        "SELECT * FROM " + tableName() + where + " ORDER BY id LIMIT :limit OFFSET :offset";
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  @Override
  public E create(E entity) {
    final Instant now = Instant.now(clock);
    final String columnList = String.join(", ", columns());
    final String valueList =
        columns().stream().map(column -> ":" + column).collect(Collectors.joining(", "));
    final String sql =
        "INSERT INTO "
            + tableName()
            + " ("
            + columnList
            + ", created_at, updated_at) VALUES ("
            + valueList
            + ", :created_at, :updated_at) RETURNING *";
    final MapSqlParameterSource params =
        bind(entity)
            .addValue("created_at", toTimestamp(now))
            .addValue("updated_at", toTimestamp(now));
    return jdbcTemplate.queryForObject(sql, params, this::mapRow);
  }

  @Override
  public Optional<E> update(long id, E entity) {
    final String assignments =
        columns().stream().map(column -> column + " = :" + column).collect(Collectors.joining(", "));
    final String sql =
        "UPDATE "
            + tableName()
            + " SET "
            + assignments
            + ", updated_at = :updated_at WHERE id = :id RETURNING *";
    final MapSqlParameterSource params =
        bind(entity).addValue("id", id).addValue("updated_at", toTimestamp(Instant.now(clock)));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  @Override
  public boolean delete(long id) {
    final String sql = "DELETE FROM " + tableName() + " WHERE id = :id";
    return jdbcTemplate.update(sql, new MapSqlParameterSource("id", id)) > 0;
  }

  private String buildWhere(ListFilter filter, MapSqlParameterSource params) {
    if (filter.criteria().isEmpty()) {
      return "";
    }
    final Map<String, FilterField> allowed = filterFields();
    final ValidationErrors errors = new ValidationErrors();
    final StringBuilder where = new StringBuilder();
    filter
        .criteria()
        .forEach(
            (name, rawValue) -> {
              final FilterField field = allowed.get(name);
              if (field == null) {
                errors.reject(name, name + " is not a supported filter");
                return;
              }
              final Object value;
              try {
                value = field.converter().apply(rawValue);
              } catch (IllegalArgumentException ex) {
                // NumberFormatException と Enum.valueOf の失敗をまとめて入力エラーにする
                errors.reject(name, name + " has an invalid value");
                return;
              }
              final String paramName = FILTER_PARAM_PREFIX + field.column();
              where.append(where.length() == 0 ? " WHERE " : " AND ");
              where.append(field.column()).append(" = :").append(paramName);
              params.addValue(paramName, value);
            });
    errors.throwIfAny();
    return where.toString();
  }
}
