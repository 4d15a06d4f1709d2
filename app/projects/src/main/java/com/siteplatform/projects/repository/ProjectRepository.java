/*
 * どこで: Projects データアクセス
 * 何を: projects テーブルの列定義と行マッピングを提供する
 * なぜ: CRUD 本体は共通の JdbcCrudRepository に任せ、差分だけを持つため
 */
package com.siteplatform.projects.repository;

import static com.siteplatform.common.JdbcTimestampUtils.toInstant;
import static com.siteplatform.common.JdbcTimestampUtils.toLocalDate;
import static com.siteplatform.common.JdbcTimestampUtils.toSqlDate;

import com.siteplatform.common.repository.FilterField;
import com.siteplatform.common.repository.JdbcCrudRepository;
import com.siteplatform.projects.model.Project;
import com.siteplatform.projects.model.ProjectStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class ProjectRepository extends JdbcCrudRepository<Project> {

  private static final List<String> COLUMNS =
      List.of("name", "description", "status", "start_date", "end_date", "budget");

  private static final Map<String, FilterField> FILTERS =
      Map.of(
          "status", FilterField.enumName("status", ProjectStatus.class),
          "name", FilterField.text("name"));

  public ProjectRepository(NamedParameterJdbcTemplate jdbcTemplate, Clock clock) {
    super(jdbcTemplate, clock);
  }

  @Override
  public String resourceName() {
    return "project";
  }

  @Override
  protected String tableName() {
    return "projects";
  }

  @Override
  protected List<String> columns() {
    return COLUMNS;
  }

  @Override
  protected Map<String, FilterField> filterFields() {
    return FILTERS;
  }

  @Override
  protected MapSqlParameterSource bind(Project project) {
    return new MapSqlParameterSource()
        .addValue("name", project.name())
        .addValue("description", project.description())
        .addValue("status", project.status().name())
        .addValue("start_date", toSqlDate(project.startDate()))
        .addValue("end_date", toSqlDate(project.endDate()))
        .addValue("budget", project.budget());
  }

  @Override
  protected Project mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new Project(
        rs.getLong("id"),
        rs.getString("name"),
        rs.getString("description"),
        ProjectStatus.valueOf(rs.getString("status")),
        toLocalDate(rs.getDate("start_date")),
        toLocalDate(rs.getDate("end_date")),
        rs.getBigDecimal("budget"),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("updated_at")));
  }
}
