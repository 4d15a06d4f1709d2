package com.siteplatform.materials.repository;

import static com.siteplatform.common.JdbcTimestampUtils.toInstant;

import com.siteplatform.common.repository.FilterField;
import com.siteplatform.common.repository.JdbcCrudRepository;
import com.siteplatform.materials.model.Material;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

/** materials テーブル。sku には一意制約がある。 */
@Repository
public class MaterialRepository extends JdbcCrudRepository<Material> {

  private static final List<String> COLUMNS =
      List.of(
          "sku", "name", "unit", "unit_price", "quantity_on_hand", "category", "reorder_level");

  private static final Map<String, FilterField> FILTERS =
      Map.of(
          "sku", FilterField.text("sku"),
          "category", FilterField.text("category"),
          "unit", FilterField.text("unit"));

  public MaterialRepository(NamedParameterJdbcTemplate jdbcTemplate, Clock clock) {
    super(jdbcTemplate, clock);
  }

  @Override
  public String resourceName() {
    return "material";
  }

  public Optional<Material> findBySku(String sku) {
    final String sql = "SELECT * FROM materials WHERE sku = :sku";
    return jdbcTemplate
        .query(sql, new MapSqlParameterSource("sku", sku), this::mapRow)
        .stream()
        .findFirst();
  }

  @Override
  protected String tableName() {
    return "materials";
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
  protected MapSqlParameterSource bind(Material material) {
    return new MapSqlParameterSource()
        .addValue("sku", material.sku())
        .addValue("name", material.name())
        .addValue("unit", material.unit())
        .addValue("unit_price", material.unitPrice())
        .addValue("quantity_on_hand", material.quantityOnHand())
        .addValue("category", material.category())
        .addValue("reorder_level", material.reorderLevel());
  }

  @Override
  protected Material mapRow(ResultSet rs, int rowNum) throws SQLException {
    final int reorderLevel = rs.getInt("reorder_level");
    return new Material(
        rs.getLong("id"),
        rs.getString("sku"),
        rs.getString("name"),
        rs.getString("unit"),
        rs.getBigDecimal("unit_price"),
        rs.getInt("quantity_on_hand"),
        rs.getString("category"),
        rs.wasNull() ? null : reorderLevel,
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("updated_at")));
  }
}
