/*
 * どこで: Logistics データアクセス
 * 何を: orders テーブルの列定義と出荷参照の集計を提供する
 * なぜ: 出荷削除時に参照中の注文があるかを判定するため
 */
package com.siteplatform.logistics.repository;

import static com.siteplatform.common.JdbcTimestampUtils.toInstant;

import com.siteplatform.common.repository.FilterField;
import com.siteplatform.common.repository.JdbcCrudRepository;
import com.siteplatform.logistics.model.Order;
import com.siteplatform.logistics.model.OrderStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class OrderRepository extends JdbcCrudRepository<Order> {

  private static final List<String> COLUMNS =
      List.of(
          "reference", "material_sku", "quantity", "status", "shipment_id", "delivery_address");

  private static final Map<String, FilterField> FILTERS =
      Map.of(
          "status", FilterField.enumName("status", OrderStatus.class),
          "material_sku", FilterField.text("material_sku"),
          "shipment_id", FilterField.number("shipment_id"),
          "reference", FilterField.text("reference"));

  public OrderRepository(NamedParameterJdbcTemplate jdbcTemplate, Clock clock) {
    super(jdbcTemplate, clock);
  }

  @Override
  public String resourceName() {
    return "order";
  }

  public long countByShipmentId(long shipmentId) {
    final String sql = "SELECT COUNT(*) FROM orders WHERE shipment_id = :shipmentId";
    final Long count =
        jdbcTemplate.queryForObject(
            sql, new MapSqlParameterSource("shipmentId", shipmentId), Long.class);
    return count == null ? 0L : count;
  }

  @Override
  protected String tableName() {
    return "orders";
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
  protected MapSqlParameterSource bind(Order order) {
    return new MapSqlParameterSource()
        .addValue("reference", order.reference())
        .addValue("material_sku", order.materialSku())
        .addValue("quantity", order.quantity())
        .addValue("status", order.status().name())
        .addValue("shipment_id", order.shipmentId())
        .addValue("delivery_address", order.deliveryAddress());
  }

  @Override
  protected Order mapRow(ResultSet rs, int rowNum) throws SQLException {
    final long shipmentId = rs.getLong("shipment_id");
    final Long nullableShipmentId = rs.wasNull() ? null : shipmentId;
    return new Order(
        rs.getLong("id"),
        rs.getString("reference"),
        rs.getString("material_sku"),
        rs.getInt("quantity"),
        OrderStatus.valueOf(rs.getString("status")),
        nullableShipmentId,
        rs.getString("delivery_address"),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("updated_at")));
  }
}
