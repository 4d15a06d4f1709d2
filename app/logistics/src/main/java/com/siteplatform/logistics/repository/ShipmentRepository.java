package com.siteplatform.logistics.repository;

import static com.siteplatform.common.JdbcTimestampUtils.toInstant;
import static com.siteplatform.common.JdbcTimestampUtils.toTimestamp;

import com.siteplatform.common.repository.FilterField;
import com.siteplatform.common.repository.JdbcCrudRepository;
import com.siteplatform.logistics.model.Shipment;
import com.siteplatform.logistics.model.ShipmentStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class ShipmentRepository extends JdbcCrudRepository<Shipment> {

  private static final List<String> COLUMNS =
      List.of("carrier", "tracking_number", "status", "shipped_at", "delivered_at");

  private static final Map<String, FilterField> FILTERS =
      Map.of(
          "status", FilterField.enumName("status", ShipmentStatus.class),
          "carrier", FilterField.text("carrier"),
          "tracking_number", FilterField.text("tracking_number"));

  public ShipmentRepository(NamedParameterJdbcTemplate jdbcTemplate, Clock clock) {
    super(jdbcTemplate, clock);
  }

  @Override
  public String resourceName() {
    return "shipment";
  }

  @Override
  protected String tableName() {
    return "shipments";
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
  protected MapSqlParameterSource bind(Shipment shipment) {
    return new MapSqlParameterSource()
        .addValue("carrier", shipment.carrier())
        .addValue("tracking_number", shipment.trackingNumber())
        .addValue("status", shipment.status().name())
        .addValue("shipped_at", toTimestamp(shipment.shippedAt()))
        .addValue("delivered_at", toTimestamp(shipment.deliveredAt()));
  }

  @Override
  protected Shipment mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new Shipment(
        rs.getLong("id"),
        rs.getString("carrier"),
        rs.getString("tracking_number"),
        ShipmentStatus.valueOf(rs.getString("status")),
        toInstant(rs.getTimestamp("shipped_at")),
        toInstant(rs.getTimestamp("delivered_at")),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("updated_at")));
  }
}
