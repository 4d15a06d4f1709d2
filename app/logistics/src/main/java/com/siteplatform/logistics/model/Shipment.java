package com.siteplatform.logistics.model;

import java.time.Instant;

/** shipments テーブルの 1 行。shippedAt/deliveredAt は状態遷移時にサービスが設定する。 */
public record Shipment(
    Long id,
    String carrier,
    String trackingNumber,
    ShipmentStatus status,
    Instant shippedAt,
    Instant deliveredAt,
    Instant createdAt,
    Instant updatedAt) {

  public static Shipment draft(String carrier, String trackingNumber, ShipmentStatus status) {
    return new Shipment(null, carrier, trackingNumber, status, null, null, null, null);
  }

  public Shipment withStatus(ShipmentStatus next, Instant shipped, Instant delivered) {
    return new Shipment(id, carrier, trackingNumber, next, shipped, delivered, createdAt, updatedAt);
  }
}
