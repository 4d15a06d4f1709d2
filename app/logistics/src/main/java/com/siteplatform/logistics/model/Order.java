package com.siteplatform.logistics.model;

import java.time.Instant;

public record Order(
    Long id,
    String reference,
    String materialSku,
    int quantity,
    OrderStatus status,
    Long shipmentId,
    String deliveryAddress,
    Instant createdAt,
    Instant updatedAt) {

  public static Order draft(
      String reference,
      String materialSku,
      int quantity,
      OrderStatus status,
      Long shipmentId,
      String deliveryAddress) {
    return new Order(
        null, reference, materialSku, quantity, status, shipmentId, deliveryAddress, null, null);
  }

  public Order withStatus(OrderStatus next) {
    return new Order(
        id, reference, materialSku, quantity, next, shipmentId, deliveryAddress, createdAt, updatedAt);
  }
}
