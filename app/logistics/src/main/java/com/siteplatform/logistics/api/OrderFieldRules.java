package com.siteplatform.logistics.api;

import com.siteplatform.common.api.ValidationErrors;
import com.siteplatform.logistics.model.OrderStatus;

/** v1/v2 で共通の注文フィールド検証。 */
public final class OrderFieldRules {

  static final int REFERENCE_MAX = 64;
  static final int MATERIAL_SKU_MAX = 64;

  private OrderFieldRules() {}

  public static ValidationErrors validateCore(
      String reference, String materialSku, Integer quantity, String status, Long shipmentId) {
    final ValidationErrors errors = new ValidationErrors();
    errors.requireText("reference", reference, REFERENCE_MAX);
    errors.requireText("material_sku", materialSku, MATERIAL_SKU_MAX);
    if (quantity == null) {
      errors.reject("quantity", "quantity is required");
    } else {
      errors.check(quantity > 0, "quantity", "quantity must be positive");
    }
    if (status != null) {
      errors.check(
          OrderStatus.tryParse(status).isPresent(),
          "status",
          "status must be one of PENDING, CONFIRMED, SHIPPED, DELIVERED, CANCELLED");
    }
    errors.check(shipmentId == null || shipmentId > 0, "shipment_id", "shipment_id must be positive");
    return errors;
  }
}
