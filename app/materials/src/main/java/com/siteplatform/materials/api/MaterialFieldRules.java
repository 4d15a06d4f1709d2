package com.siteplatform.materials.api;

import com.siteplatform.common.api.ValidationErrors;
import java.math.BigDecimal;
import java.util.regex.Pattern;

/** v1/v2 で共通の資材フィールド検証。 */
public final class MaterialFieldRules {

  static final Pattern SKU = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]{0,63}");
  static final int NAME_MAX = 200;
  static final int UNIT_MAX = 16;
  // materials.unit_price NUMERIC(14, 2)
  static final int PRICE_PRECISION = 14;
  static final int PRICE_SCALE = 2;

  private MaterialFieldRules() {}

  public static ValidationErrors validateCore(
      String sku, String name, String unit, BigDecimal unitPrice, Integer quantityOnHand) {
    final ValidationErrors errors = new ValidationErrors();
    if (sku == null || sku.isBlank()) {
      errors.reject("sku", "sku is required");
    } else {
      errors.check(
          SKU.matcher(sku).matches(),
          "sku",
          "sku must be 1-64 letters, digits, '.', '_' or '-'");
    }
    errors.requireText("name", name, NAME_MAX);
    errors.requireText("unit", unit, UNIT_MAX);
    errors.requireNonNull("unit_price", unitPrice);
    errors.nonNegative("unit_price", unitPrice);
    errors.decimal("unit_price", unitPrice, PRICE_PRECISION, PRICE_SCALE);
    errors.nonNegative("quantity_on_hand", quantityOnHand);
    return errors;
  }
}
