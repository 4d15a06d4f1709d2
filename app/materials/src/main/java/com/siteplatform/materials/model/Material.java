/*
 * どこで: Materials ドメインモデル
 * 何を: materials テーブルのスナップショットを表す
 * なぜ: v1/v2 の射影元を 1 つに保ち、在庫判定をモデル側に置くため
 */
package com.siteplatform.materials.model;

import java.math.BigDecimal;
import java.time.Instant;

public record Material(
    Long id,
    String sku,
    String name,
    String unit,
    BigDecimal unitPrice,
    int quantityOnHand,
    String category,
    Integer reorderLevel,
    Instant createdAt,
    Instant updatedAt) {

  public static Material draft(
      String sku,
      String name,
      String unit,
      BigDecimal unitPrice,
      int quantityOnHand,
      String category,
      Integer reorderLevel) {
    return new Material(
        null, sku, name, unit, unitPrice, quantityOnHand, category, reorderLevel, null, null);
  }

  /** 発注点が未設定なら補充不要とみなす。 */
  public boolean needsReorder() {
    return reorderLevel != null && quantityOnHand <= reorderLevel;
  }
}
