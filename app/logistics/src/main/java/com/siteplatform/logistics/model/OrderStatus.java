/*
 * どこで: Logistics ドメインモデル
 * 何を: 注文状態と許可される遷移を定義する
 * なぜ: 出荷との紐付けや削除可否を状態から一意に判断するため
 */
package com.siteplatform.logistics.model;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

public enum OrderStatus {
  PENDING,
  CONFIRMED,
  SHIPPED,
  DELIVERED,
  CANCELLED;

  public Set<OrderStatus> allowedNext() {
    return switch (this) {
      case PENDING -> EnumSet.of(CONFIRMED, CANCELLED);
      case CONFIRMED -> EnumSet.of(SHIPPED, CANCELLED);
      case SHIPPED -> EnumSet.of(DELIVERED);
      case DELIVERED, CANCELLED -> EnumSet.noneOf(OrderStatus.class);
    };
  }

  public boolean canTransitionTo(OrderStatus next) {
    return this == next || allowedNext().contains(next);
  }

  /** 物理削除してよい状態。出荷手配後の注文は履歴として残す。 */
  public boolean isDeletable() {
    return this == PENDING || this == CANCELLED;
  }

  public static Optional<OrderStatus> tryParse(String value) {
    if (value == null) {
      return Optional.empty();
    }
    try {
      return Optional.of(valueOf(value.trim().toUpperCase(Locale.ROOT)));
    } catch (IllegalArgumentException ex) {
      return Optional.empty();
    }
  }
}
