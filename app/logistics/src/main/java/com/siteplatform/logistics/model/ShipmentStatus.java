package com.siteplatform.logistics.model;

import java.util.Locale;
import java.util.Optional;

/** 出荷状態。CREATED → IN_TRANSIT → DELIVERED の一方向のみ。 */
public enum ShipmentStatus {
  CREATED,
  IN_TRANSIT,
  DELIVERED;

  public boolean canTransitionTo(ShipmentStatus next) {
    return next == this || next.ordinal() == ordinal() + 1;
  }

  public static Optional<ShipmentStatus> tryParse(String value) {
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
