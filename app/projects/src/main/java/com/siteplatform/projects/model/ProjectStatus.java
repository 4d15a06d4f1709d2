/*
 * どこで: Projects ドメインモデル
 * 何を: プロジェクト状態と許可される遷移を定義する
 * なぜ: 全 API バージョンで同じ状態遷移ルールを適用するため
 */
package com.siteplatform.projects.model;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

public enum ProjectStatus {
  PLANNED,
  ACTIVE,
  ON_HOLD,
  COMPLETED,
  CANCELLED;

  public Set<ProjectStatus> allowedNext() {
    return switch (this) {
      case PLANNED -> EnumSet.of(ACTIVE, CANCELLED);
      case ACTIVE -> EnumSet.of(ON_HOLD, COMPLETED, CANCELLED);
      case ON_HOLD -> EnumSet.of(ACTIVE, CANCELLED);
      case COMPLETED, CANCELLED -> EnumSet.noneOf(ProjectStatus.class);
    };
  }

  /** 同一状態への更新は遷移とみなさず許可する。 */
  public boolean canTransitionTo(ProjectStatus next) {
    return this == next || allowedNext().contains(next);
  }

  public boolean isTerminal() {
    return allowedNext().isEmpty();
  }

  public static Optional<ProjectStatus> tryParse(String value) {
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
