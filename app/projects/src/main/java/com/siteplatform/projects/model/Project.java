/*
 * どこで: Projects ドメインモデル
 * 何を: projects テーブルのスナップショットを表す
 * なぜ: 各 API バージョンの DTO 射影の元データを 1 つに保つため
 */
package com.siteplatform.projects.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

public record Project(
    Long id,
    String name,
    String description,
    ProjectStatus status,
    LocalDate startDate,
    LocalDate endDate,
    BigDecimal budget,
    Instant createdAt,
    Instant updatedAt) {

  /** 永続化前の下書き。id と時刻はストアが採番する。 */
  public static Project draft(
      String name,
      String description,
      ProjectStatus status,
      LocalDate startDate,
      LocalDate endDate,
      BigDecimal budget) {
    return new Project(null, name, description, status, startDate, endDate, budget, null, null);
  }

  public Project withStatus(ProjectStatus next) {
    return new Project(id, name, description, next, startDate, endDate, budget, createdAt, updatedAt);
  }
}
