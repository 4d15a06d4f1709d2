package com.siteplatform.projects.api.v2;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/** v2 の公開契約。created_at/updated_at は応答専用で、入力値は無視する。 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ProjectV2Dto(
    Long id,
    String name,
    String description,
    String status,
    LocalDate startDate,
    LocalDate endDate,
    BigDecimal budget,
    Instant createdAt,
    Instant updatedAt) {}
