package com.siteplatform.materials.api.v2;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.math.BigDecimal;
import java.time.Instant;

/** needs_reorder / created_at / updated_at は応答専用。 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MaterialV2Dto(
    Long id,
    String sku,
    String name,
    String unit,
    BigDecimal unitPrice,
    Integer quantityOnHand,
    String category,
    Integer reorderLevel,
    Boolean needsReorder,
    Instant createdAt,
    Instant updatedAt) {}
