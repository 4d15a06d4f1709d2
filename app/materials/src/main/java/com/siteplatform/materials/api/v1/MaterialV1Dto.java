package com.siteplatform.materials.api.v1;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.math.BigDecimal;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MaterialV1Dto(
    Long id, String sku, String name, String unit, BigDecimal unitPrice, Integer quantityOnHand) {}
