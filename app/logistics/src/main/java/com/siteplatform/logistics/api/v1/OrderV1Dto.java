package com.siteplatform.logistics.api.v1;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record OrderV1Dto(
    Long id,
    String reference,
    String materialSku,
    Integer quantity,
    String status,
    Long shipmentId) {}
