package com.siteplatform.logistics.api.v2;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record OrderV2Dto(
    Long id,
    String reference,
    String materialSku,
    Integer quantity,
    String status,
    Long shipmentId,
    String deliveryAddress,
    Instant createdAt,
    Instant updatedAt) {}
