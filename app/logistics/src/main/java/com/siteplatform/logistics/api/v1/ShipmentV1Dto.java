package com.siteplatform.logistics.api.v1;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

/** shipped_at / delivered_at はサーバが状態遷移時に設定する。入力値は無視する。 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ShipmentV1Dto(
    Long id,
    String carrier,
    String trackingNumber,
    String status,
    Instant shippedAt,
    Instant deliveredAt) {}
