package com.siteplatform.logistics.api.v1;

import com.siteplatform.common.api.ValidationErrors;
import com.siteplatform.common.dispatch.DtoCodec;
import com.siteplatform.logistics.model.Shipment;
import com.siteplatform.logistics.model.ShipmentStatus;
import org.springframework.stereotype.Component;

@Component
public class ShipmentV1Codec implements DtoCodec<Shipment, ShipmentV1Dto> {

  static final int CARRIER_MAX = 100;
  static final int TRACKING_NUMBER_MAX = 100;

  @Override
  public ValidationErrors validate(ShipmentV1Dto dto) {
    final ValidationErrors errors = new ValidationErrors();
    errors.requireText("carrier", dto.carrier(), CARRIER_MAX);
    errors.optionalText("tracking_number", dto.trackingNumber(), TRACKING_NUMBER_MAX);
    if (dto.status() != null) {
      errors.check(
          ShipmentStatus.tryParse(dto.status()).isPresent(),
          "status",
          "status must be one of CREATED, IN_TRANSIT, DELIVERED");
    }
    return errors;
  }

  @Override
  public Shipment toEntity(ShipmentV1Dto dto) {
    return Shipment.draft(
        dto.carrier().trim(), dto.trackingNumber(), ShipmentStatus.tryParse(dto.status()).orElse(null));
  }

  @Override
  public Shipment merge(Shipment existing, ShipmentV1Dto dto) {
    return new Shipment(
        existing.id(),
        dto.carrier().trim(),
        dto.trackingNumber(),
        ShipmentStatus.tryParse(dto.status()).orElse(existing.status()),
        existing.shippedAt(),
        existing.deliveredAt(),
        existing.createdAt(),
        existing.updatedAt());
  }

  @Override
  public ShipmentV1Dto toDto(Shipment shipment) {
    return new ShipmentV1Dto(
        shipment.id(),
        shipment.carrier(),
        shipment.trackingNumber(),
        shipment.status().name(),
        shipment.shippedAt(),
        shipment.deliveredAt());
  }

  @Override
  public long idOf(ShipmentV1Dto dto) {
    return dto.id();
  }
}
