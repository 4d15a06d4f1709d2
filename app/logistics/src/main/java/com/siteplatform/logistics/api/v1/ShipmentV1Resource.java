package com.siteplatform.logistics.api.v1;

import com.siteplatform.common.dispatch.CodecBackedResource;
import com.siteplatform.common.version.ApiVersion;
import com.siteplatform.logistics.model.Shipment;
import com.siteplatform.logistics.service.ShipmentService;
import org.springframework.stereotype.Component;

@Component
public class ShipmentV1Resource extends CodecBackedResource<Shipment, ShipmentV1Dto> {

  public static final String RESOURCE = "shipments";
  public static final ApiVersion VERSION = new ApiVersion(1, 0);

  public ShipmentV1Resource(ShipmentV1Codec codec, ShipmentService shipmentService) {
    super(RESOURCE, VERSION, ShipmentV1Dto.class, codec, shipmentService);
  }
}
