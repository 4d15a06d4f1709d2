package com.siteplatform.logistics.api.v2;

import com.siteplatform.common.dispatch.CodecBackedResource;
import com.siteplatform.common.version.ApiVersion;
import com.siteplatform.logistics.model.Order;
import com.siteplatform.logistics.service.OrderService;
import org.springframework.stereotype.Component;

@Component
public class OrderV2Resource extends CodecBackedResource<Order, OrderV2Dto> {

  public static final String RESOURCE = "orders";
  public static final ApiVersion VERSION = new ApiVersion(2, 0);

  public OrderV2Resource(OrderV2Codec codec, OrderService orderService) {
    super(RESOURCE, VERSION, OrderV2Dto.class, codec, orderService);
  }
}
