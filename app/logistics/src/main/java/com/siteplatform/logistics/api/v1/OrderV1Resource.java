package com.siteplatform.logistics.api.v1;

import com.siteplatform.common.dispatch.CodecBackedResource;
import com.siteplatform.common.version.ApiVersion;
import com.siteplatform.logistics.model.Order;
import com.siteplatform.logistics.service.OrderService;
import org.springframework.stereotype.Component;

@Component
public class OrderV1Resource extends CodecBackedResource<Order, OrderV1Dto> {

  public static final String RESOURCE = "orders";
  public static final ApiVersion VERSION = new ApiVersion(1, 0);

  public OrderV1Resource(OrderV1Codec codec, OrderService orderService) {
    super(RESOURCE, VERSION, OrderV1Dto.class, codec, orderService);
  }
}
