package com.siteplatform.logistics.api.v1;

import com.siteplatform.common.api.ValidationErrors;
import com.siteplatform.common.dispatch.DtoCodec;
import com.siteplatform.logistics.api.OrderFieldRules;
import com.siteplatform.logistics.model.Order;
import com.siteplatform.logistics.model.OrderStatus;
import org.springframework.stereotype.Component;

/** orders@1.0。配送先は扱わず、更新時は既存値を保持する。 */
@Component
public class OrderV1Codec implements DtoCodec<Order, OrderV1Dto> {

  @Override
  public ValidationErrors validate(OrderV1Dto dto) {
    return OrderFieldRules.validateCore(
        dto.reference(), dto.materialSku(), dto.quantity(), dto.status(), dto.shipmentId());
  }

  @Override
  public Order toEntity(OrderV1Dto dto) {
    return Order.draft(
        dto.reference().trim(),
        dto.materialSku().trim(),
        dto.quantity(),
        OrderStatus.tryParse(dto.status()).orElse(null),
        dto.shipmentId(),
        null);
  }

  @Override
  public Order merge(Order existing, OrderV1Dto dto) {
    return new Order(
        existing.id(),
        dto.reference().trim(),
        dto.materialSku().trim(),
        dto.quantity(),
        OrderStatus.tryParse(dto.status()).orElse(existing.status()),
        dto.shipmentId(),
        existing.deliveryAddress(),
        existing.createdAt(),
        existing.updatedAt());
  }

  @Override
  public OrderV1Dto toDto(Order order) {
    return new OrderV1Dto(
        order.id(),
        order.reference(),
        order.materialSku(),
        order.quantity(),
        order.status().name(),
        order.shipmentId());
  }

  @Override
  public long idOf(OrderV1Dto dto) {
    return dto.id();
  }
}
