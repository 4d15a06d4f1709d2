/*
 * どこで: Logistics API v2
 * 何を: 配送先を必須とする v2 注文 DTO の検証と射影
 * なぜ: v2 から配送先なしの注文を受け付けないため
 */
package com.siteplatform.logistics.api.v2;

import com.siteplatform.common.api.ValidationErrors;
import com.siteplatform.common.dispatch.DtoCodec;
import com.siteplatform.logistics.api.OrderFieldRules;
import com.siteplatform.logistics.model.Order;
import com.siteplatform.logistics.model.OrderStatus;
import org.springframework.stereotype.Component;

@Component
public class OrderV2Codec implements DtoCodec<Order, OrderV2Dto> {

  static final int DELIVERY_ADDRESS_MAX = 500;

  @Override
  public ValidationErrors validate(OrderV2Dto dto) {
    return OrderFieldRules.validateCore(
            dto.reference(), dto.materialSku(), dto.quantity(), dto.status(), dto.shipmentId())
        .requireText("delivery_address", dto.deliveryAddress(), DELIVERY_ADDRESS_MAX);
  }

  @Override
  public Order toEntity(OrderV2Dto dto) {
    return Order.draft(
        dto.reference().trim(),
        dto.materialSku().trim(),
        dto.quantity(),
        OrderStatus.tryParse(dto.status()).orElse(null),
        dto.shipmentId(),
        dto.deliveryAddress().trim());
  }

  @Override
  public Order merge(Order existing, OrderV2Dto dto) {
    return new Order(
        existing.id(),
        dto.reference().trim(),
        dto.materialSku().trim(),
        dto.quantity(),
        OrderStatus.tryParse(dto.status()).orElse(existing.status()),
        dto.shipmentId(),
        dto.deliveryAddress().trim(),
        existing.createdAt(),
        existing.updatedAt());
  }

  @Override
  public OrderV2Dto toDto(Order order) {
    return new OrderV2Dto(
        order.id(),
        order.reference(),
        order.materialSku(),
        order.quantity(),
        order.status().name(),
        order.shipmentId(),
        order.deliveryAddress(),
        order.createdAt(),
        order.updatedAt());
  }

  @Override
  public long idOf(OrderV2Dto dto) {
    return dto.id();
  }
}
