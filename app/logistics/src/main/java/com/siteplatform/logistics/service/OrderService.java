/*
 * どこで: Logistics 注文サービス
 * 何を: 注文の状態遷移・出荷参照の整合性・削除可否を適用する
 * なぜ: v1/v2 どちらの経路でも出荷との関係を壊さないため
 */
package com.siteplatform.logistics.service;

import com.siteplatform.common.api.BusinessRuleException;
import com.siteplatform.common.api.NotFoundException;
import com.siteplatform.common.dispatch.EntityService;
import com.siteplatform.common.repository.ListFilter;
import com.siteplatform.logistics.model.Order;
import com.siteplatform.logistics.model.OrderStatus;
import com.siteplatform.logistics.repository.OrderRepository;
import com.siteplatform.logistics.repository.ShipmentRepository;
import java.util.List;
import java.util.function.UnaryOperator;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class OrderService implements EntityService<Order> {

  private static final Logger logger = LoggerFactory.getLogger(OrderService.class);

  private final OrderRepository orderRepository;
  private final ShipmentRepository shipmentRepository;

  @Override
  public Order get(long id) {
    return orderRepository.require(id);
  }

  @Override
  public List<Order> list(ListFilter filter) {
    return orderRepository.list(filter);
  }

  @Override
  @Transactional
  public Order create(Order draft) {
    final Order candidate = draft.status() == null ? draft.withStatus(OrderStatus.PENDING) : draft;
    if (candidate.status() != OrderStatus.PENDING) {
      throw new BusinessRuleException("order must be created as PENDING");
    }
    requireShipmentExists(candidate.shipmentId());
    try {
      final Order created = orderRepository.create(candidate);
      logger.info("order created id={} reference={}", created.id(), created.reference());
      return created;
    } catch (DuplicateKeyException ex) {
      throw new BusinessRuleException("order reference already exists: " + candidate.reference(), ex);
    }
  }

  @Override
  @Transactional
  public Order update(long id, UnaryOperator<Order> change) {
    final Order existing = orderRepository.require(id);
    final Order candidate = change.apply(existing);
    if (!existing.status().canTransitionTo(candidate.status())) {
      throw new BusinessRuleException(
          "order status cannot change from " + existing.status() + " to " + candidate.status());
    }
    if (candidate.status() == OrderStatus.SHIPPED && candidate.shipmentId() == null) {
      throw new BusinessRuleException("shipment_id is required for a SHIPPED order");
    }
    requireShipmentExists(candidate.shipmentId());
    try {
      final Order updated =
          orderRepository
              .update(id, candidate)
              .orElseThrow(() -> new NotFoundException(orderRepository.resourceName(), id));
      if (existing.status() != updated.status()) {
        logger.info(
            "order status changed id={} from={} to={}", id, existing.status(), updated.status());
      }
      return updated;
    } catch (DuplicateKeyException ex) {
      throw new BusinessRuleException("order reference already exists: " + candidate.reference(), ex);
    }
  }

  @Override
  @Transactional
  public void delete(long id) {
    final Order existing = orderRepository.require(id);
    if (!existing.status().isDeletable()) {
      throw new BusinessRuleException(
          "order in status " + existing.status() + " cannot be deleted");
    }
    orderRepository.delete(id);
    logger.info("order deleted id={}", id);
  }

  private void requireShipmentExists(Long shipmentId) {
    if (shipmentId != null && !shipmentRepository.exists(shipmentId)) {
      throw new BusinessRuleException("shipment not found: " + shipmentId);
    }
  }
}
