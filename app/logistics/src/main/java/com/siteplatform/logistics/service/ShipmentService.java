/*
 * どこで: Logistics 出荷サービス
 * 何を: 出荷の状態遷移と発送/配達時刻の記録、参照中出荷の削除禁止を扱う
 * なぜ: 時刻をクライアント入力ではなくサーバの Clock で確定させるため
 */
package com.siteplatform.logistics.service;

import com.siteplatform.common.api.BusinessRuleException;
import com.siteplatform.common.api.NotFoundException;
import com.siteplatform.common.dispatch.EntityService;
import com.siteplatform.common.repository.ListFilter;
import com.siteplatform.logistics.model.Shipment;
import com.siteplatform.logistics.model.ShipmentStatus;
import com.siteplatform.logistics.repository.OrderRepository;
import com.siteplatform.logistics.repository.ShipmentRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.function.UnaryOperator;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class ShipmentService implements EntityService<Shipment> {

  private static final Logger logger = LoggerFactory.getLogger(ShipmentService.class);

  private final ShipmentRepository shipmentRepository;
  private final OrderRepository orderRepository;
  private final Clock clock;

  @Override
  public Shipment get(long id) {
    return shipmentRepository.require(id);
  }

  @Override
  public List<Shipment> list(ListFilter filter) {
    return shipmentRepository.list(filter);
  }

  @Override
  public Shipment create(Shipment draft) {
    final ShipmentStatus status = draft.status() == null ? ShipmentStatus.CREATED : draft.status();
    if (status == ShipmentStatus.DELIVERED) {
      throw new BusinessRuleException("shipment cannot be created as DELIVERED");
    }
    final Instant shippedAt = status == ShipmentStatus.IN_TRANSIT ? Instant.now(clock) : null;
    final Shipment created = shipmentRepository.create(draft.withStatus(status, shippedAt, null));
    logger.info("shipment created id={} carrier={} status={}", created.id(), created.carrier(), status);
    return created;
  }

  @Override
  @Transactional
  public Shipment update(long id, UnaryOperator<Shipment> change) {
    final Shipment existing = shipmentRepository.require(id);
    final Shipment candidate = change.apply(existing);
    final ShipmentStatus from = existing.status();
    final ShipmentStatus to = candidate.status();
    if (!from.canTransitionTo(to)) {
      throw new BusinessRuleException("shipment status cannot change from " + from + " to " + to);
    }
    final Instant now = Instant.now(clock);
    // 時刻は遷移した瞬間だけ記録し、以後の更新では保持する
    final Instant shippedAt =
        from != to && to == ShipmentStatus.IN_TRANSIT ? now : existing.shippedAt();
    final Instant deliveredAt =
        from != to && to == ShipmentStatus.DELIVERED ? now : existing.deliveredAt();
    final Shipment updated =
        shipmentRepository
            .update(id, candidate.withStatus(to, shippedAt, deliveredAt))
            .orElseThrow(() -> new NotFoundException(shipmentRepository.resourceName(), id));
    if (from != to) {
      logger.info("shipment status changed id={} from={} to={}", id, from, to);
    }
    return updated;
  }

  @Override
  @Transactional
  public void delete(long id) {
    shipmentRepository.require(id);
    final long referencing = orderRepository.countByShipmentId(id);
    if (referencing > 0) {
      throw new BusinessRuleException(
          "shipment " + id + " is referenced by " + referencing + " order(s)");
    }
    try {
      shipmentRepository.delete(id);
    } catch (DataIntegrityViolationException ex) {
      // 判定後に注文が紐付いた場合は外部キー制約で弾かれる
      throw new BusinessRuleException("shipment " + id + " is referenced by orders", ex);
    }
    logger.info("shipment deleted id={}", id);
  }
}
