/*
 * どこで: Materials ドメインサービス
 * 何を: sku の一意性・不変性と在庫の業務ルールを適用する
 * なぜ: v1/v2 のどちらから更新されても同じ sku 制約を守るため
 */
package com.siteplatform.materials.service;

import com.siteplatform.common.api.BusinessRuleException;
import com.siteplatform.common.api.NotFoundException;
import com.siteplatform.common.dispatch.EntityService;
import com.siteplatform.common.repository.ListFilter;
import com.siteplatform.materials.model.Material;
import com.siteplatform.materials.repository.MaterialRepository;
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
public class MaterialService implements EntityService<Material> {

  private static final Logger logger = LoggerFactory.getLogger(MaterialService.class);

  private final MaterialRepository materialRepository;

  @Override
  public Material get(long id) {
    return materialRepository.require(id);
  }

  @Override
  public List<Material> list(ListFilter filter) {
    return materialRepository.list(filter);
  }

  @Override
  public Material create(Material draft) {
    if (materialRepository.findBySku(draft.sku()).isPresent()) {
      throw duplicateSku(draft.sku(), null);
    }
    try {
      final Material created = materialRepository.create(draft);
      logger.info("material created id={} sku={}", created.id(), created.sku());
      return created;
    } catch (DuplicateKeyException ex) {
      // 事前確認後に同じ sku が並行登録された場合
      throw duplicateSku(draft.sku(), ex);
    }
  }

  @Override
  @Transactional
  public Material update(long id, UnaryOperator<Material> change) {
    final Material existing = materialRepository.require(id);
    final Material candidate = change.apply(existing);
    if (!existing.sku().equals(candidate.sku())) {
      throw new BusinessRuleException("sku cannot be changed after creation");
    }
    final Material updated =
        materialRepository
            .update(id, candidate)
            .orElseThrow(() -> new NotFoundException(materialRepository.resourceName(), id));
    if (updated.needsReorder() && !existing.needsReorder()) {
      logger.info(
          "material reached reorder level id={} sku={} quantity_on_hand={}",
          id,
          updated.sku(),
          updated.quantityOnHand());
    }
    return updated;
  }

  @Override
  public void delete(long id) {
    if (!materialRepository.delete(id)) {
      throw new NotFoundException(materialRepository.resourceName(), id);
    }
    logger.info("material deleted id={}", id);
  }

  private static BusinessRuleException duplicateSku(String sku, Throwable cause) {
    final String message = "sku already exists: " + sku;
    return cause == null ? new BusinessRuleException(message) : new BusinessRuleException(message, cause);
  }
}
