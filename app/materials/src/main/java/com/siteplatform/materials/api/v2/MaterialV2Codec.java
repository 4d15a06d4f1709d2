/*
 * どこで: Materials API v2
 * 何を: 分類・発注点を含む v2 DTO の検証と射影
 * なぜ: 在庫補充判定 (needs_reorder) を v2 の応答にだけ載せるため
 */
package com.siteplatform.materials.api.v2;

import com.siteplatform.common.api.ValidationErrors;
import com.siteplatform.common.dispatch.DtoCodec;
import com.siteplatform.materials.api.MaterialFieldRules;
import com.siteplatform.materials.model.Material;
import org.springframework.stereotype.Component;

@Component
public class MaterialV2Codec implements DtoCodec<Material, MaterialV2Dto> {

  static final int CATEGORY_MAX = 100;

  @Override
  public ValidationErrors validate(MaterialV2Dto dto) {
    return MaterialFieldRules.validateCore(
            dto.sku(), dto.name(), dto.unit(), dto.unitPrice(), dto.quantityOnHand())
        .optionalText("category", dto.category(), CATEGORY_MAX)
        .nonNegative("reorder_level", dto.reorderLevel());
  }

  @Override
  public Material toEntity(MaterialV2Dto dto) {
    return Material.draft(
        dto.sku(),
        dto.name().trim(),
        dto.unit().trim(),
        dto.unitPrice(),
        dto.quantityOnHand() == null ? 0 : dto.quantityOnHand(),
        dto.category(),
        dto.reorderLevel());
  }

  @Override
  public Material merge(Material existing, MaterialV2Dto dto) {
    return new Material(
        existing.id(),
        dto.sku(),
        dto.name().trim(),
        dto.unit().trim(),
        dto.unitPrice(),
        dto.quantityOnHand() == null ? existing.quantityOnHand() : dto.quantityOnHand(),
        dto.category(),
        dto.reorderLevel(),
        existing.createdAt(),
        existing.updatedAt());
  }

  @Override
  public MaterialV2Dto toDto(Material material) {
    return new MaterialV2Dto(
        material.id(),
        material.sku(),
        material.name(),
        material.unit(),
        material.unitPrice(),
        material.quantityOnHand(),
        material.category(),
        material.reorderLevel(),
        material.needsReorder(),
        material.createdAt(),
        material.updatedAt());
  }

  @Override
  public long idOf(MaterialV2Dto dto) {
    return dto.id();
  }
}
