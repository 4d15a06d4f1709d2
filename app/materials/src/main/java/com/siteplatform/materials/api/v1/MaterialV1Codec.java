package com.siteplatform.materials.api.v1;

import com.siteplatform.common.api.ValidationErrors;
import com.siteplatform.common.dispatch.DtoCodec;
import com.siteplatform.materials.api.MaterialFieldRules;
import com.siteplatform.materials.model.Material;
import org.springframework.stereotype.Component;

/** materials@1.0 の検証と射影。分類・発注点は扱わない。 */
@Component
public class MaterialV1Codec implements DtoCodec<Material, MaterialV1Dto> {

  @Override
  public ValidationErrors validate(MaterialV1Dto dto) {
    return MaterialFieldRules.validateCore(
        dto.sku(), dto.name(), dto.unit(), dto.unitPrice(), dto.quantityOnHand());
  }

  @Override
  public Material toEntity(MaterialV1Dto dto) {
    return Material.draft(
        dto.sku(),
        dto.name().trim(),
        dto.unit().trim(),
        dto.unitPrice(),
        dto.quantityOnHand() == null ? 0 : dto.quantityOnHand(),
        null,
        null);
  }

  @Override
  public Material merge(Material existing, MaterialV1Dto dto) {
    return new Material(
        existing.id(),
        dto.sku(),
        dto.name().trim(),
        dto.unit().trim(),
        dto.unitPrice(),
        dto.quantityOnHand() == null ? existing.quantityOnHand() : dto.quantityOnHand(),
        existing.category(),
        existing.reorderLevel(),
        existing.createdAt(),
        existing.updatedAt());
  }

  @Override
  public MaterialV1Dto toDto(Material material) {
    return new MaterialV1Dto(
        material.id(),
        material.sku(),
        material.name(),
        material.unit(),
        material.unitPrice(),
        material.quantityOnHand());
  }

  @Override
  public long idOf(MaterialV1Dto dto) {
    return dto.id();
  }
}
