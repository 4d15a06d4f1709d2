/*
 * どこで: MaterialService の単体テスト
 * 何を: sku の一意性・不変性を検証する
 * なぜ: 重複登録や sku 変更が業務ルール違反 (409) になることを固定するため
 */
package com.siteplatform.materials.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.siteplatform.common.api.BusinessRuleException;
import com.siteplatform.common.api.NotFoundException;
import com.siteplatform.materials.model.Material;
import com.siteplatform.materials.repository.MaterialRepository;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.dao.DuplicateKeyException;

class MaterialServiceTest {

  private static final Instant NOW = Instant.parse("2026-03-01T00:00:00Z");

  private MaterialRepository materialRepository;
  private MaterialService materialService;

  @BeforeEach
  void setUp() {
    materialRepository = Mockito.mock(MaterialRepository.class);
    materialService = new MaterialService(materialRepository);
    when(materialRepository.resourceName()).thenReturn("material");
  }

  @Test
  void createRejectsKnownSku() {
    when(materialRepository.findBySku("CEM-42")).thenReturn(Optional.of(stored(1L, "CEM-42", 10, null)));

    assertThatThrownBy(() -> materialService.create(draft("CEM-42")))
        .isInstanceOf(BusinessRuleException.class)
        .hasMessage("sku already exists: CEM-42");
    verify(materialRepository, never()).create(any());
  }

  @Test
  void createTranslatesConcurrentDuplicateKey() {
    when(materialRepository.findBySku("CEM-42")).thenReturn(Optional.empty());
    when(materialRepository.create(any())).thenThrow(new DuplicateKeyException("materials_sku_key"));

    assertThatThrownBy(() -> materialService.create(draft("CEM-42")))
        .isInstanceOf(BusinessRuleException.class)
        .hasCauseInstanceOf(DuplicateKeyException.class);
  }

  @Test
  void updateRejectsSkuChange() {
    when(materialRepository.require(1L)).thenReturn(stored(1L, "CEM-42", 10, null));

    assertThatThrownBy(
            () ->
                materialService.update(
                    1L, existing -> stored(1L, "CEM-43", existing.quantityOnHand(), null)))
        .isInstanceOf(BusinessRuleException.class)
        .hasMessageContaining("sku");
    verify(materialRepository, never()).update(anyLong(), any());
  }

  @Test
  void updateStoresQuantityChange() {
    when(materialRepository.require(1L)).thenReturn(stored(1L, "CEM-42", 10, 5));
    when(materialRepository.update(eq(1L), any()))
        .thenAnswer(invocation -> Optional.of(invocation.getArgument(1)));

    final Material updated = materialService.update(1L, existing -> stored(1L, "CEM-42", 4, 5));

    assertThat(updated.quantityOnHand()).isEqualTo(4);
    assertThat(updated.needsReorder()).isTrue();
  }

  @Test
  void deleteOfMissingMaterialIsNotFound() {
    when(materialRepository.delete(3L)).thenReturn(false);

    assertThatThrownBy(() -> materialService.delete(3L)).isInstanceOf(NotFoundException.class);
  }

  private static Material draft(String sku) {
    return Material.draft(sku, "Cement", "bag", new BigDecimal("7.50"), 10, null, null);
  }

  private static Material stored(long id, String sku, int quantity, Integer reorderLevel) {
    return new Material(
        id, sku, "Cement", "bag", new BigDecimal("7.50"), quantity, "binders", reorderLevel, NOW, NOW);
  }
}
