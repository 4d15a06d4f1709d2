package com.siteplatform.logistics.api.v2;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class OrderV2CodecTest {

  private final OrderV2Codec codec = new OrderV2Codec();

  @Test
  void deliveryAddressIsRequired() {
    final OrderV2Dto dto =
        new OrderV2Dto(null, "PO-1", "CEM-42", 5, null, null, "  ", null, null);

    assertThat(codec.validate(dto).asMap()).containsOnlyKeys("delivery_address");
  }

  @Test
  void quantityMustBePositive() {
    final OrderV2Dto dto =
        new OrderV2Dto(null, "PO-1", "CEM-42", 0, "shipped?", null, "Dock 3", null, null);

    assertThat(codec.validate(dto).asMap()).containsOnlyKeys("quantity", "status");
  }
}
