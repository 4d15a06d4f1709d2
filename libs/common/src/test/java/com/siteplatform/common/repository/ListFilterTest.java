package com.siteplatform.common.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.siteplatform.common.api.ValidationException;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ListFilterTest {

  @Test
  void pagingParametersAreSeparatedFromCriteria() {
    final ListFilter filter =
        ListFilter.fromQueryParameters(Map.of("status", "ACTIVE", "limit", "20", "offset", "40"));

    assertThat(filter.criteria()).containsExactlyEntriesOf(Map.of("status", "ACTIVE"));
    assertThat(filter.limit()).isEqualTo(20);
    assertThat(filter.offset()).isEqualTo(40);
  }

  @Test
  void defaultsApplyWhenPagingIsAbsent() {
    final ListFilter filter = ListFilter.fromQueryParameters(Map.of());

    assertThat(filter.limit()).isEqualTo(ListFilter.DEFAULT_LIMIT);
    assertThat(filter.offset()).isZero();
  }

  @Test
  void outOfRangePagingIsValidationError() {
    assertThatThrownBy(
            () -> ListFilter.fromQueryParameters(Map.of("limit", "501", "offset", "-1")))
        .isInstanceOfSatisfying(
            ValidationException.class,
            ex -> assertThat(ex.errors()).containsKeys("limit", "offset"));
  }

  @Test
  void nonNumericLimitIsValidationError() {
    assertThatThrownBy(() -> ListFilter.fromQueryParameters(Map.of("limit", "ten")))
        .isInstanceOfSatisfying(
            ValidationException.class,
            ex -> assertThat(ex.errors().get("limit")).contains("limit must be an integer"));
  }
}
