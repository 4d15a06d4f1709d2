package com.siteplatform.projects.api.v2;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.Test;

class ProjectV2CodecTest {

  private final ProjectV2Codec codec = new ProjectV2Codec();

  @Test
  void validateRejectsEndBeforeStart() {
    final ProjectV2Dto dto =
        new ProjectV2Dto(
            null, "Tower", null, null, LocalDate.of(2026, 5, 1), LocalDate.of(2026, 4, 30), null, null, null);

    assertThat(codec.validate(dto).asMap()).containsOnlyKeys("end_date");
  }

  @Test
  void validateRejectsNegativeBudget() {
    final ProjectV2Dto dto =
        new ProjectV2Dto(null, "Tower", null, null, null, null, new BigDecimal("-0.01"), null, null);

    assertThat(codec.validate(dto).asMap()).containsOnlyKeys("budget");
  }

  @Test
  void validateRejectsBudgetTheColumnWouldRound() {
    final ProjectV2Dto dto =
        new ProjectV2Dto(null, "Tower", null, null, null, null, new BigDecimal("0.125"), null, null);

    assertThat(codec.validate(dto).asMap())
        .containsOnlyKeys("budget")
        .containsValue(List.of("budget must have at most 2 decimal places"));
  }

  @Test
  void validateRejectsBudgetTheColumnCannotHold() {
    final ProjectV2Dto dto =
        new ProjectV2Dto(null, "Tower", null, null, null, null, new BigDecimal("1E+13"), null, null);

    assertThat(codec.validate(dto).asMap())
        .containsOnlyKeys("budget")
        .containsValue(List.of("budget must have at most 12 integer digits"));
  }

  @Test
  void validateAcceptsSameDayProject() {
    final LocalDate day = LocalDate.of(2026, 5, 1);
    final ProjectV2Dto dto =
        new ProjectV2Dto(null, "Tower", null, "active", day, day, BigDecimal.ZERO, null, null);

    assertThat(codec.validate(dto).isEmpty()).isTrue();
  }
}
