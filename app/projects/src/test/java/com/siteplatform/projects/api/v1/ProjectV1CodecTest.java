package com.siteplatform.projects.api.v1;

import static org.assertj.core.api.Assertions.assertThat;

import com.siteplatform.projects.model.Project;
import com.siteplatform.projects.model.ProjectStatus;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import org.junit.jupiter.api.Test;

class ProjectV1CodecTest {

  private final ProjectV1Codec codec = new ProjectV1Codec();

  @Test
  void validateRequiresName() {
    assertThat(codec.validate(new ProjectV1Dto(null, " ", null, null)).asMap())
        .containsOnlyKeys("name");
  }

  @Test
  void validateRejectsUnknownStatus() {
    assertThat(codec.validate(new ProjectV1Dto(null, "Tower", null, "paused")).asMap())
        .containsOnlyKeys("status");
  }

  @Test
  void validateRejectsOverlongDescription() {
    final String description = "x".repeat(ProjectV1Codec.DESCRIPTION_MAX + 1);
    assertThat(codec.validate(new ProjectV1Dto(null, "Tower", description, null)).asMap())
        .containsOnlyKeys("description");
  }

  @Test
  void toEntityLeavesMissingStatusForServiceDefault() {
    final Project draft = codec.toEntity(new ProjectV1Dto(null, " Tower ", "north", null));

    assertThat(draft.id()).isNull();
    assertThat(draft.name()).isEqualTo("Tower");
    assertThat(draft.status()).isNull();
  }

  @Test
  void mergeKeepsColumnsOutsideTheV1Contract() {
    final Project existing =
        new Project(
            3L,
            "Tower",
            null,
            ProjectStatus.ACTIVE,
            LocalDate.of(2026, 1, 1),
            LocalDate.of(2026, 12, 31),
            new BigDecimal("1000.00"),
            Instant.parse("2026-01-01T00:00:00Z"),
            Instant.parse("2026-01-02T00:00:00Z"));

    final Project merged = codec.merge(existing, new ProjectV1Dto(null, "Tower B", "renamed", null));

    assertThat(merged.name()).isEqualTo("Tower B");
    assertThat(merged.status()).isEqualTo(ProjectStatus.ACTIVE);
    assertThat(merged.startDate()).isEqualTo(LocalDate.of(2026, 1, 1));
    assertThat(merged.budget()).isEqualByComparingTo("1000");
  }
}
