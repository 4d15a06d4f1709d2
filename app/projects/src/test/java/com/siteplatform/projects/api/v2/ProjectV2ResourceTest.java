/*
 * どこで: projects@2.0 ハンドラの単体テスト
 * 何を: v2 固有の「稼働には開始日が必要」ルールを検証する
 * なぜ: v1 では許される操作が v2 で拒否されることを固定するため
 */
package com.siteplatform.projects.api.v2;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.siteplatform.common.api.BusinessRuleException;
import com.siteplatform.common.api.ValidationException;
import com.siteplatform.projects.model.Project;
import com.siteplatform.projects.model.ProjectStatus;
import com.siteplatform.projects.service.ProjectService;
import java.time.Instant;
import java.time.LocalDate;
import java.util.function.UnaryOperator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

class ProjectV2ResourceTest {

  private static final Instant NOW = Instant.parse("2026-03-01T00:00:00Z");

  private ProjectService projectService;
  private ProjectV2Resource resource;

  @BeforeEach
  void setUp() {
    projectService = Mockito.mock(ProjectService.class);
    resource = new ProjectV2Resource(new ProjectV2Codec(), projectService);
  }

  @Test
  void createActiveWithoutStartDateIsBusinessRuleViolation() {
    final ProjectV2Dto dto =
        new ProjectV2Dto(null, "Tower", null, "ACTIVE", null, null, null, null, null);

    assertThatThrownBy(() -> resource.create(dto)).isInstanceOf(BusinessRuleException.class);
    verify(projectService, never()).create(any());
  }

  @Test
  void createWithInvalidInputIsValidationError() {
    final ProjectV2Dto dto = new ProjectV2Dto(null, null, null, null, null, null, null, null, null);

    assertThatThrownBy(() -> resource.create(dto))
        .isInstanceOfSatisfying(
            ValidationException.class, ex -> assertThat(ex.errors()).containsKey("name"));
  }

  @Test
  @SuppressWarnings("unchecked")
  void updateToActiveRequiresStartDateOnMergedValue() {
    final Project existing =
        new Project(7L, "Tower", null, ProjectStatus.PLANNED, null, null, null, NOW, NOW);
    when(projectService.update(eq(7L), any()))
        .thenAnswer(
            invocation -> ((UnaryOperator<Project>) invocation.getArgument(1)).apply(existing));

    final ProjectV2Dto withoutStart =
        new ProjectV2Dto(null, "Tower", null, "ACTIVE", null, null, null, null, null);
    assertThatThrownBy(() -> resource.update(7L, withoutStart))
        .isInstanceOf(BusinessRuleException.class);

    final ProjectV2Dto withStart =
        new ProjectV2Dto(
            null, "Tower", null, "ACTIVE", LocalDate.of(2026, 3, 1), null, null, null, null);
    assertThat(resource.update(7L, withStart).status()).isEqualTo("ACTIVE");
  }
}
