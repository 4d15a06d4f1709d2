/*
 * どこで: Projects API v2
 * 何を: v2 DTO の検証 (期間・予算を含む) と Project との相互変換
 * なぜ: v2 で追加された入力ルールを v1 と独立に保つため
 */
package com.siteplatform.projects.api.v2;

import com.siteplatform.common.api.ValidationErrors;
import com.siteplatform.common.dispatch.DtoCodec;
import com.siteplatform.projects.model.Project;
import com.siteplatform.projects.model.ProjectStatus;
import org.springframework.stereotype.Component;

@Component
public class ProjectV2Codec implements DtoCodec<Project, ProjectV2Dto> {

  static final int NAME_MAX = 200;
  static final int DESCRIPTION_MAX = 2000;
  // projects.budget NUMERIC(14, 2)
  static final int BUDGET_PRECISION = 14;
  static final int BUDGET_SCALE = 2;

  @Override
  public ValidationErrors validate(ProjectV2Dto dto) {
    final ValidationErrors errors = new ValidationErrors();
    errors.requireText("name", dto.name(), NAME_MAX);
    errors.optionalText("description", dto.description(), DESCRIPTION_MAX);
    if (dto.status() != null) {
      errors.check(
          ProjectStatus.tryParse(dto.status()).isPresent(),
          "status",
          "status must be one of PLANNED, ACTIVE, ON_HOLD, COMPLETED, CANCELLED");
    }
    if (dto.startDate() != null && dto.endDate() != null) {
      errors.check(
          !dto.endDate().isBefore(dto.startDate()),
          "end_date",
          "end_date must not be before start_date");
    }
    errors.nonNegative("budget", dto.budget());
    errors.decimal("budget", dto.budget(), BUDGET_PRECISION, BUDGET_SCALE);
    return errors;
  }

  @Override
  public Project toEntity(ProjectV2Dto dto) {
    return Project.draft(
        dto.name().trim(),
        dto.description(),
        ProjectStatus.tryParse(dto.status()).orElse(null),
        dto.startDate(),
        dto.endDate(),
        dto.budget());
  }

  @Override
  public Project merge(Project existing, ProjectV2Dto dto) {
    final ProjectStatus status =
        ProjectStatus.tryParse(dto.status()).orElse(existing.status());
    return new Project(
        existing.id(),
        dto.name().trim(),
        dto.description(),
        status,
        dto.startDate(),
        dto.endDate(),
        dto.budget(),
        existing.createdAt(),
        existing.updatedAt());
  }

  @Override
  public ProjectV2Dto toDto(Project project) {
    return new ProjectV2Dto(
        project.id(),
        project.name(),
        project.description(),
        project.status().name(),
        project.startDate(),
        project.endDate(),
        project.budget(),
        project.createdAt(),
        project.updatedAt());
  }

  @Override
  public long idOf(ProjectV2Dto dto) {
    return dto.id();
  }
}
