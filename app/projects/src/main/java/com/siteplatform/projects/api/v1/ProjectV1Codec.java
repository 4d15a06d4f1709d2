/*
 * どこで: Projects API v1
 * 何を: v1 DTO の検証と Project との相互変換
 * なぜ: v1 の入力ルールと射影を副作用の無い関数として保つため
 */
package com.siteplatform.projects.api.v1;

import com.siteplatform.common.api.ValidationErrors;
import com.siteplatform.common.dispatch.DtoCodec;
import com.siteplatform.projects.model.Project;
import com.siteplatform.projects.model.ProjectStatus;
import org.springframework.stereotype.Component;

@Component
public class ProjectV1Codec implements DtoCodec<Project, ProjectV1Dto> {

  static final int NAME_MAX = 200;
  static final int DESCRIPTION_MAX = 2000;

  @Override
  public ValidationErrors validate(ProjectV1Dto dto) {
    final ValidationErrors errors = new ValidationErrors();
    errors.requireText("name", dto.name(), NAME_MAX);
    errors.optionalText("description", dto.description(), DESCRIPTION_MAX);
    if (dto.status() != null) {
      errors.check(
          ProjectStatus.tryParse(dto.status()).isPresent(),
          "status",
          "status must be one of PLANNED, ACTIVE, ON_HOLD, COMPLETED, CANCELLED");
    }
    return errors;
  }

  @Override
  public Project toEntity(ProjectV1Dto dto) {
    return Project.draft(
        dto.name().trim(), dto.description(), parseStatus(dto.status()), null, null, null);
  }

  @Override
  public Project merge(Project existing, ProjectV1Dto dto) {
    final ProjectStatus status =
        dto.status() == null ? existing.status() : parseStatus(dto.status());
    // v1 に無い列 (日付・予算) は既存値を保持する
    return new Project(
        existing.id(),
        dto.name().trim(),
        dto.description(),
        status,
        existing.startDate(),
        existing.endDate(),
        existing.budget(),
        existing.createdAt(),
        existing.updatedAt());
  }

  @Override
  public ProjectV1Dto toDto(Project project) {
    return new ProjectV1Dto(
        project.id(), project.name(), project.description(), project.status().name());
  }

  @Override
  public long idOf(ProjectV1Dto dto) {
    return dto.id();
  }

  private static ProjectStatus parseStatus(String raw) {
    return ProjectStatus.tryParse(raw).orElse(null);
  }
}
