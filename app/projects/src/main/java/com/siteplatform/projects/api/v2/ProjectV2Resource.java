/*
 * どこで: Projects API v2
 * 何を: projects@2.0 のハンドラと v2 固有の業務ルール
 * なぜ: 開始日の無いプロジェクトを稼働させない制約を v2 から導入したため
 */
package com.siteplatform.projects.api.v2;

import com.siteplatform.common.api.BusinessRuleException;
import com.siteplatform.common.dispatch.CodecBackedResource;
import com.siteplatform.common.version.ApiVersion;
import com.siteplatform.projects.model.Project;
import com.siteplatform.projects.model.ProjectStatus;
import com.siteplatform.projects.service.ProjectService;
import org.springframework.stereotype.Component;

@Component
public class ProjectV2Resource extends CodecBackedResource<Project, ProjectV2Dto> {

  public static final String RESOURCE = "projects";
  public static final ApiVersion VERSION = new ApiVersion(2, 0);

  public ProjectV2Resource(ProjectV2Codec codec, ProjectService projectService) {
    super(RESOURCE, VERSION, ProjectV2Dto.class, codec, projectService);
  }

  @Override
  protected void beforeCreate(Project draft) {
    requireStartDateWhenActive(draft);
  }

  @Override
  protected void beforeUpdate(Project existing, Project merged) {
    requireStartDateWhenActive(merged);
  }

  private static void requireStartDateWhenActive(Project project) {
    if (project.status() == ProjectStatus.ACTIVE && project.startDate() == null) {
      throw new BusinessRuleException("start_date is required for an ACTIVE project");
    }
  }
}
