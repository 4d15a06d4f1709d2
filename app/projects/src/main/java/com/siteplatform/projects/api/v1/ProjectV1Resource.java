package com.siteplatform.projects.api.v1;

import com.siteplatform.common.dispatch.CodecBackedResource;
import com.siteplatform.common.version.ApiVersion;
import com.siteplatform.projects.model.Project;
import com.siteplatform.projects.service.ProjectService;
import org.springframework.stereotype.Component;

/** projects@1.0 のハンドラ。 */
@Component
public class ProjectV1Resource extends CodecBackedResource<Project, ProjectV1Dto> {

  public static final String RESOURCE = "projects";
  public static final ApiVersion VERSION = new ApiVersion(1, 0);

  public ProjectV1Resource(ProjectV1Codec codec, ProjectService projectService) {
    super(RESOURCE, VERSION, ProjectV1Dto.class, codec, projectService);
  }
}
