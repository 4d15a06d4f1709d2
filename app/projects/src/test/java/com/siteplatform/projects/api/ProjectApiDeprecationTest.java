/*
 * どこで: projects API の非推奨バージョンテスト
 * 何を: DEPRECATED の v1 が通常どおり応答し、非推奨ヘッダが付くことを検証する
 * なぜ: 移行期間中のクライアントを壊さずに非推奨を通知するため
 */
package com.siteplatform.projects.api;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.siteplatform.common.api.ApiExceptionHandler;
import com.siteplatform.common.dispatch.ApiMetrics;
import com.siteplatform.common.dispatch.ResourceDispatchController;
import com.siteplatform.common.dispatch.VersionRegistry;
import com.siteplatform.common.version.VersionLifecycleStore;
import com.siteplatform.projects.api.v1.ProjectV1Codec;
import com.siteplatform.projects.api.v1.ProjectV1Resource;
import com.siteplatform.projects.api.v2.ProjectV2Codec;
import com.siteplatform.projects.api.v2.ProjectV2Resource;
import com.siteplatform.projects.model.Project;
import com.siteplatform.projects.model.ProjectStatus;
import com.siteplatform.projects.service.ProjectService;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(ResourceDispatchController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import({
  ApiExceptionHandler.class,
  VersionRegistry.class,
  ProjectV1Codec.class,
  ProjectV1Resource.class,
  ProjectV2Codec.class,
  ProjectV2Resource.class
})
@TestPropertySource(
    properties = {
      "site.api.lifecycle[0].resource=projects",
      "site.api.lifecycle[0].version=1.0",
      "site.api.lifecycle[0].state=DEPRECATED"
    })
class ProjectApiDeprecationTest {

  private static final Instant NOW = Instant.parse("2026-03-01T09:00:00Z");

  @Autowired private MockMvc mockMvc;

  @MockitoBean private ProjectService projectService;

  @MockitoBean private ApiMetrics apiMetrics;

  @MockitoBean private VersionLifecycleStore lifecycleStore;

  @BeforeEach
  void setUp() {
    when(projectService.get(4L))
        .thenReturn(new Project(4L, "Depot", null, ProjectStatus.PLANNED, null, null, null, NOW, NOW));
  }

  @Test
  void deprecatedVersionStillServesAndIsAnnotated() throws Exception {
    mockMvc
        .perform(get("/api/v1/projects/4"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.name").value("Depot"))
        .andExpect(header().string("X-Api-Version", "1.0"))
        .andExpect(header().string("Deprecation", "true"))
        .andExpect(
            header().string("Warning", "299 - \"API version 1.0 of projects is deprecated\""));
  }

  @Test
  void activeVersionIsNotAnnotated() throws Exception {
    mockMvc
        .perform(get("/api/v2/projects/4"))
        .andExpect(status().isOk())
        .andExpect(header().string("X-Api-Version", "2.0"))
        .andExpect(header().doesNotExist("Deprecation"));
  }
}
