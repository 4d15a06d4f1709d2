/*
 * どこで: Projects ドメインサービス
 * 何を: 全バージョン共通の業務ルール (状態遷移) とリポジトリ操作をまとめる
 * なぜ: v1/v2 で同じ状態機械を共有し、バージョン差分を codec 側に閉じ込めるため
 */
package com.siteplatform.projects.service;

import com.siteplatform.common.api.BusinessRuleException;
import com.siteplatform.common.api.NotFoundException;
import com.siteplatform.common.dispatch.EntityService;
import com.siteplatform.common.repository.ListFilter;
import com.siteplatform.projects.model.Project;
import com.siteplatform.projects.model.ProjectStatus;
import com.siteplatform.projects.repository.ProjectRepository;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.function.UnaryOperator;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class ProjectService implements EntityService<Project> {

  private static final Logger logger = LoggerFactory.getLogger(ProjectService.class);

  // 作成直後に取り得る状態
  private static final Set<ProjectStatus> INITIAL_STATES =
      EnumSet.of(ProjectStatus.PLANNED, ProjectStatus.ACTIVE);

  private final ProjectRepository projectRepository;

  @Override
  public Project get(long id) {
    return projectRepository.require(id);
  }

  @Override
  public List<Project> list(ListFilter filter) {
    return projectRepository.list(filter);
  }

  @Override
  public Project create(Project draft) {
    final Project candidate =
        draft.status() == null ? draft.withStatus(ProjectStatus.PLANNED) : draft;
    if (!INITIAL_STATES.contains(candidate.status())) {
      throw new BusinessRuleException(
          "project cannot be created in status " + candidate.status());
    }
    final Project created = projectRepository.create(candidate);
    logger.info("project created id={} status={}", created.id(), created.status());
    return created;
  }

  @Override
  @Transactional
  public Project update(long id, UnaryOperator<Project> change) {
    final Project existing = projectRepository.require(id);
    final Project candidate = change.apply(existing);
    if (!existing.status().canTransitionTo(candidate.status())) {
      throw new BusinessRuleException(
          "project status cannot change from " + existing.status() + " to " + candidate.status());
    }
    final Project updated =
        projectRepository
            .update(id, candidate)
            .orElseThrow(() -> new NotFoundException(projectRepository.resourceName(), id));
    if (existing.status() != updated.status()) {
      logger.info(
          "project status changed id={} from={} to={}", id, existing.status(), updated.status());
    }
    return updated;
  }

  @Override
  public void delete(long id) {
    if (!projectRepository.delete(id)) {
      throw new NotFoundException(projectRepository.resourceName(), id);
    }
    logger.info("project deleted id={}", id);
  }
}
