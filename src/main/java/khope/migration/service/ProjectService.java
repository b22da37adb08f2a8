package khope.migration.service;

import khope.migration.domain.BoardType;
import khope.migration.domain.Project;
import khope.migration.domain.WorkspaceDocument;
import khope.migration.dualread.DualReadCache;
import khope.migration.dualread.DualReadResolver;
import khope.migration.dualread.DualReadResult;
import khope.migration.exception.ResourceNotFoundException;
import khope.migration.identity.IdentityGuard;
import khope.migration.identity.VerifiedIdentity;
import khope.migration.migration.dto.LegacyProject;
import khope.migration.repository.ProjectRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 프로젝트 CRUD
 *
 * 워크스페이스가 저장/변경될 때마다 ProjectFile 무결성 레코드를 교체한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProjectService {

    private static final int DEFAULT_PUBLIC_LIMIT = 20;
    private static final int MAX_PUBLIC_LIMIT = 100;

    private final ProjectRepository projectRepository;
    private final ProjectFileService projectFileService;
    private final TargetRecordValidator validator;
    private final DualReadResolver dualReadResolver;
    private final DualReadCache dualReadCache;

    @Transactional
    public Project createProject(VerifiedIdentity caller, ProjectDraft draft) {
        IdentityGuard.requireIdentity(caller);
        String workspace = draft.workspace() != null ? draft.workspace() : WorkspaceDocument.EMPTY;
        validator.validateProjectName(draft.name());
        validator.validateWorkspace(workspace, draft.name());

        Project project = projectRepository.save(Project.builder()
                .userId(caller.subject())
                .name(draft.name())
                .description(draft.description() != null ? draft.description() : "")
                .workspace(workspace)
                .boardType(draft.boardType() != null ? BoardType.fromValue(draft.boardType()) : BoardType.DEFAULT)
                .isPublic(Boolean.TRUE.equals(draft.isPublic()))
                .canShare(Boolean.TRUE.equals(draft.canShare()))
                .tags(draft.tags() != null ? new LinkedHashSet<>(draft.tags()) : new LinkedHashSet<>())
                .build());

        projectFileService.saveWorkspaceFile(project);
        dualReadCache.evict(caller.subject());
        log.info("프로젝트 생성 - userId: {}, projectId: {}", caller.subject(), project.getId());
        return project;
    }

    /**
     * 소유자만 수정 가능. null 필드는 유지한다.
     */
    @Transactional
    public Project updateProject(VerifiedIdentity caller, Long projectId, ProjectDraft draft) {
        IdentityGuard.requireIdentity(caller);
        Project project = findOwned(caller, projectId);

        if (draft.name() != null) {
            validator.validateProjectName(draft.name());
            project.setName(draft.name());
        }
        boolean workspaceChanged = false;
        if (draft.workspace() != null) {
            validator.validateWorkspace(draft.workspace(), project.getName());
            workspaceChanged = !Objects.equals(draft.workspace(), project.getWorkspace());
            project.setWorkspace(draft.workspace());
        }
        if (draft.description() != null) {
            project.setDescription(draft.description());
        }
        if (draft.boardType() != null) {
            project.setBoardType(BoardType.fromValue(draft.boardType()));
        }
        if (draft.isPublic() != null) {
            project.setIsPublic(draft.isPublic());
        }
        if (draft.canShare() != null) {
            project.setCanShare(draft.canShare());
        }
        if (draft.tags() != null) {
            project.getTags().clear();
            project.getTags().addAll(draft.tags());
        }
        project.setUpdated(Instant.now());

        Project saved = projectRepository.save(project);
        if (workspaceChanged) {
            projectFileService.saveWorkspaceFile(saved);
        }
        dualReadCache.evict(caller.subject());
        return saved;
    }

    /**
     * 소유자이거나 공개 프로젝트일 때만 조회된다.
     */
    @Transactional(readOnly = true)
    public Optional<Project> getProject(VerifiedIdentity caller, Long projectId) {
        return projectRepository.findById(projectId)
                .filter(p -> Boolean.TRUE.equals(p.getIsPublic()) || (caller != null && caller.owns(p.getUserId())));
    }

    @Transactional(readOnly = true)
    public Optional<Project> getPublicProject(Long projectId) {
        return projectRepository.findById(projectId)
                .filter(p -> Boolean.TRUE.equals(p.getIsPublic()));
    }

    public DualReadResult<List<Project>, List<LegacyProject>> getUserProjects(VerifiedIdentity caller) {
        IdentityGuard.requireIdentity(caller);
        return dualReadResolver.resolveProjects(caller, caller.subject());
    }

    @Transactional(readOnly = true)
    public List<Project> getPublicProjects(Integer limit) {
        int size = limit == null || limit <= 0 ? DEFAULT_PUBLIC_LIMIT : Math.min(limit, MAX_PUBLIC_LIMIT);
        return projectRepository.findByIsPublicTrueOrderByCreatedDesc(PageRequest.of(0, size));
    }

    @Transactional
    public long incrementViews(Long projectId) {
        Project project = projectRepository.findById(projectId)
                .filter(p -> Boolean.TRUE.equals(p.getIsPublic()))
                .orElseThrow(() -> new ResourceNotFoundException("Project not found or not public"));
        project.incrementViews();
        dualReadCache.evict(project.getUserId());
        return project.getViews();
    }

    /**
     * 파일 레코드를 먼저 삭제한 뒤 프로젝트를 삭제한다.
     */
    @Transactional
    public void deleteProject(VerifiedIdentity caller, Long projectId) {
        IdentityGuard.requireIdentity(caller);
        Project project = findOwned(caller, projectId);

        long files = projectFileService.deleteFiles(projectId);
        projectRepository.delete(project);
        dualReadCache.evict(caller.subject());
        log.info("프로젝트 삭제 - userId: {}, projectId: {}, 파일: {}건", caller.subject(), projectId, files);
    }

    private Project findOwned(VerifiedIdentity caller, Long projectId) {
        return projectRepository.findById(projectId)
                .filter(p -> caller.owns(p.getUserId()))
                .orElseThrow(() -> new ResourceNotFoundException("Project not found or access denied"));
    }

    public record ProjectDraft(
            String name,
            String description,
            String workspace,
            String boardType,
            Boolean isPublic,
            Boolean canShare,
            List<String> tags
    ) {}
}
