package khope.migration.service;

import khope.migration.checksum.ChecksumEngine;
import khope.migration.domain.Project;
import khope.migration.domain.ProjectFile;
import khope.migration.dualread.DualReadResult;
import khope.migration.dualread.ReadSource;
import khope.migration.exception.ResourceNotFoundException;
import khope.migration.exception.ValidationException;
import khope.migration.migration.dto.LegacyProject;
import khope.migration.repository.ProjectFileRepository;
import khope.migration.repository.ProjectRepository;
import khope.migration.support.TestDataCleaner;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static khope.migration.support.TestFixtures.VALID_WORKSPACE;
import static khope.migration.support.TestFixtures.user;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@DisplayName("ProjectService - 프로젝트와 워크스페이스 무결성 레코드")
class ProjectServiceTest {

    private static final String UPDATED_WORKSPACE = "<xml><block type=\"servo_write\"/><block type=\"delay\"/></xml>";

    @Autowired
    private ProjectService projectService;

    @Autowired
    private ProjectFileService projectFileService;

    @Autowired
    private ChecksumEngine checksumEngine;

    @Autowired
    private ProjectRepository projectRepository;

    @Autowired
    private ProjectFileRepository projectFileRepository;

    @Autowired
    private TestDataCleaner cleaner;

    @AfterEach
    void tearDown() {
        cleaner.clean();
    }

    private static ProjectService.ProjectDraft draft(String name, String workspace) {
        return new ProjectService.ProjectDraft(name, null, workspace, null, null, null, List.of("led"));
    }

    @Test
    @DisplayName("생성 시 워크스페이스 파일 레코드가 함께 저장된다")
    void createStoresFileRecord() {
        Project project = projectService.createProject(user("user-1"), draft("Blink", VALID_WORKSPACE));

        List<ProjectFile> files = projectFileService.listFiles(project.getId());

        assertThat(files).hasSize(1);
        ProjectFile file = files.get(0);
        assertThat(file.getFilename()).isEqualTo(ProjectFile.WORKSPACE_FILENAME);
        assertThat(file.getContentType()).isEqualTo("application/xml");
        assertThat(file.getSize()).isEqualTo((long) VALID_WORKSPACE.getBytes(StandardCharsets.UTF_8).length);
        assertThat(file.getChecksum()).isEqualTo(checksumEngine.checksum(VALID_WORKSPACE));
        assertThat(file.getStorageRef()).isEqualTo("project-" + project.getId() + "-workspace");
    }

    @Test
    @DisplayName("워크스페이스 변경 시 파일 레코드가 교체되고 무결성 검증 통과")
    void updateReplacesFileRecord() {
        Project project = projectService.createProject(user("user-1"), draft("Blink", VALID_WORKSPACE));

        projectService.updateProject(user("user-1"), project.getId(), draft(null, UPDATED_WORKSPACE));

        List<ProjectFile> files = projectFileService.listFiles(project.getId());
        assertThat(files).hasSize(1);
        assertThat(files.get(0).getChecksum()).isEqualTo(checksumEngine.checksum(UPDATED_WORKSPACE));

        ProjectFileService.IntegrityReport report = projectFileService.verifyIntegrity(project.getId());
        assertThat(report.valid()).isTrue();
    }

    @Test
    @DisplayName("레코드를 거치지 않고 워크스페이스가 바뀌면 무결성 검증 실패")
    void tamperedWorkspaceFailsIntegrity() {
        Project project = projectService.createProject(user("user-1"), draft("Blink", VALID_WORKSPACE));
        Project stored = projectRepository.findById(project.getId()).orElseThrow();
        stored.setWorkspace(UPDATED_WORKSPACE);
        projectRepository.save(stored);

        ProjectFileService.IntegrityReport report = projectFileService.verifyIntegrity(project.getId());

        assertThat(report.valid()).isFalse();
        assertThat(report.actualChecksum()).isNotEqualTo(report.expectedChecksum());
    }

    @Test
    @DisplayName("이름 길이와 워크스페이스 형식 검증")
    void createValidatesInput() {
        assertThatThrownBy(() -> projectService.createProject(user("user-1"), draft("", VALID_WORKSPACE)))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Project name must be between 1 and 100 characters");

        assertThatThrownBy(() -> projectService.createProject(user("user-1"), draft("x".repeat(101), VALID_WORKSPACE)))
                .isInstanceOf(ValidationException.class);

        assertThatThrownBy(() -> projectService.createProject(user("user-1"), draft("Blink", "<block/>")))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("Invalid XML content");

        assertThat(projectRepository.count()).isZero();
    }

    @Test
    @DisplayName("소유자가 아니면 수정/삭제 불가")
    void onlyOwnerCanModify() {
        Project project = projectService.createProject(user("user-1"), draft("Blink", VALID_WORKSPACE));

        assertThatThrownBy(() -> projectService.updateProject(user("user-2"), project.getId(), draft("Hijack", null)))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessage("Project not found or access denied");
        assertThatThrownBy(() -> projectService.deleteProject(user("user-2"), project.getId()))
                .isInstanceOf(ResourceNotFoundException.class);

        assertThat(projectService.getProject(user("user-2"), project.getId())).isEmpty();
        assertThat(projectService.getProject(user("user-1"), project.getId())).isPresent();
    }

    @Test
    @DisplayName("삭제 시 파일 레코드도 함께 삭제")
    void deleteRemovesFiles() {
        Project project = projectService.createProject(user("user-1"), draft("Blink", VALID_WORKSPACE));

        projectService.deleteProject(user("user-1"), project.getId());

        assertThat(projectRepository.count()).isZero();
        assertThat(projectFileRepository.count()).isZero();
    }

    @Test
    @DisplayName("조회수는 공개 프로젝트만 증가")
    void viewsOnlyForPublicProjects() {
        Project privateProject = projectService.createProject(user("user-1"), draft("Secret", VALID_WORKSPACE));
        Project publicProject = projectService.createProject(user("user-1"),
                new ProjectService.ProjectDraft("Shared", "demo", VALID_WORKSPACE, "mega", true, true, null));

        assertThatThrownBy(() -> projectService.incrementViews(privateProject.getId()))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessage("Project not found or not public");

        assertThat(projectService.incrementViews(publicProject.getId())).isEqualTo(1);
        assertThat(projectService.incrementViews(publicProject.getId())).isEqualTo(2);
        assertThat(projectService.getPublicProjects(null))
                .extracting(Project::getName)
                .containsExactly("Shared");
        assertThat(projectService.getPublicProject(privateProject.getId())).isEmpty();
    }

    @Test
    @DisplayName("조회수 증가 후 내 프로젝트 목록은 캐시가 아닌 최신 값을 돌려준다")
    void viewIncrementRefreshesCachedList() {
        Project shared = projectService.createProject(user("user-1"),
                new ProjectService.ProjectDraft("Shared", null, VALID_WORKSPACE, null, true, null, null));
        projectService.getUserProjects(user("user-1"));
        assertThat(projectService.getUserProjects(user("user-1")).source()).isEqualTo(ReadSource.CACHE);

        projectService.incrementViews(shared.getId());
        DualReadResult<List<Project>, List<LegacyProject>> result = projectService.getUserProjects(user("user-1"));

        assertThat(result.source()).isEqualTo(ReadSource.TARGET);
        assertThat(result.data()).extracting(Project::getViews).containsExactly(1L);
    }
}
