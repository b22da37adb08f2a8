package khope.migration.migration;

import khope.migration.checksum.ChecksumEngine;
import khope.migration.domain.MigrationStatus;
import khope.migration.domain.Project;
import khope.migration.exception.AuthorizationException;
import khope.migration.exception.ResourceNotFoundException;
import khope.migration.migration.dto.LegacyDataBundle;
import khope.migration.migration.dto.MigrationResult;
import khope.migration.migration.dto.MigrationStatusView;
import khope.migration.migration.dto.RollbackResult;
import khope.migration.repository.ProfileRepository;
import khope.migration.repository.ProjectFileRepository;
import khope.migration.repository.ProjectRepository;
import khope.migration.repository.SettingsRepository;
import khope.migration.service.ProjectService;
import khope.migration.support.TestDataCleaner;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;

import static khope.migration.support.TestFixtures.VALID_WORKSPACE;
import static khope.migration.support.TestFixtures.admin;
import static khope.migration.support.TestFixtures.profile;
import static khope.migration.support.TestFixtures.project;
import static khope.migration.support.TestFixtures.settings;
import static khope.migration.support.TestFixtures.user;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@DisplayName("RollbackService - 마이그레이션 롤백")
class RollbackServiceTest {

    @Autowired
    private MigrationService migrationService;

    @Autowired
    private RollbackService rollbackService;

    @Autowired
    private ProjectService projectService;

    @Autowired
    private ChecksumEngine checksumEngine;

    @Autowired
    private SettingsRepository settingsRepository;

    @Autowired
    private ProfileRepository profileRepository;

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

    private MigrationResult migrateFourRecords() {
        LegacyDataBundle bundle = LegacyDataBundle.builder()
                .settings(settings())
                .profile(profile("user-1", "grace_h"))
                .projects(List.of(
                        project("fb-1", "Blink", VALID_WORKSPACE),
                        project("fb-2", "Servo", VALID_WORKSPACE)))
                .build();
        return migrationService.migrateUserData(user("user-1"), bundle, checksumEngine.checksum(bundle));
    }

    @Test
    @DisplayName("관리자는 롤백할 수 있고, 삭제 건수가 마이그레이션 건수와 일치한다")
    void adminRollbackRemovesMigratedRecords() {
        // Given
        MigrationResult migration = migrateFourRecords();
        assertThat(migration.migrated()).isEqualTo(4);

        // When
        RollbackResult result = rollbackService.rollback(admin(), "user-1", migration.migrationId());

        // Then
        assertThat(result.rolledBack())
                .containsEntry("settings", 1)
                .containsEntry("profile", 1)
                .containsEntry("projects", 2);
        assertThat(result.total()).isEqualTo(migration.migrated());
        assertThat(result.projectFiles()).isEqualTo(2);

        assertThat(settingsRepository.count()).isZero();
        assertThat(profileRepository.count()).isZero();
        assertThat(projectRepository.count()).isZero();
        assertThat(projectFileRepository.count()).isZero();
        assertThat(migrationService.findStatus("user-1"))
                .map(MigrationStatusView::status)
                .contains(MigrationStatus.ROLLED_BACK);
    }

    @Test
    @DisplayName("소유자라도 관리자가 아니면 롤백 불가, 데이터는 그대로")
    void ownerWithoutAdminCannotRollback() {
        MigrationResult migration = migrateFourRecords();

        assertThatThrownBy(() -> rollbackService.rollback(user("user-1"), "user-1", migration.migrationId()))
                .isInstanceOf(AuthorizationException.class)
                .hasMessage("Unauthorized: Only admins can rollback migrations");

        assertThat(projectRepository.count()).isEqualTo(2);
    }

    @Test
    @DisplayName("모르는 migrationId나 이미 롤백된 건은 ResourceNotFoundException")
    void unknownOrRepeatedRollbackIsNotFound() {
        MigrationResult migration = migrateFourRecords();

        assertThatThrownBy(() -> rollbackService.rollback(admin(), "user-1", "mig_unknown"))
                .isInstanceOf(ResourceNotFoundException.class);

        rollbackService.rollback(admin(), "user-1", migration.migrationId());

        assertThatThrownBy(() -> rollbackService.rollback(admin(), "user-1", migration.migrationId()))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    @DisplayName("마이그레이션 이후 직접 만든 프로젝트는 남긴다")
    void userCreatedRecordsSurviveRollback() {
        MigrationResult migration = migrateFourRecords();
        projectService.createProject(user("user-1"),
                new ProjectService.ProjectDraft("Fresh", null, VALID_WORKSPACE, null, null, null, null));

        rollbackService.rollback(admin(), "user-1", migration.migrationId());

        assertThat(projectRepository.findByUserIdOrderByCreatedDesc("user-1"))
                .extracting(Project::getName)
                .containsExactly("Fresh");
        assertThat(projectFileRepository.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("롤백 후에는 다시 마이그레이션할 수 있다")
    void rolledBackUserCanMigrateAgain() {
        MigrationResult first = migrateFourRecords();
        rollbackService.rollback(admin(), "user-1", first.migrationId());

        MigrationResult second = migrateFourRecords();

        assertThat(second.migrated()).isEqualTo(4);
        assertThat(second.migrationId()).isNotEqualTo(first.migrationId());
    }
}
