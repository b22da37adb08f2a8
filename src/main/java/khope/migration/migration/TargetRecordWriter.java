package khope.migration.migration;

import khope.migration.domain.Profile;
import khope.migration.domain.Project;
import khope.migration.domain.Settings;
import khope.migration.exception.ValidationException;
import khope.migration.repository.ProfileRepository;
import khope.migration.repository.ProjectRepository;
import khope.migration.repository.SettingsRepository;
import khope.migration.service.ProjectFileService;
import khope.migration.service.TargetRecordValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * 서브 리소스 단위 쓰기
 *
 * 메서드 하나가 트랜잭션 하나. 한 섹션의 실패가 이미 커밋된 다른 섹션을 되돌리지 않는다.
 * MigrationService에서 프록시를 거쳐 호출되도록 별도 빈으로 분리했다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TargetRecordWriter {

    private final SettingsRepository settingsRepository;
    private final ProfileRepository profileRepository;
    private final ProjectRepository projectRepository;
    private final ProjectFileService projectFileService;
    private final TargetRecordValidator validator;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Settings insertSettings(Settings settings, String migrationId) {
        if (settingsRepository.existsByUserId(settings.getUserId())) {
            throw new ValidationException("Settings already exist for user " + settings.getUserId());
        }
        settings.setMigrationId(migrationId);
        return settingsRepository.saveAndFlush(settings);
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Profile insertProfile(Profile profile, String migrationId) {
        if (profileRepository.existsByUserId(profile.getUserId())) {
            throw new ValidationException("Profile already exists for user " + profile.getUserId());
        }
        validator.validateProfile(profile);
        profile.setMigrationId(migrationId);
        return profileRepository.saveAndFlush(profile);
    }

    /**
     * 프로젝트와 워크스페이스 무결성 레코드를 함께 기록
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Project insertProject(Project project, String migrationId) {
        validator.validateProjectName(project.getName());
        validator.validateWorkspace(project.getWorkspace(), project.getName());
        project.setMigrationId(migrationId);

        Project saved = projectRepository.saveAndFlush(project);
        projectFileService.saveWorkspaceFile(saved);
        log.debug("프로젝트 기록 - userId: {}, projectId: {}, legacyId: {}",
                saved.getUserId(), saved.getId(), saved.getLegacyId());
        return saved;
    }
}
