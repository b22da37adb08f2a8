package khope.migration.migration;

import khope.migration.domain.MigrationRecord;
import khope.migration.domain.MigrationStatus;
import khope.migration.domain.Project;
import khope.migration.domain.ResourceKind;
import khope.migration.dualread.DualReadCache;
import khope.migration.exception.ResourceNotFoundException;
import khope.migration.identity.IdentityGuard;
import khope.migration.identity.VerifiedIdentity;
import khope.migration.migration.dto.RollbackResult;
import khope.migration.repository.MigrationRecordRepository;
import khope.migration.repository.ProfileRepository;
import khope.migration.repository.ProjectFileRepository;
import khope.migration.repository.ProjectRepository;
import khope.migration.repository.SettingsRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 마이그레이션 롤백 (관리자 전용)
 *
 * 해당 migrationId로 기록된 레코드만 삭제한다. 이후 직접 만든 데이터는 건드리지 않는다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RollbackService {

    private final MigrationRecordRepository migrationRecordRepository;
    private final SettingsRepository settingsRepository;
    private final ProfileRepository profileRepository;
    private final ProjectRepository projectRepository;
    private final ProjectFileRepository projectFileRepository;
    private final DualReadCache dualReadCache;

    @Transactional
    public RollbackResult rollback(VerifiedIdentity caller, String userId, String migrationId) {
        IdentityGuard.requireAdmin(caller);

        MigrationRecord record = migrationRecordRepository.findByUserIdAndMigrationId(userId, migrationId)
                .filter(r -> r.getStatus() != MigrationStatus.ROLLED_BACK)
                .orElseThrow(() -> new ResourceNotFoundException(
                        "Migration not found: " + migrationId + " for user " + userId));

        Map<String, Integer> rolledBack = new LinkedHashMap<>();

        int settings = settingsRepository.findByUserIdAndMigrationId(userId, migrationId)
                .map(s -> {
                    settingsRepository.delete(s);
                    return 1;
                })
                .orElse(0);
        rolledBack.put(ResourceKind.SETTINGS.getKey(), settings);

        int profile = profileRepository.findByUserIdAndMigrationId(userId, migrationId)
                .map(p -> {
                    profileRepository.delete(p);
                    return 1;
                })
                .orElse(0);
        rolledBack.put(ResourceKind.PROFILE.getKey(), profile);

        // 파일 레코드를 먼저 지워 고아 레코드가 남지 않게 한다
        int files = 0;
        List<Project> projects = projectRepository.findByUserIdAndMigrationId(userId, migrationId);
        for (Project project : projects) {
            files += (int) projectFileRepository.deleteByProjectId(project.getId());
        }
        projectRepository.deleteAll(projects);
        rolledBack.put(ResourceKind.PROJECT.getKey(), projects.size());

        record.markRolledBack();
        dualReadCache.evict(userId);

        log.info("마이그레이션 롤백 - admin: {}, userId: {}, migrationId: {}, 삭제: {}, 파일: {}건",
                caller.subject(), userId, migrationId, rolledBack, files);

        return new RollbackResult(userId, migrationId, rolledBack, files);
    }
}
