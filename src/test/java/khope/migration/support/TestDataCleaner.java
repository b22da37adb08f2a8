package khope.migration.support;

import khope.migration.dualread.DualReadCache;
import khope.migration.legacy.InMemoryLegacyDataStore;
import khope.migration.repository.MigrationRecordRepository;
import khope.migration.repository.ProfileRepository;
import khope.migration.repository.ProjectFileRepository;
import khope.migration.repository.ProjectRepository;
import khope.migration.repository.SettingsRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * 테스트 간 저장소/캐시 초기화
 */
@Component
@Profile("test")
@RequiredArgsConstructor
public class TestDataCleaner {

    private final ProjectFileRepository projectFileRepository;
    private final ProjectRepository projectRepository;
    private final ProfileRepository profileRepository;
    private final SettingsRepository settingsRepository;
    private final MigrationRecordRepository migrationRecordRepository;
    private final InMemoryLegacyDataStore legacyDataStore;
    private final DualReadCache dualReadCache;

    public void clean() {
        projectFileRepository.deleteAll();
        projectRepository.deleteAll();
        profileRepository.deleteAll();
        settingsRepository.deleteAll();
        migrationRecordRepository.deleteAll();
        legacyDataStore.clear();
        dualReadCache.clear();
    }
}
