package khope.migration.migration;

import khope.migration.legacy.InMemoryLegacyDataStore;
import khope.migration.repository.MigrationRecordRepository;
import khope.migration.repository.SettingsRepository;
import khope.migration.support.TestDataCleaner;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;

import static khope.migration.support.TestFixtures.settings;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * 배치 크기 1에서 레코드가 남지 않는 유저가 스캔을 막지 않는지 확인
 */
@SpringBootTest(properties = {
        "migration.background.enabled=true",
        "migration.background.initial-delay-ms=3600000",
        "migration.background.batch-size=1"
})
@DisplayName("BackgroundMigrationWorker - 배치 진행")
class BackgroundMigrationWorkerBatchTest {

    @Autowired
    private BackgroundMigrationWorker worker;

    @Autowired
    private InMemoryLegacyDataStore legacyDataStore;

    @Autowired
    private SettingsRepository settingsRepository;

    @Autowired
    private MigrationRecordRepository migrationRecordRepository;

    @Autowired
    private TestDataCleaner cleaner;

    @AfterEach
    void tearDown() {
        cleaner.clean();
        worker.reset();
    }

    @Test
    @DisplayName("빈 번들 유저는 한 번만 시도하고 다음 유저로 넘어간다")
    void emptyBundleUserDoesNotBlockScan() {
        // Given: 정렬상 앞에 오는 유저는 빈 프로젝트 목록만 가지고 있음
        legacyDataStore.saveProjects("a-empty", List.of());
        legacyDataStore.saveSettings("b-real", settings());

        // When
        int first = worker.runBatch();
        int second = worker.runBatch();
        int third = worker.runBatch();

        // Then
        assertThat(first).isZero();
        assertThat(second).isEqualTo(1);
        assertThat(third).isZero();
        assertThat(settingsRepository.findByUserId("b-real")).isPresent();
        assertThat(migrationRecordRepository.existsByUserId("a-empty")).isFalse();
        assertThat(worker.isCompleted()).isTrue();
        assertThat(worker.getProgress().migrated()).isEqualTo(1);
        assertThat(worker.getProgress().errors()).isEqualTo(1);
    }

    @Test
    @DisplayName("reset 후에는 이전에 시도한 유저도 다시 스캔한다")
    void resetClearsAttemptedUsers() {
        legacyDataStore.saveProjects("a-empty", List.of());
        worker.runBatch();
        worker.runBatch();
        assertThat(worker.isCompleted()).isTrue();

        worker.reset();
        legacyDataStore.saveSettings("a-empty", settings());
        int migrated = worker.runBatch();

        assertThat(migrated).isEqualTo(1);
        assertThat(settingsRepository.findByUserId("a-empty")).isPresent();
    }
}
