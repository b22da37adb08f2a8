package khope.migration.migration;

import khope.migration.checksum.ChecksumEngine;
import khope.migration.config.MigrationConfig;
import khope.migration.identity.VerifiedIdentity;
import khope.migration.legacy.LegacyDataStore;
import khope.migration.migration.dto.LegacyDataBundle;
import khope.migration.migration.dto.MigrationResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * 레거시 저장소에서 번들을 읽어 소유자 대신 마이그레이션을 실행한다.
 * 듀얼 리드 폴백과 백그라운드 워커가 사용하며, 실패는 로그만 남기고 호출자에게 전파하지 않는다.
 */
@Slf4j
@Component
public class LegacyMigrationTrigger {

    private final LegacyDataStore legacyDataStore;
    private final ChecksumEngine checksumEngine;
    private final MigrationService migrationService;
    private final MigrationStatusTracker statusTracker;
    private final TaskExecutor migrationExecutor;

    @Value("${migration.dual-read.async:false}")
    private boolean async;

    public LegacyMigrationTrigger(
            LegacyDataStore legacyDataStore,
            ChecksumEngine checksumEngine,
            MigrationService migrationService,
            MigrationStatusTracker statusTracker,
            @Qualifier(MigrationConfig.MIGRATION_EXECUTOR) TaskExecutor migrationExecutor) {
        this.legacyDataStore = legacyDataStore;
        this.checksumEngine = checksumEngine;
        this.migrationService = migrationService;
        this.statusTracker = statusTracker;
        this.migrationExecutor = migrationExecutor;
    }

    /**
     * 설정에 따라 동기 또는 migrationExecutor에서 비동기로 실행
     *
     * @return 마이그레이션을 시작했으면 true (비동기는 제출 성공 여부)
     */
    public boolean trigger(VerifiedIdentity owner) {
        if (statusTracker.hasRecord(owner.subject())) {
            return false;
        }

        if (async) {
            migrationExecutor.execute(() -> migrateFromLegacy(owner));
            log.debug("레거시 마이그레이션 비동기 제출 - userId: {}", owner.subject());
            return true;
        }
        return migrateFromLegacy(owner).isPresent();
    }

    /**
     * 이미 레코드가 있거나 레거시 데이터가 없으면 건너뛴다.
     */
    public Optional<MigrationResult> migrateFromLegacy(VerifiedIdentity owner) {
        String userId = owner.subject();
        try {
            if (statusTracker.hasRecord(userId)) {
                log.debug("마이그레이션 레코드 존재, 스킵 - userId: {}", userId);
                return Optional.empty();
            }

            Optional<LegacyDataBundle> bundle = legacyDataStore.loadBundle(userId);
            if (bundle.isEmpty()) {
                log.debug("레거시 데이터 없음, 스킵 - userId: {}", userId);
                return Optional.empty();
            }

            String checksum = checksumEngine.checksum(bundle.get());
            MigrationResult result = migrationService.migrate(owner, userId, bundle.get(), checksum);

            if (!result.success()) {
                log.warn("레거시 마이그레이션 부분 실패 - userId: {}, errors: {}", userId, result.errors());
            }
            return Optional.of(result);

        } catch (RuntimeException e) {
            log.warn("레거시 마이그레이션 트리거 실패 - userId: {}, 원인: {}", userId, e.getMessage());
            return Optional.empty();
        }
    }
}
