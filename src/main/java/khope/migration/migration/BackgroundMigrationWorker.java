package khope.migration.migration;

import khope.migration.identity.VerifiedIdentity;
import khope.migration.legacy.LegacyDataStore;
import khope.migration.migration.dto.MigrationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 백그라운드 마이그레이션 워커
 *
 * 유저가 접속하기 전에 레거시 데이터를 선제적으로 옮긴다.
 * 듀얼 리드의 자동 마이그레이션과 함께 사용하여 마이그레이션 기간을 단축한다.
 *
 * 활성화: migration.background.enabled=true
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "migration.background.enabled", havingValue = "true")
public class BackgroundMigrationWorker {

    private final LegacyDataStore legacyDataStore;
    private final MigrationStatusTracker statusTracker;
    private final LegacyMigrationTrigger migrationTrigger;

    @Value("${migration.background.batch-size:50}")
    private int batchSize;

    private final AtomicBoolean isRunning = new AtomicBoolean(false);
    private final AtomicLong totalMigrated = new AtomicLong(0);
    private final AtomicLong totalScanned = new AtomicLong(0);
    private final AtomicLong totalErrors = new AtomicLong(0);

    // 이번 스캔에서 이미 시도한 유저 (빈 번들/조회 실패로 레코드가 안 남는 유저가 배치를 막지 않도록)
    private final Set<String> attempted = ConcurrentHashMap.newKeySet();

    private volatile boolean scanCompleted = false;

    @Scheduled(initialDelayString = "${migration.background.initial-delay-ms:10000}",
            fixedDelayString = "${migration.background.interval-ms:60000}")
    public void migrateInBackground() {
        if (scanCompleted) {
            log.debug("마이그레이션 완료 상태, 스킵");
            return;
        }

        if (!isRunning.compareAndSet(false, true)) {
            log.debug("이전 마이그레이션 작업 진행 중, 스킵");
            return;
        }

        try {
            int migrated = runBatch();
            if (migrated > 0) {
                log.info("백그라운드 마이그레이션 진행 - 이번 배치: {}건, 누적: {}건, 스캔: {}건",
                        migrated, totalMigrated.get(), totalScanned.get());
            }
        } catch (Exception e) {
            log.error("백그라운드 마이그레이션 중 오류 발생", e);
            totalErrors.incrementAndGet();
        } finally {
            isRunning.set(false);
        }
    }

    /**
     * 마이그레이션 레코드가 없고 이번 스캔에서 시도하지 않은 유저를 최대 batchSize명 골라 소유자 대신 실행
     */
    int runBatch() {
        List<String> pending = legacyDataStore.scanUserIds(batchSize,
                userId -> !attempted.contains(userId) && !statusTracker.hasRecord(userId));

        if (pending.isEmpty()) {
            scanCompleted = true;
            log.info("백그라운드 마이그레이션 완료! 총 마이그레이션: {}건, 총 스캔: {}건",
                    totalMigrated.get(), totalScanned.get());
            return 0;
        }

        int migrated = 0;
        for (String userId : pending) {
            attempted.add(userId);
            totalScanned.incrementAndGet();
            Optional<MigrationResult> result = migrationTrigger.migrateFromLegacy(VerifiedIdentity.ofSubject(userId));
            if (result.isPresent()) {
                migrated++;
                totalMigrated.incrementAndGet();
                if (!result.get().success()) {
                    totalErrors.incrementAndGet();
                }
            } else {
                totalErrors.incrementAndGet();
            }
        }
        return migrated;
    }

    public MigrationProgress getProgress() {
        return new MigrationProgress(
                totalMigrated.get(),
                totalScanned.get(),
                totalErrors.get(),
                scanCompleted,
                isRunning.get()
        );
    }

    /**
     * 상태 초기화 (새 레거시 데이터 유입 후 재스캔용)
     */
    public void reset() {
        scanCompleted = false;
        attempted.clear();
        totalMigrated.set(0);
        totalScanned.set(0);
        totalErrors.set(0);
        log.info("백그라운드 마이그레이션 상태 초기화");
    }

    public boolean isCompleted() {
        return scanCompleted;
    }

    public record MigrationProgress(
            long migrated,
            long scanned,
            long errors,
            boolean completed,
            boolean running
    ) {
        public double progressRate() {
            return scanned > 0 ? (double) migrated / scanned * 100 : 0;
        }
    }
}
