package khope.migration.migration;

import khope.migration.domain.MigrationRecord;
import khope.migration.domain.MigrationStatus;
import khope.migration.exception.DuplicateMigrationException;
import khope.migration.repository.MigrationRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 유저별 마이그레이션 레코드 선점/완료 처리
 *
 * 선점은 섹션 쓰기보다 먼저, 독립 트랜잭션으로 커밋된다.
 * 동시 선점은 userId unique 제약 또는 @Version 충돌로 하나만 성공한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MigrationStatusTracker {

    private final MigrationRecordRepository migrationRecordRepository;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public MigrationRecord claim(String userId, String migrationId, String checksum) {
        Optional<MigrationRecord> existing = migrationRecordRepository.findByUserId(userId);

        if (existing.isPresent()) {
            MigrationRecord record = existing.get();
            if (record.getStatus().blocksMigration()) {
                log.info("중복 마이그레이션 차단 - userId: {}, status: {}", userId, record.getStatus());
                throw new DuplicateMigrationException(userId);
            }
            log.info("마이그레이션 재선점 - userId: {}, 이전 상태: {}", userId, record.getStatus());
            record.restart(migrationId, checksum);
            return migrationRecordRepository.saveAndFlush(record);
        }

        return migrationRecordRepository.saveAndFlush(MigrationRecord.builder()
                .userId(userId)
                .migrationId(migrationId)
                .status(MigrationStatus.PENDING)
                .checksum(checksum)
                .startedAt(Instant.now())
                .build());
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public MigrationRecord complete(String userId, int migrated, List<String> errors) {
        MigrationRecord record = migrationRecordRepository.findByUserId(userId)
                .orElseThrow(() -> new IllegalStateException("선점되지 않은 마이그레이션: " + userId));
        record.complete(migrated, errors);
        return migrationRecordRepository.saveAndFlush(record);
    }

    /**
     * 섹션 처리 밖에서 예상치 못한 예외가 난 경우 PENDING으로 남지 않도록 실패 처리
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void fail(String userId, String reason) {
        migrationRecordRepository.findByUserId(userId).ifPresent(record -> {
            record.complete(0, List.of(reason));
            migrationRecordRepository.saveAndFlush(record);
        });
    }

    @Transactional(readOnly = true)
    public Optional<MigrationRecord> find(String userId) {
        return migrationRecordRepository.findByUserId(userId);
    }

    @Transactional(readOnly = true)
    public boolean hasRecord(String userId) {
        return migrationRecordRepository.existsByUserId(userId);
    }
}
