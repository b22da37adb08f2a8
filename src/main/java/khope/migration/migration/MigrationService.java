package khope.migration.migration;

import khope.migration.checksum.ChecksumEngine;
import khope.migration.domain.MigrationRecord;
import khope.migration.domain.MigrationStatus;
import khope.migration.domain.Profile;
import khope.migration.domain.ResourceKind;
import khope.migration.dualread.DualReadCache;
import khope.migration.exception.AuthorizationException;
import khope.migration.exception.DataIntegrityException;
import khope.migration.exception.DuplicateMigrationException;
import khope.migration.exception.ValidationException;
import khope.migration.identity.IdentityGuard;
import khope.migration.identity.VerifiedIdentity;
import khope.migration.migration.dto.LegacyDataBundle;
import khope.migration.migration.dto.LegacyProject;
import khope.migration.migration.dto.MigrationResult;
import khope.migration.migration.dto.MigrationStatusView;
import khope.migration.repository.MigrationRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * 유저 데이터 마이그레이션 오케스트레이터
 *
 * 처리 순서:
 * 1. 호출자 == 데이터 소유자 확인
 * 2. 번들 체크섬 재계산 후 비교 (불일치 시 쓰기 없이 중단)
 * 3. 마이그레이션 레코드 선점 (PENDING/COMPLETED면 중복)
 * 4. settings → profile → projects 순서로 섹션별 독립 기록, 실패는 errors에 누적
 * 5. 레코드 완료 처리, 듀얼 리드 캐시 무효화
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MigrationService {

    private final ChecksumEngine checksumEngine;
    private final ResourceTransformer transformer;
    private final TargetRecordWriter writer;
    private final MigrationStatusTracker statusTracker;
    private final MigrationLockManager lockManager;
    private final MigrationRecordRepository migrationRecordRepository;
    private final DualReadCache dualReadCache;

    /**
     * 호출자 본인의 데이터 마이그레이션
     */
    public MigrationResult migrateUserData(VerifiedIdentity caller, LegacyDataBundle bundle, String checksum) {
        IdentityGuard.requireIdentity(caller);
        return migrate(caller, caller.subject(), bundle, checksum);
    }

    public MigrationResult migrate(VerifiedIdentity caller, String userId,
                                   LegacyDataBundle bundle, String checksum) {
        IdentityGuard.requireOwner(caller, userId);
        if (bundle == null) {
            throw new ValidationException("Migration bundle is required");
        }
        if (bundle.isEmpty()) {
            // 빈 번들로 레코드를 선점하면 이후의 실제 마이그레이션이 막힌다
            throw new ValidationException("Migration bundle has no data");
        }

        String actual = checksumEngine.checksum(bundle);
        if (!actual.equals(checksum)) {
            log.warn("번들 체크섬 불일치 - userId: {}, expected: {}, actual: {}", userId, checksum, actual);
            throw new DataIntegrityException(checksum, actual);
        }

        String migrationId = newMigrationId();
        return lockManager.executeWithLock(userId,
                () -> execute(caller, userId, bundle, actual, migrationId));
    }

    private MigrationResult execute(VerifiedIdentity caller, String userId, LegacyDataBundle bundle,
                                    String checksum, String migrationId) {
        claim(userId, migrationId, checksum);
        log.info("마이그레이션 시작 - userId: {}, migrationId: {}", userId, migrationId);

        Map<ResourceKind, Integer> counts = new EnumMap<>(ResourceKind.class);
        List<String> errors = new ArrayList<>();

        try {
            if (bundle.getSettings() != null) {
                migrateSection(ResourceKind.SETTINGS, counts, errors, () ->
                        writer.insertSettings(transformer.transformSettings(userId, bundle.getSettings()), migrationId));
            }

            if (bundle.getProfile() != null) {
                migrateSection(ResourceKind.PROFILE, counts, errors, () ->
                        writer.insertProfile(withIdentityDefaults(
                                transformer.transformProfile(userId, bundle.getProfile()), caller), migrationId));
            }

            if (bundle.getProjects() != null) {
                for (LegacyProject project : bundle.getProjects()) {
                    migrateSection(ResourceKind.PROJECT, counts, errors, () ->
                            writer.insertProject(transformer.transformProject(userId, project), migrationId));
                }
            }

            int migrated = counts.values().stream().mapToInt(Integer::intValue).sum();
            MigrationRecord record = statusTracker.complete(userId, migrated, errors);

            log.info("마이그레이션 완료 - userId: {}, migrationId: {}, 성공: {}건, 실패: {}건, 상태: {}",
                    userId, migrationId, migrated, errors.size(), record.getStatus());

            return new MigrationResult(migrationId, migrated, byKey(counts), List.copyOf(errors));

        } catch (RuntimeException e) {
            log.error("마이그레이션 중단 - userId: {}, migrationId: {}", userId, migrationId, e);
            statusTracker.fail(userId, "Migration aborted: " + e.getMessage());
            throw e;
        } finally {
            dualReadCache.evict(userId);
        }
    }

    private void claim(String userId, String migrationId, String checksum) {
        try {
            statusTracker.claim(userId, migrationId, checksum);
        } catch (DataIntegrityViolationException | OptimisticLockingFailureException e) {
            // 동시 요청이 먼저 선점함
            log.info("마이그레이션 선점 경합 - userId: {}", userId);
            throw new DuplicateMigrationException(userId);
        }
    }

    private void migrateSection(ResourceKind kind, Map<ResourceKind, Integer> counts,
                                List<String> errors, Runnable section) {
        try {
            section.run();
            counts.merge(kind, 1, Integer::sum);
        } catch (RuntimeException e) {
            log.warn("{} 마이그레이션 실패 - {}", kind.getLabel(), describe(e));
            errors.add(kind.failure(describe(e)));
        }
    }

    /**
     * 마이그레이션된 프로필에 비어 있는 신원 필드는 검증된 호출자 정보로 채운다.
     */
    private static Profile withIdentityDefaults(Profile profile, VerifiedIdentity caller) {
        if (!StringUtils.hasText(profile.getEmail()) && caller.email() != null) {
            profile.setEmail(caller.email());
        }
        if (!StringUtils.hasText(profile.getName()) && caller.name() != null) {
            profile.setName(caller.name());
        }
        if (profile.getProfileImage() == null) {
            profile.setProfileImage(caller.pictureUrl());
        }
        return profile;
    }

    private static String describe(RuntimeException e) {
        if (e instanceof DataAccessException dataAccess && dataAccess.getMostSpecificCause() != e) {
            return dataAccess.getMostSpecificCause().getMessage();
        }
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private static Map<String, Integer> byKey(Map<ResourceKind, Integer> counts) {
        Map<String, Integer> result = new LinkedHashMap<>();
        for (ResourceKind kind : ResourceKind.values()) {
            result.put(kind.getKey(), counts.getOrDefault(kind, 0));
        }
        return Collections.unmodifiableMap(result);
    }

    private static String newMigrationId() {
        return "mig_" + UUID.randomUUID().toString().replace("-", "");
    }

    /**
     * 마이그레이션 상태 조회 (소유자 또는 관리자)
     */
    public Optional<MigrationStatusView> checkMigrationStatus(VerifiedIdentity caller, String userId) {
        IdentityGuard.requireIdentity(caller);
        if (!caller.owns(userId) && !caller.admin()) {
            throw new AuthorizationException("Unauthorized: caller does not own user data " + userId);
        }
        return findStatus(userId);
    }

    public Optional<MigrationStatusView> findStatus(String userId) {
        return statusTracker.find(userId).map(MigrationStatusView::from);
    }

    /**
     * 상태별 레코드 목록 (관리자 전용, 실패 건 재처리 확인용)
     */
    public List<MigrationStatusView> findByStatus(VerifiedIdentity caller, MigrationStatus status) {
        IdentityGuard.requireIdentity(caller);
        if (!caller.admin()) {
            throw new AuthorizationException("Unauthorized: admin capability required");
        }
        return migrationRecordRepository.findByStatus(status).stream()
                .map(MigrationStatusView::from)
                .toList();
    }
}
