package khope.migration.dualread;

import khope.migration.domain.MigrationStatus;
import khope.migration.domain.Profile;
import khope.migration.domain.Project;
import khope.migration.domain.ResourceKind;
import khope.migration.domain.Settings;
import khope.migration.identity.VerifiedIdentity;
import khope.migration.legacy.LegacyDataStore;
import khope.migration.migration.LegacyMigrationTrigger;
import khope.migration.migration.MigrationStatusTracker;
import khope.migration.migration.dto.LegacyProfile;
import khope.migration.migration.dto.LegacyProject;
import khope.migration.migration.dto.LegacySettings;
import khope.migration.repository.ProfileRepository;
import khope.migration.repository.ProjectRepository;
import khope.migration.repository.SettingsRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * 듀얼 리드 조회
 *
 * 조회 순서: 로컬 캐시 → 신규 저장소 → 레거시 저장소
 *
 * 신규 저장소에 있으면 항상 그것이 권위 있는 값이다.
 * 마이그레이션이 COMPLETED인 유저는 신규 저장소가 비어 있어도 레거시로 내려가지 않는다.
 * 레거시에서만 찾은 경우 소유자 본인의 요청이면 마이그레이션을 트리거한다.
 * 조회 실패는 "없음"으로 바꾸지 않고 그대로 전파한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DualReadResolver {

    private final DualReadCache cache;
    private final ProfileRepository profileRepository;
    private final SettingsRepository settingsRepository;
    private final ProjectRepository projectRepository;
    private final LegacyDataStore legacyDataStore;
    private final LegacyMigrationTrigger migrationTrigger;
    private final MigrationStatusTracker statusTracker;

    @Value("${migration.dual-read.auto-migrate:true}")
    private boolean autoMigrate;

    public DualReadResult<Profile, LegacyProfile> resolveProfile(VerifiedIdentity caller, String userId) {
        return resolve(ResourceKind.PROFILE, caller, userId,
                () -> profileRepository.findByUserId(userId),
                () -> legacyDataStore.findProfile(userId),
                Profile::copy,
                null);
    }

    public DualReadResult<Settings, LegacySettings> resolveSettings(VerifiedIdentity caller, String userId) {
        return resolve(ResourceKind.SETTINGS, caller, userId,
                () -> settingsRepository.findByUserId(userId),
                () -> legacyDataStore.findSettings(userId),
                Settings::copy,
                null);
    }

    public DualReadResult<List<Project>, List<LegacyProject>> resolveProjects(VerifiedIdentity caller, String userId) {
        return resolve(ResourceKind.PROJECT, caller, userId,
                () -> nonEmpty(projectRepository.findByUserIdOrderByCreatedDesc(userId)),
                () -> nonEmpty(legacyDataStore.findProjects(userId)),
                DualReadResolver::copyAll,
                List.of());
    }

    /**
     * @param settledEmpty 마이그레이션 완료 유저의 신규 저장소가 비었을 때 돌려줄 값 (null이면 NONE)
     */
    private <T, L> DualReadResult<T, L> resolve(ResourceKind kind, VerifiedIdentity caller, String userId,
                                                Supplier<Optional<T>> target,
                                                Supplier<Optional<L>> legacy,
                                                UnaryOperator<T> copier,
                                                T settledEmpty) {
        Optional<T> cached = cache.get(kind, userId, copier);
        if (cached.isPresent()) {
            return DualReadResult.cached(cached.get());
        }

        Optional<T> authoritative = target.get();
        if (authoritative.isPresent()) {
            cache.put(kind, userId, authoritative.get(), copier);
            log.debug("신규 저장소 HIT - kind: {}, userId: {}", kind, userId);
            return DualReadResult.authoritative(authoritative.get());
        }

        if (migrationCompleted(userId)) {
            // 마이그레이션 이후 삭제된 데이터를 레거시에서 되살리지 않는다
            log.debug("마이그레이션 완료 유저, 레거시 폴백 생략 - kind: {}, userId: {}", kind, userId);
            if (settledEmpty == null) {
                return DualReadResult.notFound();
            }
            cache.put(kind, userId, settledEmpty, copier);
            return DualReadResult.authoritative(settledEmpty);
        }

        Optional<L> fallback = legacy.get();
        if (fallback.isPresent()) {
            log.info("레거시 폴백 - kind: {}, userId: {}", kind, userId);
            return DualReadResult.fallback(fallback.get(), triggerMigration(caller, userId));
        }

        return DualReadResult.notFound();
    }

    private boolean migrationCompleted(String userId) {
        return statusTracker.find(userId)
                .map(record -> record.getStatus() == MigrationStatus.COMPLETED)
                .orElse(false);
    }

    private boolean triggerMigration(VerifiedIdentity caller, String userId) {
        if (!autoMigrate || caller == null || !caller.owns(userId)) {
            return false;
        }
        return migrationTrigger.trigger(caller);
    }

    private static List<Project> copyAll(List<Project> projects) {
        return projects.stream().map(Project::copy).toList();
    }

    private static <E> Optional<List<E>> nonEmpty(List<E> list) {
        return list.isEmpty() ? Optional.empty() : Optional.of(list);
    }
}
