package khope.migration.legacy;

import khope.migration.migration.dto.LegacyDataBundle;
import khope.migration.migration.dto.LegacyProfile;
import khope.migration.migration.dto.LegacyProject;
import khope.migration.migration.dto.LegacySettings;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * 레거시 저장소 (외부 협력자)
 *
 * 내부 구조는 다루지 않고 유저 단위 키 조회/저장만 사용한다.
 * 조회 실패는 LegacyStoreException, 데이터 없음은 빈 결과로 구분한다.
 */
public interface LegacyDataStore {

    Optional<LegacyProfile> findProfile(String userId);

    Optional<LegacySettings> findSettings(String userId);

    List<LegacyProject> findProjects(String userId);

    void saveProfile(String userId, LegacyProfile profile);

    void saveSettings(String userId, LegacySettings settings);

    void saveProjects(String userId, List<LegacyProject> projects);

    void delete(String userId);

    /**
     * 레거시 데이터가 있는 유저 ID를 filter를 통과한 것만 최대 limit개 조회
     */
    List<String> scanUserIds(int limit, Predicate<String> filter);

    /**
     * 유저의 레거시 데이터 전체를 번들로 조회 (하나도 없으면 empty)
     */
    default Optional<LegacyDataBundle> loadBundle(String userId) {
        LegacyDataBundle bundle = LegacyDataBundle.builder()
                .settings(findSettings(userId).orElse(null))
                .profile(findProfile(userId).orElse(null))
                .projects(findProjects(userId))
                .build();
        if (bundle.getProjects().isEmpty()) {
            bundle.setProjects(null);
        }
        return bundle.isEmpty() ? Optional.empty() : Optional.of(bundle);
    }
}
