package khope.migration.legacy;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import khope.migration.exception.LegacyStoreException;
import khope.migration.migration.dto.LegacyProfile;
import khope.migration.migration.dto.LegacyProject;
import khope.migration.migration.dto.LegacySettings;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Redis 기반 레거시 저장소
 *
 * 키 구조 (값은 JSON 문서):
 * - legacy:user:{userId}:profile
 * - legacy:user:{userId}:settings
 * - legacy:user:{userId}:projects  (프로젝트 배열)
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RedisLegacyDataStore implements LegacyDataStore {

    private static final String KEY_PREFIX = "legacy:user:";
    private static final String PROFILE_SUFFIX = ":profile";
    private static final String SETTINGS_SUFFIX = ":settings";
    private static final String PROJECTS_SUFFIX = ":projects";

    private static final TypeReference<List<LegacyProject>> PROJECT_LIST = new TypeReference<>() {
    };

    private final StringRedisTemplate stringRedisTemplate;
    private final ObjectMapper objectMapper;

    @Value("${migration.legacy.scan-count:100}")
    private int scanCount;

    @Override
    public Optional<LegacyProfile> findProfile(String userId) {
        return read(KEY_PREFIX + userId + PROFILE_SUFFIX)
                .map(json -> parse(json, LegacyProfile.class, userId));
    }

    @Override
    public Optional<LegacySettings> findSettings(String userId) {
        return read(KEY_PREFIX + userId + SETTINGS_SUFFIX)
                .map(json -> parse(json, LegacySettings.class, userId));
    }

    @Override
    public List<LegacyProject> findProjects(String userId) {
        return read(KEY_PREFIX + userId + PROJECTS_SUFFIX)
                .map(json -> {
                    try {
                        return objectMapper.readValue(json, PROJECT_LIST);
                    } catch (JsonProcessingException e) {
                        throw new LegacyStoreException("손상된 레거시 프로젝트 문서 - userId: " + userId, e);
                    }
                })
                .orElseGet(List::of);
    }

    @Override
    public void saveProfile(String userId, LegacyProfile profile) {
        write(KEY_PREFIX + userId + PROFILE_SUFFIX, profile);
    }

    @Override
    public void saveSettings(String userId, LegacySettings settings) {
        write(KEY_PREFIX + userId + SETTINGS_SUFFIX, settings);
    }

    @Override
    public void saveProjects(String userId, List<LegacyProject> projects) {
        write(KEY_PREFIX + userId + PROJECTS_SUFFIX, projects);
    }

    @Override
    public void delete(String userId) {
        stringRedisTemplate.delete(List.of(
                KEY_PREFIX + userId + PROFILE_SUFFIX,
                KEY_PREFIX + userId + SETTINGS_SUFFIX,
                KEY_PREFIX + userId + PROJECTS_SUFFIX));
        log.debug("레거시 데이터 삭제 - userId: {}", userId);
    }

    /**
     * SCAN으로 레거시 키를 순회하며 유저 ID 추출
     */
    @Override
    public List<String> scanUserIds(int limit, Predicate<String> filter) {
        ScanOptions options = ScanOptions.scanOptions()
                .match(KEY_PREFIX + "*")
                .count(scanCount)
                .build();

        Set<String> seen = new LinkedHashSet<>();
        List<String> userIds = new ArrayList<>();

        try (Cursor<String> cursor = stringRedisTemplate.scan(options)) {
            while (cursor.hasNext() && userIds.size() < limit) {
                String userId = extractUserId(cursor.next());
                if (userId != null && seen.add(userId) && filter.test(userId)) {
                    userIds.add(userId);
                }
            }
        } catch (DataAccessException e) {
            throw new LegacyStoreException("레거시 저장소 SCAN 실패", e);
        }

        return userIds;
    }

    private Optional<String> read(String key) {
        try {
            String json = stringRedisTemplate.opsForValue().get(key);
            if (json == null) {
                log.debug("레거시 MISS - key: {}", key);
                return Optional.empty();
            }
            log.debug("레거시 HIT - key: {}", key);
            return Optional.of(json);
        } catch (DataAccessException e) {
            log.warn("레거시 저장소 조회 실패 - key: {}, 원인: {}", key, e.getMessage());
            throw new LegacyStoreException("레거시 저장소 연결 실패 - key: " + key, e);
        }
    }

    private void write(String key, Object value) {
        try {
            stringRedisTemplate.opsForValue().set(key, objectMapper.writeValueAsString(value));
            log.debug("레거시 저장 - key: {}", key);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("레거시 문서 직렬화 실패 - key: " + key, e);
        }
    }

    private <T> T parse(String json, Class<T> type, String userId) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            log.error("JSON 파싱 실패 - userId: {}, type: {}", userId, type.getSimpleName(), e);
            throw new LegacyStoreException("손상된 레거시 문서 - userId: " + userId, e);
        }
    }

    private static String extractUserId(String key) {
        if (!key.startsWith(KEY_PREFIX)) {
            return null;
        }
        int end = key.lastIndexOf(':');
        return end > KEY_PREFIX.length() ? key.substring(KEY_PREFIX.length(), end) : null;
    }
}
