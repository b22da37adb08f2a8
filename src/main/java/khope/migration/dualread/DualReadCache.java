package khope.migration.dualread;

import khope.migration.config.CacheConfig;
import khope.migration.domain.ResourceKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * 신규 저장소 조회 결과 캐시
 * 쓰기/마이그레이션/롤백 후에는 반드시 evict 해야 한다.
 *
 * 엔티티는 변경 가능하므로 넣을 때와 꺼낼 때 모두 사본을 만든다.
 */
@Slf4j
@Component
public class DualReadCache {

    private final CacheManager localCacheManager;

    public DualReadCache(@Qualifier(CacheConfig.LOCAL_CACHE_MANAGER) CacheManager localCacheManager) {
        this.localCacheManager = localCacheManager;
    }

    @SuppressWarnings("unchecked")
    public <T> Optional<T> get(ResourceKind kind, String userId, UnaryOperator<T> copier) {
        Cache.ValueWrapper wrapper = cache().get(key(kind, userId));
        if (wrapper == null) {
            return Optional.empty();
        }
        log.debug("듀얼 리드 캐시 HIT - kind: {}, userId: {}", kind, userId);
        return Optional.ofNullable((T) wrapper.get()).map(copier);
    }

    public <T> void put(ResourceKind kind, String userId, T value, UnaryOperator<T> copier) {
        cache().put(key(kind, userId), copier.apply(value));
    }

    /**
     * 유저의 모든 리소스 캐시 삭제
     */
    public void evict(String userId) {
        Cache cache = cache();
        for (ResourceKind kind : ResourceKind.values()) {
            cache.evict(key(kind, userId));
        }
        log.debug("듀얼 리드 캐시 삭제 - userId: {}", userId);
    }

    public void clear() {
        cache().clear();
    }

    private Cache cache() {
        Cache cache = localCacheManager.getCache(CacheConfig.DUAL_READ_CACHE);
        if (cache == null) {
            throw new IllegalStateException("캐시가 설정되지 않았습니다: " + CacheConfig.DUAL_READ_CACHE);
        }
        return cache;
    }

    private static String key(ResourceKind kind, String userId) {
        return kind.getKey() + ":" + userId;
    }
}
