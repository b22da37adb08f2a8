package khope.migration.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.cache.CacheManager;
import org.springframework.cache.caffeine.CaffeineCache;
import org.springframework.cache.support.SimpleCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.concurrent.TimeUnit;

@Configuration
public class CacheConfig {

    public static final String LOCAL_CACHE_MANAGER = "localCacheManager";

    // 캐시 이름 상수
    public static final String DUAL_READ_CACHE = "dualReadCache";

    @Value("${cache.dual-read.expire-seconds:300}")
    private long dualReadExpireSeconds;

    @Value("${cache.dual-read.maximum-size:10000}")
    private long dualReadMaximumSize;

    /**
     * 듀얼 리드 캐시 - Caffeine (로컬 캐시)
     * 신규 저장소에서 읽은 권위 있는 레코드만 담는다. 레거시 데이터는 캐시하지 않음.
     */
    @Bean(LOCAL_CACHE_MANAGER)
    public CacheManager localCacheManager() {
        SimpleCacheManager cacheManager = new SimpleCacheManager();

        CaffeineCache dualReadCache = new CaffeineCache(DUAL_READ_CACHE,
                Caffeine.newBuilder()
                        .expireAfterWrite(dualReadExpireSeconds, TimeUnit.SECONDS)
                        .maximumSize(dualReadMaximumSize)
                        .recordStats()
                        .build());

        cacheManager.setCaches(List.of(dualReadCache));
        return cacheManager;
    }
}
