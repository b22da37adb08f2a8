package khope.migration.config;

import lombok.extern.slf4j.Slf4j;
import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.config.Config;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * StringRedisTemplate은 Spring Boot에서 자동 생성됨 (RedisAutoConfiguration)
 * 레거시 저장소 접근에는 그것만 사용한다.
 */
@Slf4j
@Configuration
public class RedisConfig {

    @Value("${spring.data.redis.host:localhost}")
    private String redisHost;

    @Value("${spring.data.redis.port:6379}")
    private int redisPort;

    /**
     * 유저 단위 마이그레이션 분산락용 Redisson 클라이언트
     * migration.lock.redisson.enabled=true 일 때만 활성화
     */
    @Bean(destroyMethod = "shutdown")
    @ConditionalOnProperty(name = "migration.lock.redisson.enabled", havingValue = "true")
    public RedissonClient redissonClient() {
        Config config = new Config();
        config.useSingleServer()
                .setAddress("redis://" + redisHost + ":" + redisPort);
        log.info("Redisson 클라이언트 초기화 - {}:{}", redisHost, redisPort);
        return Redisson.create(config);
    }
}
