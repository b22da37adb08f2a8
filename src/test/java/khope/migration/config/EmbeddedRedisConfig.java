package khope.migration.config;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

/**
 * 테스트용 Embedded Redis 설정
 *
 * embedded-redis가 클래스패스에 있을 때만 레거시 저장소용 Redis를 띄운다.
 * 없으면 Redis 의존 테스트는 assumeTrue로 건너뛴다.
 */
@Configuration
@Profile("test")
public class EmbeddedRedisConfig {

    private static final Logger log = LoggerFactory.getLogger(EmbeddedRedisConfig.class);

    @Value("${spring.data.redis.port:6370}")
    private int redisPort;

    private Object redisServer;

    @PostConstruct
    public void startRedis() {
        String osArch = System.getProperty("os.arch");
        String osName = System.getProperty("os.name").toLowerCase();
        if (osName.contains("mac") && osArch.equals("aarch64")) {
            log.warn("macOS ARM 환경, Embedded Redis를 건너뜁니다. 레거시 Redis 테스트는 스킵됩니다.");
            return;
        }

        try {
            Class<?> redisServerClass = Class.forName("redis.embedded.RedisServer");
            Object builder = redisServerClass.getMethod("builder").invoke(null);
            builder = builder.getClass().getMethod("port", int.class).invoke(builder, redisPort);
            redisServer = builder.getClass().getMethod("build").invoke(builder);
            redisServer.getClass().getMethod("start").invoke(redisServer);
            log.info("Embedded Redis 시작됨 (포트: {})", redisPort);
        } catch (ClassNotFoundException e) {
            log.info("embedded-redis 없음, 레거시 Redis 테스트는 로컬 Redis(포트: {})가 있을 때만 실행", redisPort);
        } catch (Exception e) {
            log.warn("Embedded Redis 시작 실패: {}", e.getMessage());
        }
    }

    @PreDestroy
    public void stopRedis() {
        if (redisServer == null) {
            return;
        }
        try {
            Boolean isActive = (Boolean) redisServer.getClass().getMethod("isActive").invoke(redisServer);
            if (isActive) {
                redisServer.getClass().getMethod("stop").invoke(redisServer);
                log.info("Embedded Redis 중지됨");
            }
        } catch (Exception e) {
            log.warn("Embedded Redis 중지 실패: {}", e.getMessage());
        }
    }
}
