package khope.migration.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import khope.migration.checksum.ChecksumStrategy;
import khope.migration.checksum.RollingHashChecksum;
import khope.migration.checksum.Sha256Checksum;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.jackson.Jackson2ObjectMapperBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * 마이그레이션 관련 설정
 */
@Configuration
public class MigrationConfig {

    public static final String MIGRATION_EXECUTOR = "migrationExecutor";

    @Value("${migration.checksum.algorithm:" + RollingHashChecksum.ALGORITHM + "}")
    private String checksumAlgorithm;

    @Value("${migration.executor.pool-size:4}")
    private int executorPoolSize;

    /**
     * ObjectMapper 커스터마이징
     * Spring Boot 자동 설정된 ObjectMapper를 사용하되 추가 설정
     */
    @Bean
    public Jackson2ObjectMapperBuilderCustomizer objectMapperCustomizer() {
        return builder -> {
            // unknown 필드 무시 (레거시 문서에는 여분의 필드가 많다)
            builder.featuresToDisable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
            // 날짜 처리
            builder.featuresToDisable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
            builder.modulesToInstall(new JavaTimeModule());
        };
    }

    /**
     * 체크섬 알고리즘 선택
     * 기본은 손상 감지용 32비트 롤링 해시, 변조 감지가 필요하면 sha256
     */
    @Bean
    public ChecksumStrategy checksumStrategy() {
        return switch (checksumAlgorithm) {
            case RollingHashChecksum.ALGORITHM -> new RollingHashChecksum();
            case Sha256Checksum.ALGORITHM -> new Sha256Checksum();
            default -> throw new IllegalStateException(
                    "지원하지 않는 체크섬 알고리즘: " + checksumAlgorithm);
        };
    }

    /**
     * 듀얼 리드 비동기 마이그레이션 / 백그라운드 워커용 실행기
     */
    @Bean(MIGRATION_EXECUTOR)
    public ThreadPoolTaskExecutor migrationExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(executorPoolSize);
        executor.setMaxPoolSize(executorPoolSize);
        executor.setThreadNamePrefix("migration-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        return executor;
    }
}
