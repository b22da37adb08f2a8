package khope.migration.migration;

import khope.migration.exception.DuplicateMigrationException;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * 유저 단위 분산 락
 *
 * RedissonClient가 없으면(migration.lock.redisson.enabled=false) 락 없이 실행하고
 * 중복 방지는 마이그레이션 레코드의 unique 제약에 맡긴다.
 */
@Slf4j
@Component
public class MigrationLockManager {

    private static final String LOCK_PREFIX = "lock:migration:";

    private final RedissonClient redissonClient;

    @Value("${migration.lock.wait-ms:0}")
    private long waitMs;

    @Value("${migration.lock.lease-ms:30000}")
    private long leaseMs;

    public MigrationLockManager(ObjectProvider<RedissonClient> redissonClientProvider) {
        this.redissonClient = redissonClientProvider.getIfAvailable();
        if (redissonClient == null) {
            log.info("분산 락 비활성화 - 레코드 제약 조건만 사용");
        }
    }

    /**
     * 락을 잡고 작업 실행. 이미 다른 요청이 진행 중이면 중복으로 처리한다.
     */
    public <T> T executeWithLock(String userId, Supplier<T> task) {
        if (redissonClient == null) {
            return task.get();
        }

        RLock lock = redissonClient.getLock(LOCK_PREFIX + userId);
        boolean acquired;
        try {
            acquired = lock.tryLock(waitMs, leaseMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("락 획득 중 인터럽트 - userId: " + userId, e);
        }

        if (!acquired) {
            log.info("마이그레이션 진행 중, 락 획득 실패 - userId: {}", userId);
            throw new DuplicateMigrationException(userId);
        }

        try {
            return task.get();
        } finally {
            if (lock.isHeldByCurrentThread()) {
                lock.unlock();
            }
        }
    }
}
