package khope.migration.domain;

/**
 * 유저별 마이그레이션 상태
 */
public enum MigrationStatus {
    PENDING,
    COMPLETED,
    FAILED,
    ROLLED_BACK;

    /**
     * 재마이그레이션을 막는 상태인지 (유저 단위 전체 가드)
     */
    public boolean blocksMigration() {
        return this == PENDING || this == COMPLETED;
    }
}
