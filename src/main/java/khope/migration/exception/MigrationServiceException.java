package khope.migration.exception;

/**
 * 마이그레이션 서브시스템 공통 예외
 */
public abstract class MigrationServiceException extends RuntimeException {

    protected MigrationServiceException(String message) {
        super(message);
    }

    protected MigrationServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
