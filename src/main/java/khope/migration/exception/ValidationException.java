package khope.migration.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * 단일 리소스 범위의 검증 실패
 *
 * 마이그레이션 중에는 errors 항목으로 기록되고 배치는 계속 진행된다.
 * 일반 CRUD 경로에서는 호출 실패로 그대로 전달된다.
 */
@ResponseStatus(HttpStatus.BAD_REQUEST)
public class ValidationException extends MigrationServiceException {

    public ValidationException(String message) {
        super(message);
    }
}
