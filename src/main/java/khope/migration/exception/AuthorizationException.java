package khope.migration.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * 호출자 인증 정보가 없거나, 리소스 소유자와 다르거나, 관리자 권한이 없을 때
 * 부분 적용 없이 호출 전체가 실패한다.
 */
@ResponseStatus(HttpStatus.FORBIDDEN)
public class AuthorizationException extends MigrationServiceException {

    public AuthorizationException(String message) {
        super(message);
    }
}
