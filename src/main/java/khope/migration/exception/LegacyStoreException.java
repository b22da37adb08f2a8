package khope.migration.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * 레거시 저장소 조회 실패 (연결 장애, 손상된 문서)
 * "데이터 없음"과 구분하기 위해 빈 결과 대신 이 예외를 던진다.
 */
@ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
public class LegacyStoreException extends MigrationServiceException {

    public LegacyStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
