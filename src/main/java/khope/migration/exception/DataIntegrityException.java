package khope.migration.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * 번들 체크섬 불일치
 * 마이그레이션 전체를 막는 유일한 all-or-nothing 실패
 */
@Getter
@ResponseStatus(HttpStatus.BAD_REQUEST)
public class DataIntegrityException extends MigrationServiceException {

    private final String expectedChecksum;
    private final String actualChecksum;

    public DataIntegrityException(String expectedChecksum, String actualChecksum) {
        super("Data integrity check failed: checksum mismatch");
        this.expectedChecksum = expectedChecksum;
        this.actualChecksum = actualChecksum;
    }
}
