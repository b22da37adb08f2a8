package khope.migration.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@Getter
@ResponseStatus(HttpStatus.CONFLICT)
public class DuplicateMigrationException extends MigrationServiceException {

    private final String userId;

    public DuplicateMigrationException(String userId) {
        super("User data already migrated: " + userId);
        this.userId = userId;
    }
}
