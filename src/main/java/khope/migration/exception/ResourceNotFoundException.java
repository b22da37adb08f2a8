package khope.migration.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.NOT_FOUND)
public class ResourceNotFoundException extends MigrationServiceException {

    public ResourceNotFoundException(String message) {
        super(message);
    }
}
