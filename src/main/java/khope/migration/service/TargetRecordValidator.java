package khope.migration.service;

import khope.migration.domain.Profile;
import khope.migration.domain.Project;
import khope.migration.domain.WorkspaceDocument;
import khope.migration.exception.ValidationException;
import khope.migration.repository.ProfileRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.regex.Pattern;

/**
 * 신규 저장소 쓰기 전 필드 검증
 * 마이그레이션 경로와 CRUD 경로가 같은 규칙을 사용한다.
 */
@Component
@RequiredArgsConstructor
public class TargetRecordValidator {

    private static final Pattern USERNAME = Pattern.compile("^[a-zA-Z0-9_]{3,20}$");

    private final ProfileRepository profileRepository;

    /**
     * username 형식 + 전역 유일성 (본인의 기존 레코드는 제외)
     */
    public void validateUsername(String username, String ownerId) {
        if (username == null) {
            return;
        }
        if (!USERNAME.matcher(username).matches()) {
            throw new ValidationException("Invalid username format: " + username);
        }
        if (profileRepository.existsByUsernameAndUserIdNot(username, ownerId)) {
            throw new ValidationException("Username already taken: " + username);
        }
    }

    public void validateBio(String bio) {
        if (bio != null && bio.length() > Profile.BIO_MAX_LENGTH) {
            throw new ValidationException("Bio too long: max " + Profile.BIO_MAX_LENGTH + " characters");
        }
    }

    public void validateWebsite(String website) {
        if (website == null || website.isEmpty()) {
            return;
        }
        try {
            URI uri = new URI(website);
            String scheme = uri.getScheme();
            if (scheme == null || uri.getHost() == null
                    || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
                throw new ValidationException("Invalid URL format: " + website);
            }
        } catch (URISyntaxException e) {
            throw new ValidationException("Invalid URL format: " + website);
        }
    }

    public void validateProfile(Profile profile) {
        validateUsername(profile.getUsername(), profile.getUserId());
        validateBio(profile.getBio());
        validateWebsite(profile.getWebsite());
    }

    public void validateProjectName(String name) {
        if (name == null || name.isEmpty() || name.length() > Project.NAME_MAX_LENGTH) {
            throw new ValidationException("Project name must be between 1 and "
                    + Project.NAME_MAX_LENGTH + " characters");
        }
    }

    public void validateWorkspace(String workspace, String projectName) {
        if (!WorkspaceDocument.isValid(workspace)) {
            throw new ValidationException("Invalid XML content: malformed Blockly workspace in project '"
                    + projectName + "'");
        }
    }
}
