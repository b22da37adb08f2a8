package khope.migration.migration;

import khope.migration.domain.BoardType;
import khope.migration.domain.Profile;
import khope.migration.domain.Project;
import khope.migration.domain.Settings;
import khope.migration.domain.Theme;
import khope.migration.domain.WorkspaceDocument;
import khope.migration.exception.ValidationException;
import khope.migration.migration.dto.LegacyProfile;
import khope.migration.migration.dto.LegacyProject;
import khope.migration.migration.dto.LegacySettings;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashSet;

/**
 * 레거시 형태 → 신규 형태 변환 (순수 함수)
 *
 * 기본값 테이블:
 * <pre>
 * settings.boardType         → uno
 * settings.theme             → light
 * settings.language          → en
 * settings.autoSave          → true
 * settings.tutorialCompleted → {}
 * profile.isPublic           → true
 * profile.username/bio/...   → 없음
 * project.name               → "Untitled Project"
 * project.description        → ""
 * project.workspace          → &lt;xml&gt;&lt;/xml&gt;
 * project.boardType          → uno
 * project.isPublic/canShare  → false
 * </pre>
 *
 * 누락된 선택 필드로는 실패하지 않는다. 값이 있는데 잘못된 경우(enum, 워크스페이스 문서)만
 * ValidationException을 던진다.
 */
@Component
public class ResourceTransformer {

    public Profile transformProfile(LegacyProfile legacy) {
        return transformProfile(legacy.getUserId(), legacy);
    }

    public Profile transformProfile(String ownerId, LegacyProfile legacy) {
        if (!StringUtils.hasText(ownerId)) {
            throw new ValidationException("Profile owner id is missing");
        }
        return Profile.builder()
                .userId(ownerId)
                .email(orDefault(legacy.getEmail(), ""))
                .name(orDefault(legacy.getDisplayName(), ""))
                .profileImage(blankToNull(legacy.getPhotoUrl()))
                .username(blankToNull(legacy.getUsername()))
                .bio(blankToNull(legacy.getBio()))
                .location(blankToNull(legacy.getLocation()))
                .website(blankToNull(legacy.getWebsite()))
                .isPublic(legacy.getIsPublic() != null ? legacy.getIsPublic() : true)
                .build();
    }

    public Settings transformSettings(String ownerId, LegacySettings legacy) {
        return Settings.builder()
                .userId(ownerId)
                .boardType(legacy.getBoardType() != null
                        ? BoardType.fromValue(legacy.getBoardType()) : BoardType.DEFAULT)
                .theme(legacy.getTheme() != null
                        ? Theme.fromValue(legacy.getTheme()) : Theme.DEFAULT)
                .language(StringUtils.hasText(legacy.getLanguage())
                        ? legacy.getLanguage() : Settings.DEFAULT_LANGUAGE)
                .autoSave(legacy.getAutoSave() != null ? legacy.getAutoSave() : true)
                .tutorialCompleted(legacy.getTutorialCompleted() != null
                        ? new HashMap<>(legacy.getTutorialCompleted()) : new HashMap<>())
                .updated(Instant.now())
                .build();
    }

    public Project transformProject(String ownerId, LegacyProject legacy) {
        String name = StringUtils.hasText(legacy.getName()) ? legacy.getName() : Project.DEFAULT_NAME;
        String workspace = legacy.getWorkspace() != null ? legacy.getWorkspace() : WorkspaceDocument.EMPTY;

        if (!WorkspaceDocument.isValid(workspace)) {
            throw new ValidationException("Invalid XML content: malformed Blockly workspace in project '"
                    + name + "'" + (legacy.getId() != null ? " (legacy id " + legacy.getId() + ")" : ""));
        }

        Instant now = Instant.now();
        return Project.builder()
                .userId(ownerId)
                .name(name)
                .description(orDefault(legacy.getDescription(), ""))
                .workspace(workspace)
                .boardType(legacy.getBoardType() != null
                        ? BoardType.fromValue(legacy.getBoardType()) : BoardType.DEFAULT)
                .isPublic(Boolean.TRUE.equals(legacy.getIsPublic()))
                .canShare(Boolean.TRUE.equals(legacy.getCanShare()))
                .tags(legacy.getTags() != null ? new LinkedHashSet<>(legacy.getTags()) : new LinkedHashSet<>())
                .legacyId(legacy.getId())
                .created(legacy.getCreated() != null ? legacy.getCreated() : now)
                .updated(legacy.getUpdated() != null ? legacy.getUpdated() : now)
                .build();
    }

    private static String orDefault(String value, String defaultValue) {
        return value != null ? value : defaultValue;
    }

    private static String blankToNull(String value) {
        return StringUtils.hasText(value) ? value : null;
    }
}
