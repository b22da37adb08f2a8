package khope.migration.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 마이그레이션 대상 서브 리소스 종류
 * label은 errors 항목의 접두어로 사용된다.
 */
public enum ResourceKind {
    SETTINGS("settings", "Settings"),
    PROFILE("profile", "Profile"),
    PROJECT("projects", "Project");

    private final String key;
    private final String label;

    ResourceKind(String key, String label) {
        this.key = key;
        this.label = label;
    }

    @JsonValue
    public String getKey() {
        return key;
    }

    public String getLabel() {
        return label;
    }

    public String failure(String message) {
        return label + " migration failed: " + message;
    }
}
