package khope.migration.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import khope.migration.exception.ValidationException;

import java.util.Arrays;

public enum Theme {
    LIGHT("light"),
    DARK("dark");

    public static final Theme DEFAULT = LIGHT;

    private final String value;

    Theme(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static Theme fromValue(String value) {
        return Arrays.stream(values())
                .filter(theme -> theme.value.equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new ValidationException("Invalid theme: " + value));
    }
}
