package khope.migration.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import khope.migration.exception.ValidationException;

import java.util.Arrays;

/**
 * 지원 보드 종류
 */
public enum BoardType {
    UNO("uno"),
    NANO("nano"),
    MEGA("mega");

    public static final BoardType DEFAULT = UNO;

    private final String value;

    BoardType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static BoardType fromValue(String value) {
        return Arrays.stream(values())
                .filter(type -> type.value.equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new ValidationException("Invalid board type: " + value));
    }
}
