package khope.migration.migration.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * 레거시 유저 설정
 * boardType/theme는 원본 문자열 그대로 보관하고 변환 시점에 검증한다.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LegacySettings {

    private String boardType;

    private String theme;

    private String language;

    private Boolean autoSave;

    private Map<String, Boolean> tutorialCompleted;
}
