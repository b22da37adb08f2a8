package khope.migration.migration.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 한 번의 마이그레이션 호출로 제출되는 레거시 리소스 묶음
 * 각 섹션은 선택적이며, 없는 섹션은 건너뛴다 (에러로 세지 않음).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LegacyDataBundle {

    private LegacySettings settings;

    private LegacyProfile profile;

    private List<LegacyProject> projects;

    @JsonIgnore
    public boolean isEmpty() {
        return settings == null && profile == null && (projects == null || projects.isEmpty());
    }
}
