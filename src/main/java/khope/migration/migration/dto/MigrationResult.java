package khope.migration.migration.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * 마이그레이션 집계 결과
 *
 * 부분 실패는 정상 결과다. 호출자는 최상위 성공 여부가 아니라 errors를 확인해야 한다.
 *
 * @param migrationId    롤백에 사용할 마이그레이션 ID
 * @param migrated       성공적으로 기록된 서브 리소스 수
 * @param migratedByKind 종류별 성공 수 (settings/profile/projects)
 * @param errors         실패한 서브 리소스마다 하나씩, 종류 접두어 포함
 */
public record MigrationResult(
        String migrationId,
        int migrated,
        Map<String, Integer> migratedByKind,
        List<String> errors
) {

    @JsonProperty("success")
    public boolean success() {
        return errors.isEmpty();
    }
}
