package khope.migration.migration.dto;

import java.util.Map;

/**
 * @param rolledBack   종류별 삭제된 레코드 수 (settings/profile/projects)
 * @param projectFiles 함께 삭제된 프로젝트 파일 무결성 레코드 수
 */
public record RollbackResult(
        String userId,
        String migrationId,
        Map<String, Integer> rolledBack,
        int projectFiles
) {

    public int total() {
        return rolledBack.values().stream().mapToInt(Integer::intValue).sum();
    }
}
