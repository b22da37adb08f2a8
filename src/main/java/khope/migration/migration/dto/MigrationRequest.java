package khope.migration.migration.dto;

import com.fasterxml.jackson.annotation.JsonAlias;

/**
 * @param bundle   레거시 데이터 번들
 * @param checksum 클라이언트가 계산한 번들 체크섬
 */
public record MigrationRequest(
        @JsonAlias("firebaseData") LegacyDataBundle bundle,
        String checksum
) {
}
