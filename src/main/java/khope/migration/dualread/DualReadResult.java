package khope.migration.dualread;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * 듀얼 리드 결과
 *
 * - CACHE/TARGET: data에 신규 저장소 레코드 (권위 있음)
 * - LEGACY: legacyData에 레거시 형태 레코드, migrationTriggered는 마이그레이션 시작 여부
 * - NONE: 두 저장소 모두 데이터 없음 (에러 아님). 기본값이 있는 리소스는 data에 기본값
 */
public record DualReadResult<T, L>(
        ReadSource source,
        T data,
        L legacyData,
        boolean migrationTriggered
) {

    public static <T, L> DualReadResult<T, L> cached(T data) {
        return new DualReadResult<>(ReadSource.CACHE, data, null, false);
    }

    public static <T, L> DualReadResult<T, L> authoritative(T data) {
        return new DualReadResult<>(ReadSource.TARGET, data, null, false);
    }

    public static <T, L> DualReadResult<T, L> fallback(L legacyData, boolean migrationTriggered) {
        return new DualReadResult<>(ReadSource.LEGACY, null, legacyData, migrationTriggered);
    }

    public static <T, L> DualReadResult<T, L> notFound() {
        return new DualReadResult<>(ReadSource.NONE, null, null, false);
    }

    /**
     * 어디에도 없을 때 저장되지 않은 기본값을 돌려주는 리소스용 (settings)
     */
    public static <T, L> DualReadResult<T, L> defaulted(T defaults) {
        return new DualReadResult<>(ReadSource.NONE, defaults, null, false);
    }

    @JsonIgnore
    public boolean isFound() {
        return source != ReadSource.NONE;
    }

    @JsonIgnore
    public boolean isAuthoritative() {
        return source == ReadSource.TARGET || source == ReadSource.CACHE;
    }
}
