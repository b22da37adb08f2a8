package khope.migration.dualread;

/**
 * 듀얼 리드 결과의 출처
 */
public enum ReadSource {
    CACHE,
    TARGET,
    LEGACY,
    NONE
}
