package khope.migration.checksum;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 체크섬 엔진
 *
 * 두 곳에서 사용된다:
 * - 아티팩트 무결성: 저장 시점의 워크스페이스 문서 원문
 * - 번들 무결성: 마이그레이션 번들의 정규화된 JSON
 *
 * 정규화 규칙: 프로퍼티/맵 키 알파벳 정렬, null 제외, 공백 없음.
 * 클라이언트도 같은 규칙으로 직렬화해야 태그가 일치한다.
 */
@Slf4j
@Component
public class ChecksumEngine {

    private final ChecksumStrategy strategy;
    private final ObjectMapper canonicalMapper;

    public ChecksumEngine(ChecksumStrategy strategy, ObjectMapper objectMapper) {
        this.strategy = strategy;
        this.canonicalMapper = objectMapper.copy()
                .configure(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY, true)
                .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
                .configure(SerializationFeature.INDENT_OUTPUT, false)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL);
        log.info("체크섬 알고리즘: {}", strategy.algorithm());
    }

    /**
     * 원문 문자열의 체크섬 (아티팩트용)
     */
    public String checksum(String content) {
        return strategy.hash(content);
    }

    /**
     * 구조화된 페이로드의 체크섬 (번들용)
     */
    public String checksum(Object payload) {
        if (payload instanceof String content) {
            return checksum(content);
        }
        return strategy.hash(canonicalize(payload));
    }

    public boolean verify(Object payload, String expectedChecksum) {
        return expectedChecksum != null && expectedChecksum.equals(checksum(payload));
    }

    public String canonicalize(Object payload) {
        try {
            return canonicalMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("체크섬 대상 직렬화 실패: " + payload.getClass().getSimpleName(), e);
        }
    }

    public String algorithm() {
        return strategy.algorithm();
    }
}
