package khope.migration.checksum;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import khope.migration.migration.dto.LegacySettings;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ChecksumEngine - 정규화 JSON 체크섬")
class ChecksumEngineTest {

    private final ChecksumEngine engine =
            new ChecksumEngine(new RollingHashChecksum(), new ObjectMapper().registerModule(new JavaTimeModule()));

    @Test
    @DisplayName("null 필드는 제외되고 프로퍼티는 알파벳 순으로 직렬화된다")
    void canonicalFormSortsAndDropsNulls() {
        LegacySettings settings = LegacySettings.builder()
                .theme("dark")
                .boardType("nano")
                .build();

        assertThat(engine.canonicalize(settings)).isEqualTo("{\"boardType\":\"nano\",\"theme\":\"dark\"}");
    }

    @Test
    @DisplayName("맵 키 삽입 순서와 무관하게 같은 체크섬")
    void mapKeyOrderDoesNotMatter() {
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("name", "Blink");
        first.put("boardType", "uno");

        Map<String, Object> second = new LinkedHashMap<>();
        second.put("boardType", "uno");
        second.put("name", "Blink");

        assertThat(engine.checksum(first)).isEqualTo(engine.checksum(second));
    }

    @Test
    @DisplayName("값 하나가 바뀌면 verify 실패")
    void verifyDetectsChangedValue() {
        LegacySettings original = LegacySettings.builder().theme("dark").autoSave(true).build();
        String tag = engine.checksum(original);

        LegacySettings tampered = LegacySettings.builder().theme("dark").autoSave(false).build();

        assertThat(engine.verify(original, tag)).isTrue();
        assertThat(engine.verify(tampered, tag)).isFalse();
        assertThat(engine.verify(original, null)).isFalse();
    }

    @Test
    @DisplayName("문자열은 JSON 인코딩 없이 원문 그대로 해시")
    void rawStringIsHashedAsIs() {
        String workspace = "<xml><block type=\"led\"/></xml>";

        assertThat(engine.checksum((Object) workspace)).isEqualTo(new RollingHashChecksum().hash(workspace));
        assertThat(engine.algorithm()).isEqualTo(RollingHashChecksum.ALGORITHM);
    }
}
