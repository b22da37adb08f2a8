package khope.migration.migration.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * 레거시 프로젝트
 * 워크스페이스 문서는 레거시에서 xml 필드로 저장되어 있었다.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LegacyProject {

    @JsonAlias("firebaseId")
    private String id;

    private String name;

    private String description;

    @JsonAlias("xml")
    private String workspace;

    private String boardType;

    private Boolean isPublic;

    private Boolean canShare;

    private List<String> tags;

    private Instant created;

    private Instant updated;
}
