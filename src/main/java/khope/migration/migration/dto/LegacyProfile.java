package khope.migration.migration.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 레거시 저장소의 유저 프로필
 *
 * 레거시 필드명은 @JsonAlias로 흡수한다:
 * - uid → userId
 * - displayName / name → displayName
 * - photoURL / profileImage → photoUrl
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LegacyProfile {

    @JsonAlias("uid")
    private String userId;

    private String email;

    @JsonAlias("name")
    private String displayName;

    @JsonAlias({"photoURL", "profileImage"})
    private String photoUrl;

    private String username;

    private String bio;

    private String location;

    private String website;

    private Boolean isPublic;
}
