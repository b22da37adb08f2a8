package khope.migration.service;

import khope.migration.domain.Profile;
import khope.migration.dualread.DualReadResult;
import khope.migration.dualread.ReadSource;
import khope.migration.exception.AuthorizationException;
import khope.migration.exception.ValidationException;
import khope.migration.migration.dto.LegacyProfile;
import khope.migration.support.TestDataCleaner;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static khope.migration.support.TestFixtures.user;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@DisplayName("ProfileService - 프로필 수정/조회")
class ProfileServiceTest {

    @Autowired
    private ProfileService profileService;

    @Autowired
    private TestDataCleaner cleaner;

    @AfterEach
    void tearDown() {
        cleaner.clean();
    }

    private static ProfileService.ProfileUpdate username(String username) {
        return new ProfileService.ProfileUpdate(username, null, null, null, null);
    }

    @Test
    @DisplayName("첫 수정 시 검증된 신원으로 비공개 프로필 생성")
    void firstUpdateCreatesPrivateProfile() {
        Profile profile = profileService.updateProfile(user("user-1"), username("alice"));

        assertThat(profile.getId()).isNotNull();
        assertThat(profile.getEmail()).isEqualTo("user-1@example.com");
        assertThat(profile.getName()).isEqualTo("User user-1");
        assertThat(profile.getIsPublic()).isFalse();
    }

    @Test
    @DisplayName("다른 유저가 쓰는 username은 거부, 본인 username 재저장은 허용")
    void usernameUniquenessExcludesOwner() {
        profileService.updateProfile(user("user-1"), username("alice"));

        assertThatThrownBy(() -> profileService.updateProfile(user("user-2"), username("alice")))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Username already taken: alice");

        Profile same = profileService.updateProfile(user("user-1"), username("alice"));
        assertThat(same.getUsername()).isEqualTo("alice");
    }

    @Test
    @DisplayName("형식/길이/URL 검증")
    void fieldValidation() {
        assertThatThrownBy(() -> profileService.updateProfile(user("user-1"), username("ab")))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Invalid username format: ab");

        assertThatThrownBy(() -> profileService.updateProfile(user("user-1"),
                new ProfileService.ProfileUpdate(null, "x".repeat(501), null, null, null)))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("Bio too long");

        assertThatThrownBy(() -> profileService.updateProfile(user("user-1"),
                new ProfileService.ProfileUpdate(null, null, null, "ftp://files.example.com", null)))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Invalid URL format: ftp://files.example.com");
    }

    @Test
    @DisplayName("비공개 프로필은 소유자에게만 보인다")
    void privateProfileVisibleOnlyToOwner() {
        profileService.updateProfile(user("user-1"), username("alice"));

        DualReadResult<Profile, LegacyProfile> own = profileService.getProfile(user("user-1"), "user-1");
        DualReadResult<Profile, LegacyProfile> other = profileService.getProfile(user("user-2"), "user-1");
        DualReadResult<Profile, LegacyProfile> anonymous = profileService.getProfile(null, "user-1");

        assertThat(own.isFound()).isTrue();
        assertThat(own.source()).isIn(ReadSource.TARGET, ReadSource.CACHE);
        assertThat(other.isFound()).isFalse();
        assertThat(anonymous.isFound()).isFalse();
    }

    @Test
    @DisplayName("공개로 바꾸면 다른 유저도 조회 가능")
    void publicProfileVisibleToOthers() {
        profileService.updateProfile(user("user-1"),
                new ProfileService.ProfileUpdate("alice", null, "Seoul", "https://alice.dev", true));

        DualReadResult<Profile, LegacyProfile> other = profileService.getProfile(user("user-2"), "user-1");

        assertThat(other.isFound()).isTrue();
        assertThat(other.data().getLocation()).isEqualTo("Seoul");
    }

    @Test
    @DisplayName("신원 없이 수정하면 거부")
    void updateRequiresIdentity() {
        assertThatThrownBy(() -> profileService.updateProfile(null, username("alice")))
                .isInstanceOf(AuthorizationException.class);
    }
}
