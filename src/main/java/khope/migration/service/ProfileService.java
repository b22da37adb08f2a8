package khope.migration.service;

import khope.migration.domain.Profile;
import khope.migration.dualread.DualReadCache;
import khope.migration.dualread.DualReadResolver;
import khope.migration.dualread.DualReadResult;
import khope.migration.identity.IdentityGuard;
import khope.migration.identity.VerifiedIdentity;
import khope.migration.migration.dto.LegacyProfile;
import khope.migration.repository.ProfileRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

/**
 * 프로필 조회/수정
 *
 * 조회는 듀얼 리드를 거치며, 비공개 프로필은 소유자에게만 보인다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProfileService {

    private final ProfileRepository profileRepository;
    private final DualReadResolver dualReadResolver;
    private final DualReadCache dualReadCache;
    private final TargetRecordValidator validator;

    /**
     * @param userId null이면 호출자 본인
     */
    public DualReadResult<Profile, LegacyProfile> getProfile(VerifiedIdentity caller, String userId) {
        String targetUserId = userId != null ? userId : (caller != null ? caller.subject() : null);
        if (targetUserId == null) {
            return DualReadResult.notFound();
        }

        DualReadResult<Profile, LegacyProfile> result = dualReadResolver.resolveProfile(caller, targetUserId);
        boolean owner = caller != null && caller.owns(targetUserId);

        if (result.isAuthoritative() && !owner && !Boolean.TRUE.equals(result.data().getIsPublic())) {
            return DualReadResult.notFound();
        }
        // 레거시 프로필은 공개 여부가 없으면 공개로 본다 (마이그레이션 기본값과 동일)
        if (result.legacyData() != null && !owner && Boolean.FALSE.equals(result.legacyData().getIsPublic())) {
            return DualReadResult.notFound();
        }
        return result;
    }

    /**
     * 본인 프로필 수정. 없으면 검증된 신원 정보로 새로 만든다.
     */
    @Transactional
    public Profile updateProfile(VerifiedIdentity caller, ProfileUpdate update) {
        IdentityGuard.requireIdentity(caller);
        String userId = caller.subject();

        validator.validateUsername(update.username(), userId);
        validator.validateBio(update.bio());
        validator.validateWebsite(update.website());

        Profile profile = profileRepository.findByUserId(userId)
                .orElseGet(() -> Profile.builder()
                        .userId(userId)
                        .email(caller.email() != null ? caller.email() : "")
                        .name(caller.name() != null ? caller.name() : "")
                        .profileImage(caller.pictureUrl())
                        .lastLogin(Instant.now())
                        .build());

        if (update.username() != null) {
            profile.setUsername(update.username());
        }
        if (update.bio() != null) {
            profile.setBio(update.bio());
        }
        if (update.location() != null) {
            profile.setLocation(update.location());
        }
        if (update.website() != null) {
            profile.setWebsite(update.website());
        }
        if (update.isPublic() != null) {
            profile.setIsPublic(update.isPublic());
        }

        Profile saved = profileRepository.save(profile);
        dualReadCache.evict(userId);
        log.debug("프로필 저장 - userId: {}", userId);
        return saved;
    }

    public record ProfileUpdate(
            String username,
            String bio,
            String location,
            String website,
            Boolean isPublic
    ) {}
}
