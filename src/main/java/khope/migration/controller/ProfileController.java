package khope.migration.controller;

import khope.migration.domain.Profile;
import khope.migration.dualread.DualReadResult;
import khope.migration.identity.IdentityProvider;
import khope.migration.identity.VerifiedIdentity;
import khope.migration.migration.dto.LegacyProfile;
import khope.migration.service.ProfileService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/profile")
@RequiredArgsConstructor
public class ProfileController {

    private final ProfileService profileService;
    private final IdentityProvider identityProvider;

    @GetMapping
    public ResponseEntity<DualReadResult<Profile, LegacyProfile>> myProfile() {
        return profile(null);
    }

    @GetMapping("/{userId}")
    public ResponseEntity<DualReadResult<Profile, LegacyProfile>> profile(@PathVariable String userId) {
        DualReadResult<Profile, LegacyProfile> result = profileService.getProfile(caller(), userId);
        if (!result.isFound()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(result);
    }

    @PutMapping
    public ResponseEntity<Profile> update(@RequestBody ProfileService.ProfileUpdate request) {
        return ResponseEntity.ok(profileService.updateProfile(caller(), request));
    }

    private VerifiedIdentity caller() {
        return identityProvider.currentIdentity().orElse(null);
    }
}
