package khope.migration.controller;

import khope.migration.domain.Settings;
import khope.migration.dualread.DualReadResult;
import khope.migration.identity.IdentityProvider;
import khope.migration.identity.VerifiedIdentity;
import khope.migration.migration.dto.LegacySettings;
import khope.migration.service.SettingsService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/settings")
@RequiredArgsConstructor
public class SettingsController {

    private final SettingsService settingsService;
    private final IdentityProvider identityProvider;

    @GetMapping
    public ResponseEntity<DualReadResult<Settings, LegacySettings>> settings() {
        return ResponseEntity.ok(settingsService.getSettings(caller()));
    }

    @PutMapping
    public ResponseEntity<Settings> update(@RequestBody SettingsService.SettingsUpdate request) {
        return ResponseEntity.ok(settingsService.updateSettings(caller(), request));
    }

    @PutMapping("/tutorial/{step}")
    public ResponseEntity<Settings> tutorial(@PathVariable String step, @RequestBody TutorialProgressRequest request) {
        return ResponseEntity.ok(settingsService.updateTutorialProgress(caller(), step, request.completed()));
    }

    private VerifiedIdentity caller() {
        return identityProvider.currentIdentity().orElse(null);
    }

    public record TutorialProgressRequest(
            boolean completed
    ) {}
}
