package khope.migration.controller;

import khope.migration.checksum.ChecksumEngine;
import khope.migration.domain.MigrationStatus;
import khope.migration.domain.Profile;
import khope.migration.domain.Project;
import khope.migration.domain.Settings;
import khope.migration.exception.ResourceNotFoundException;
import khope.migration.identity.IdentityGuard;
import khope.migration.identity.IdentityProvider;
import khope.migration.identity.VerifiedIdentity;
import khope.migration.migration.BackgroundMigrationWorker;
import khope.migration.migration.MigrationService;
import khope.migration.migration.ResourceTransformer;
import khope.migration.migration.RollbackService;
import khope.migration.migration.dto.LegacyDataBundle;
import khope.migration.migration.dto.LegacyProfile;
import khope.migration.migration.dto.LegacyProject;
import khope.migration.migration.dto.LegacySettings;
import khope.migration.migration.dto.MigrationRequest;
import khope.migration.migration.dto.MigrationResult;
import khope.migration.migration.dto.MigrationStatusView;
import khope.migration.migration.dto.RollbackResult;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/migration")
@RequiredArgsConstructor
public class MigrationController {

    private final MigrationService migrationService;
    private final RollbackService rollbackService;
    private final ResourceTransformer transformer;
    private final ChecksumEngine checksumEngine;
    private final IdentityProvider identityProvider;
    private final ObjectProvider<BackgroundMigrationWorker> backgroundWorker;

    @PostMapping
    public ResponseEntity<MigrationResult> migrate(@RequestBody MigrationRequest request) {
        return ResponseEntity.ok(migrationService.migrateUserData(caller(), request.bundle(), request.checksum()));
    }

    @GetMapping("/status")
    public ResponseEntity<MigrationStatusView> myStatus() {
        VerifiedIdentity caller = IdentityGuard.requireIdentity(caller());
        return status(caller.subject());
    }

    @GetMapping("/status/{userId}")
    public ResponseEntity<MigrationStatusView> status(@PathVariable String userId) {
        return migrationService.checkMigrationStatus(caller(), userId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/records")
    public ResponseEntity<List<MigrationStatusView>> records(@RequestParam MigrationStatus status) {
        return ResponseEntity.ok(migrationService.findByStatus(caller(), status));
    }

    @PostMapping("/rollback")
    public ResponseEntity<RollbackResult> rollback(@RequestBody RollbackRequest request) {
        return ResponseEntity.ok(rollbackService.rollback(caller(), request.userId(), request.migrationId()));
    }

    /**
     * 클라이언트가 번들 제출 전에 같은 정규화 규칙으로 태그를 계산할 수 있도록 제공
     */
    @PostMapping("/checksum")
    public ResponseEntity<ChecksumResponse> checksum(@RequestBody LegacyDataBundle bundle) {
        return ResponseEntity.ok(new ChecksumResponse(checksumEngine.algorithm(), checksumEngine.checksum(bundle)));
    }

    @PostMapping("/transform/profile")
    public ResponseEntity<Profile> previewProfile(@RequestBody LegacyProfile legacy) {
        VerifiedIdentity caller = IdentityGuard.requireIdentity(caller());
        return ResponseEntity.ok(transformer.transformProfile(caller.subject(), legacy));
    }

    @PostMapping("/transform/settings")
    public ResponseEntity<Settings> previewSettings(@RequestBody LegacySettings legacy) {
        VerifiedIdentity caller = IdentityGuard.requireIdentity(caller());
        return ResponseEntity.ok(transformer.transformSettings(caller.subject(), legacy));
    }

    @PostMapping("/transform/project")
    public ResponseEntity<Project> previewProject(@RequestBody LegacyProject legacy) {
        VerifiedIdentity caller = IdentityGuard.requireIdentity(caller());
        return ResponseEntity.ok(transformer.transformProject(caller.subject(), legacy));
    }

    @GetMapping("/background/progress")
    public ResponseEntity<BackgroundMigrationWorker.MigrationProgress> backgroundProgress() {
        BackgroundMigrationWorker worker = backgroundWorker.getIfAvailable();
        if (worker == null) {
            throw new ResourceNotFoundException("Background migration is disabled");
        }
        return ResponseEntity.ok(worker.getProgress());
    }

    private VerifiedIdentity caller() {
        return identityProvider.currentIdentity().orElse(null);
    }

    public record RollbackRequest(
            String userId,
            String migrationId
    ) {}

    public record ChecksumResponse(
            String algorithm,
            String checksum
    ) {}
}
