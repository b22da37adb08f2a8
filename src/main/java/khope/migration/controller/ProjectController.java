package khope.migration.controller;

import khope.migration.domain.Project;
import khope.migration.domain.ProjectFile;
import khope.migration.dualread.DualReadResult;
import khope.migration.exception.ResourceNotFoundException;
import khope.migration.identity.IdentityProvider;
import khope.migration.identity.VerifiedIdentity;
import khope.migration.migration.dto.LegacyProject;
import khope.migration.service.ProjectFileService;
import khope.migration.service.ProjectService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/projects")
@RequiredArgsConstructor
public class ProjectController {

    private final ProjectService projectService;
    private final ProjectFileService projectFileService;
    private final IdentityProvider identityProvider;

    @GetMapping
    public ResponseEntity<DualReadResult<List<Project>, List<LegacyProject>>> myProjects() {
        return ResponseEntity.ok(projectService.getUserProjects(caller()));
    }

    @GetMapping("/public")
    public ResponseEntity<List<Project>> publicProjects(@RequestParam(required = false) Integer limit) {
        return ResponseEntity.ok(projectService.getPublicProjects(limit));
    }

    @GetMapping("/public/{id}")
    public ResponseEntity<Project> publicProject(@PathVariable Long id) {
        return projectService.getPublicProject(id)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/{id}")
    public ResponseEntity<Project> findById(@PathVariable Long id) {
        return projectService.getProject(caller(), id)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @PostMapping
    public ResponseEntity<Project> create(@RequestBody ProjectService.ProjectDraft request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(projectService.createProject(caller(), request));
    }

    @PutMapping("/{id}")
    public ResponseEntity<Project> update(@PathVariable Long id, @RequestBody ProjectService.ProjectDraft request) {
        return ResponseEntity.ok(projectService.updateProject(caller(), id, request));
    }

    @PostMapping("/{id}/views")
    public ResponseEntity<ViewCountResponse> incrementViews(@PathVariable Long id) {
        return ResponseEntity.ok(new ViewCountResponse(id, projectService.incrementViews(id)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable Long id) {
        projectService.deleteProject(caller(), id);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{id}/files")
    public ResponseEntity<List<ProjectFile>> files(@PathVariable Long id) {
        requireReadable(id);
        return ResponseEntity.ok(projectFileService.listFiles(id));
    }

    @GetMapping("/{id}/integrity")
    public ResponseEntity<ProjectFileService.IntegrityReport> integrity(@PathVariable Long id) {
        requireReadable(id);
        return ResponseEntity.ok(projectFileService.verifyIntegrity(id));
    }

    private void requireReadable(Long id) {
        if (projectService.getProject(caller(), id).isEmpty()) {
            throw new ResourceNotFoundException("Project not found: " + id);
        }
    }

    private VerifiedIdentity caller() {
        return identityProvider.currentIdentity().orElse(null);
    }

    public record ViewCountResponse(
            Long id,
            long views
    ) {}
}
