package khope.migration.service;

import khope.migration.checksum.ChecksumEngine;
import khope.migration.domain.Project;
import khope.migration.domain.ProjectFile;
import khope.migration.exception.ResourceNotFoundException;
import khope.migration.repository.ProjectFileRepository;
import khope.migration.repository.ProjectRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;

/**
 * 워크스페이스 문서 무결성 레코드 관리
 *
 * 프로젝트당 현재 유효한 레코드는 하나. 워크스페이스가 바뀌면 교체한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProjectFileService {

    private final ProjectFileRepository projectFileRepository;
    private final ProjectRepository projectRepository;
    private final ChecksumEngine checksumEngine;

    /**
     * 현재 워크스페이스 문서 기준으로 무결성 레코드 교체
     */
    @Transactional
    public ProjectFile saveWorkspaceFile(Project project) {
        String workspace = project.getWorkspace();
        long replaced = projectFileRepository.deleteByProjectId(project.getId());

        ProjectFile file = projectFileRepository.save(ProjectFile.builder()
                .projectId(project.getId())
                .userId(project.getUserId())
                .filename(ProjectFile.WORKSPACE_FILENAME)
                .contentType(ProjectFile.WORKSPACE_CONTENT_TYPE)
                .size(byteSize(workspace))
                .checksum(checksumEngine.checksum(workspace))
                .storageRef(storageRef(project.getId()))
                .uploadedAt(Instant.now())
                .build());

        log.debug("워크스페이스 파일 레코드 저장 - projectId: {}, size: {}, 교체: {}건",
                project.getId(), file.getSize(), replaced);
        return file;
    }

    /**
     * 저장된 워크스페이스를 최신 레코드의 크기/체크섬과 비교
     */
    @Transactional(readOnly = true)
    public IntegrityReport verifyIntegrity(Long projectId) {
        Project project = projectRepository.findById(projectId)
                .orElseThrow(() -> new ResourceNotFoundException("Project not found: " + projectId));
        ProjectFile file = projectFileRepository.findFirstByProjectIdOrderByUploadedAtDescIdDesc(projectId)
                .orElseThrow(() -> new ResourceNotFoundException("No file record for project: " + projectId));

        String actualChecksum = checksumEngine.checksum(project.getWorkspace());
        long actualSize = byteSize(project.getWorkspace());
        boolean valid = file.getChecksum().equals(actualChecksum) && file.getSize() == actualSize;

        if (!valid) {
            log.warn("워크스페이스 무결성 불일치 - projectId: {}, expected: {}/{}B, actual: {}/{}B",
                    projectId, file.getChecksum(), file.getSize(), actualChecksum, actualSize);
        }

        return new IntegrityReport(projectId, valid, file.getChecksum(), actualChecksum,
                file.getSize(), actualSize);
    }

    @Transactional(readOnly = true)
    public List<ProjectFile> listFiles(Long projectId) {
        return projectFileRepository.findByProjectId(projectId);
    }

    @Transactional
    public long deleteFiles(Long projectId) {
        return projectFileRepository.deleteByProjectId(projectId);
    }

    private static long byteSize(String content) {
        return content.getBytes(StandardCharsets.UTF_8).length;
    }

    private static String storageRef(Long projectId) {
        return "project-" + projectId + "-workspace";
    }

    public record IntegrityReport(
            Long projectId,
            boolean valid,
            String expectedChecksum,
            String actualChecksum,
            long expectedSize,
            long actualSize
    ) {
    }
}
