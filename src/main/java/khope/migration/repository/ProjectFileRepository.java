package khope.migration.repository;

import khope.migration.domain.ProjectFile;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ProjectFileRepository extends JpaRepository<ProjectFile, Long> {

    List<ProjectFile> findByProjectId(Long projectId);

    Optional<ProjectFile> findFirstByProjectIdOrderByUploadedAtDescIdDesc(Long projectId);

    List<ProjectFile> findByUserId(String userId);

    long deleteByProjectId(Long projectId);
}
