package khope.migration.repository;

import khope.migration.domain.Project;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ProjectRepository extends JpaRepository<Project, Long> {

    List<Project> findByUserIdOrderByCreatedDesc(String userId);

    List<Project> findByUserIdAndMigrationId(String userId, String migrationId);

    List<Project> findByIsPublicTrueOrderByCreatedDesc(Pageable pageable);
}
