package khope.migration.repository;

import khope.migration.domain.MigrationRecord;
import khope.migration.domain.MigrationStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface MigrationRecordRepository extends JpaRepository<MigrationRecord, Long> {

    Optional<MigrationRecord> findByUserId(String userId);

    Optional<MigrationRecord> findByUserIdAndMigrationId(String userId, String migrationId);

    boolean existsByUserId(String userId);

    List<MigrationRecord> findByStatus(MigrationStatus status);
}
