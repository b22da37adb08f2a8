package khope.migration.repository;

import khope.migration.domain.Settings;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface SettingsRepository extends JpaRepository<Settings, Long> {

    Optional<Settings> findByUserId(String userId);

    boolean existsByUserId(String userId);

    Optional<Settings> findByUserIdAndMigrationId(String userId, String migrationId);
}
