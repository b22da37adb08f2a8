package khope.migration.repository;

import khope.migration.domain.Profile;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface ProfileRepository extends JpaRepository<Profile, Long> {

    Optional<Profile> findByUserId(String userId);

    boolean existsByUserId(String userId);

    /**
     * 본인 레코드를 제외한 username 중복 여부
     */
    boolean existsByUsernameAndUserIdNot(String username, String userId);

    Optional<Profile> findByUserIdAndMigrationId(String userId, String migrationId);
}
