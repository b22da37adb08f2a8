package khope.migration.domain;

import jakarta.persistence.*;
import lombok.*;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 유저별 마이그레이션 상태 레코드
 *
 * 중복 마이그레이션 방지의 근거. 프로세스 메모리 플래그 대신 호출 시점마다 조회한다.
 * userId가 unique이므로 동시에 두 요청이 선점하면 하나는 제약 조건에서 실패한다.
 */
@Entity
@Table(name = "migration_records", indexes = {
        @Index(name = "idx_migration_records_status", columnList = "status")
})
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class MigrationRecord implements Serializable {

    private static final long serialVersionUID = 1L;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, updatable = false)
    private String userId;

    @Column(nullable = false)
    private String migrationId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private MigrationStatus status;

    @Builder.Default
    private int migratedCount = 0;

    @Builder.Default
    private int errorCount = 0;

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "migration_record_errors", joinColumns = @JoinColumn(name = "record_id"))
    @OrderColumn(name = "error_index")
    @Column(name = "error", length = 1000)
    private List<String> errors = new ArrayList<>();

    @Column(nullable = false)
    private String checksum;

    @Column(nullable = false)
    private Instant startedAt;

    private Instant completedAt;

    @Version
    private Long version;

    /**
     * 실패/롤백된 레코드를 새 마이그레이션으로 재선점
     */
    public void restart(String migrationId, String checksum) {
        this.migrationId = migrationId;
        this.checksum = checksum;
        this.status = MigrationStatus.PENDING;
        this.migratedCount = 0;
        this.errorCount = 0;
        this.errors.clear();
        this.startedAt = Instant.now();
        this.completedAt = null;
    }

    public void complete(int migratedCount, List<String> errors) {
        this.migratedCount = migratedCount;
        this.errorCount = errors.size();
        this.errors.clear();
        this.errors.addAll(errors);
        // 모든 섹션이 실패한 경우만 FAILED, 부분 성공은 COMPLETED
        this.status = (migratedCount == 0 && !errors.isEmpty())
                ? MigrationStatus.FAILED
                : MigrationStatus.COMPLETED;
        this.completedAt = Instant.now();
    }

    public void markRolledBack() {
        this.status = MigrationStatus.ROLLED_BACK;
        this.completedAt = Instant.now();
    }
}
