package khope.migration.migration.dto;

import khope.migration.domain.MigrationRecord;
import khope.migration.domain.MigrationStatus;

import java.time.Instant;
import java.util.List;

/**
 * checkMigrationStatus 응답
 */
public record MigrationStatusView(
        String userId,
        String migrationId,
        MigrationStatus status,
        boolean migrated,
        int migratedCount,
        int errorCount,
        List<String> errors,
        String checksum,
        Instant startedAt,
        Instant migratedAt
) {

    public static MigrationStatusView from(MigrationRecord record) {
        return new MigrationStatusView(
                record.getUserId(),
                record.getMigrationId(),
                record.getStatus(),
                record.getStatus() == MigrationStatus.COMPLETED,
                record.getMigratedCount(),
                record.getErrorCount(),
                List.copyOf(record.getErrors()),
                record.getChecksum(),
                record.getStartedAt(),
                record.getCompletedAt()
        );
    }
}
