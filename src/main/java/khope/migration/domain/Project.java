package khope.migration.domain;

import jakarta.persistence.*;
import lombok.*;

import java.io.Serializable;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 블록 에디터 프로젝트
 * workspace는 블록 워크스페이스 XML 문서
 */
@Entity
@Table(name = "projects")
@Getter
@Setter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Project implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final int NAME_MAX_LENGTH = 100;
    public static final String DEFAULT_NAME = "Untitled Project";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, updatable = false)
    private String userId;

    @Column(nullable = false, length = NAME_MAX_LENGTH)
    private String name;

    @Column(length = 2000)
    private String description;

    @Lob
    @Column(nullable = false)
    private String workspace;

    @Enumerated(EnumType.STRING)
    @Builder.Default
    @Column(nullable = false)
    private BoardType boardType = BoardType.DEFAULT;

    @Builder.Default
    @Column(nullable = false)
    private Boolean isPublic = false;

    @Builder.Default
    @Column(nullable = false)
    private Boolean canShare = false;

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "project_tags", joinColumns = @JoinColumn(name = "project_id"))
    @Column(name = "tag")
    private Set<String> tags = new LinkedHashSet<>();

    @Builder.Default
    @Column(nullable = false)
    private Long likes = 0L;

    @Builder.Default
    @Column(nullable = false)
    private Long views = 0L;

    /**
     * 레거시 저장소의 원본 ID (감사/롤백용)
     */
    private String legacyId;

    private String migrationId;

    @Column(updatable = false)
    private Instant created;

    private Instant updated;

    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        if (created == null) {
            created = now;
        }
        if (updated == null) {
            updated = now;
        }
    }

    public Project copy() {
        return toBuilder()
                .tags(new LinkedHashSet<>(tags))
                .build();
    }

    public void incrementViews() {
        this.views += 1;
    }
}
