package khope.migration.domain;

import jakarta.persistence.*;
import lombok.*;

import java.io.Serializable;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * 유저 설정
 * 유저당 정확히 하나. 레코드가 없으면 기본값이 암묵적으로 적용되며 첫 쓰기 전까지 저장하지 않는다.
 */
@Entity
@Table(name = "settings")
@Getter
@Setter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Settings implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final String DEFAULT_LANGUAGE = "en";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, updatable = false)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Builder.Default
    @Column(nullable = false)
    private BoardType boardType = BoardType.DEFAULT;

    @Enumerated(EnumType.STRING)
    @Builder.Default
    @Column(nullable = false)
    private Theme theme = Theme.DEFAULT;

    @Builder.Default
    @Column(nullable = false, length = 16)
    private String language = DEFAULT_LANGUAGE;

    @Builder.Default
    @Column(nullable = false)
    private Boolean autoSave = true;

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "settings_tutorial", joinColumns = @JoinColumn(name = "settings_id"))
    @MapKeyColumn(name = "step")
    @Column(name = "completed")
    private Map<String, Boolean> tutorialCompleted = new HashMap<>();

    private Instant updated;

    private String migrationId;

    /**
     * 저장되지 않은 기본 설정
     */
    public static Settings defaultsFor(String userId) {
        return Settings.builder()
                .userId(userId)
                .updated(Instant.now())
                .build();
    }

    public Settings copy() {
        return toBuilder()
                .tutorialCompleted(new HashMap<>(tutorialCompleted))
                .build();
    }

    @PrePersist
    @PreUpdate
    protected void touch() {
        updated = Instant.now();
    }
}
