package khope.migration.domain;

import jakarta.persistence.*;
import lombok.*;

import java.io.Serializable;
import java.time.Instant;

/**
 * 유저 프로필 (신규 저장소)
 */
@Entity
@Table(name = "profiles")
@Getter
@Setter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Profile implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final int BIO_MAX_LENGTH = 500;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, updatable = false)
    private String userId;

    @Column(nullable = false)
    private String email;

    @Column(nullable = false)
    private String name;

    private String profileImage;

    @Column(unique = true)
    private String username;

    @Column(length = BIO_MAX_LENGTH)
    private String bio;

    private String location;

    private String website;

    @Builder.Default
    @Column(nullable = false)
    private Boolean isPublic = false;

    private Instant lastLogin;

    @Column(updatable = false)
    private Instant created;

    private Instant updated;

    /**
     * 이 레코드를 만든 마이그레이션 ID (롤백 추적용, 직접 생성 시 null)
     */
    private String migrationId;

    /**
     * 캐시 보관용 분리 사본
     */
    public Profile copy() {
        return toBuilder().build();
    }

    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        if (created == null) {
            created = now;
        }
        if (lastLogin == null) {
            lastLogin = now;
        }
        updated = now;
    }

    @PreUpdate
    protected void onUpdate() {
        updated = Instant.now();
    }
}
