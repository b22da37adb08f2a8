package khope.migration.domain;

import jakarta.persistence.*;
import lombok.*;

import java.io.Serializable;
import java.time.Instant;

/**
 * 프로젝트 워크스페이스 문서의 무결성 레코드
 * 저장 매체와 무관하게 손상/잘림을 재검증할 수 있도록 크기와 체크섬을 함께 보관한다.
 */
@Entity
@Table(name = "project_files")
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class ProjectFile implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final String WORKSPACE_FILENAME = "workspace.xml";
    public static final String WORKSPACE_CONTENT_TYPE = "application/xml";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long projectId;

    @Column(nullable = false)
    private String userId;

    @Column(nullable = false)
    private String filename;

    @Column(nullable = false)
    private String contentType;

    /**
     * 바이트 크기 (UTF-8)
     */
    @Column(nullable = false)
    private Long size;

    @Column(nullable = false)
    private String checksum;

    @Column(nullable = false)
    private String storageRef;

    @Column(nullable = false)
    private Instant uploadedAt;
}
