package khope.migration.identity;

/**
 * 외부 인증 제공자가 검증한 호출자 정보
 *
 * @param subject    고유 사용자 ID (리소스 소유자 키)
 * @param email      이메일 (없을 수 있음)
 * @param name       표시 이름 (없을 수 있음)
 * @param pictureUrl 아바타 URL (없을 수 있음)
 * @param admin      롤백 등 관리자 전용 작업 권한
 */
public record VerifiedIdentity(
        String subject,
        String email,
        String name,
        String pictureUrl,
        boolean admin
) {

    /**
     * 시스템이 소유자 대신 작업할 때 사용하는 최소 신원
     * (백그라운드 마이그레이션 등)
     */
    public static VerifiedIdentity ofSubject(String subject) {
        return new VerifiedIdentity(subject, null, null, null, false);
    }

    public boolean owns(String userId) {
        return subject != null && subject.equals(userId);
    }
}
