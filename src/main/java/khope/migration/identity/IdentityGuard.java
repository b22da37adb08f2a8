package khope.migration.identity;

import khope.migration.exception.AuthorizationException;

/**
 * 변경 작업 전 호출자 검증
 * 모든 검사는 데이터에 접근하기 전에 실패한다.
 */
public final class IdentityGuard {

    private IdentityGuard() {
    }

    public static VerifiedIdentity requireIdentity(VerifiedIdentity caller) {
        if (caller == null || caller.subject() == null || caller.subject().isBlank()) {
            throw new AuthorizationException("Unauthorized");
        }
        return caller;
    }

    public static VerifiedIdentity requireOwner(VerifiedIdentity caller, String userId) {
        requireIdentity(caller);
        if (!caller.owns(userId)) {
            throw new AuthorizationException("Unauthorized: caller does not own user data " + userId);
        }
        return caller;
    }

    /**
     * 소유자 여부와 무관하게 관리자 권한만 확인한다.
     */
    public static VerifiedIdentity requireAdmin(VerifiedIdentity caller) {
        requireIdentity(caller);
        if (!caller.admin()) {
            throw new AuthorizationException("Unauthorized: Only admins can rollback migrations");
        }
        return caller;
    }
}
