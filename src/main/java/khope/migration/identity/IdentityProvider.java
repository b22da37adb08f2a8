package khope.migration.identity;

import java.util.Optional;

/**
 * 현재 요청의 검증된 호출자 조회
 * 인증 자체는 외부 제공자의 책임이며, 여기서는 결과만 소비한다.
 */
public interface IdentityProvider {

    Optional<VerifiedIdentity> currentIdentity();
}
