package khope.migration.identity;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

import java.util.Optional;
import java.util.Set;

/**
 * 인증 게이트웨이가 주입한 헤더에서 호출자 정보를 읽는다.
 *
 * 게이트웨이가 토큰 검증을 마친 뒤 X-Auth-* 헤더를 채운다는 전제.
 * 관리자 권한은 migration.security.admin-subjects 목록으로 부여한다.
 */
@Slf4j
@Component
public class HeaderIdentityProvider implements IdentityProvider {

    public static final String SUBJECT_HEADER = "X-Auth-Subject";
    public static final String EMAIL_HEADER = "X-Auth-Email";
    public static final String NAME_HEADER = "X-Auth-Name";
    public static final String PICTURE_HEADER = "X-Auth-Picture";

    private final Set<String> adminSubjects;

    public HeaderIdentityProvider(
            @Value("${migration.security.admin-subjects:}") Set<String> adminSubjects) {
        this.adminSubjects = adminSubjects;
    }

    @Override
    public Optional<VerifiedIdentity> currentIdentity() {
        if (!(RequestContextHolder.getRequestAttributes() instanceof ServletRequestAttributes attributes)) {
            return Optional.empty();
        }

        HttpServletRequest request = attributes.getRequest();
        String subject = request.getHeader(SUBJECT_HEADER);
        if (!StringUtils.hasText(subject)) {
            log.debug("인증 헤더 없음 - uri: {}", request.getRequestURI());
            return Optional.empty();
        }

        return Optional.of(new VerifiedIdentity(
                subject,
                request.getHeader(EMAIL_HEADER),
                request.getHeader(NAME_HEADER),
                request.getHeader(PICTURE_HEADER),
                adminSubjects.contains(subject)
        ));
    }
}
