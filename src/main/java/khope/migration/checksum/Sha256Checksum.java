package khope.migration.checksum;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * 변조 감지가 필요한 환경용 SHA-256 체크섬
 */
public class Sha256Checksum implements ChecksumStrategy {

    public static final String ALGORITHM = "sha256";

    @Override
    public String algorithm() {
        return ALGORITHM;
    }

    @Override
    public String hash(String data) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(data.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256을 사용할 수 없습니다", e);
        }
    }
}
