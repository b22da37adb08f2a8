package khope.migration.checksum;

/**
 * 32비트 롤링 해시 (h * 31 + c)
 *
 * 손상/잘림 감지용이며 충돌 저항성은 없다.
 * UTF-16 코드 유닛 단위로 계산하므로 기존 클라이언트가 만든 태그와 동일한 값이 나온다.
 */
public class RollingHashChecksum implements ChecksumStrategy {

    public static final String ALGORITHM = "rolling-hash-32";

    @Override
    public String algorithm() {
        return ALGORITHM;
    }

    @Override
    public String hash(String data) {
        int hash = 0;
        for (int i = 0; i < data.length(); i++) {
            hash = ((hash << 5) - hash) + data.charAt(i);
        }
        // Integer.MIN_VALUE도 양수로 표현되도록 long으로 확장
        return Long.toHexString(Math.abs((long) hash));
    }
}
