package khope.migration.checksum;

/**
 * 직렬화된 문자열에 대한 체크섬 함수
 * 구현체는 결정적이어야 한다 (같은 입력 → 같은 태그).
 */
public interface ChecksumStrategy {

    String algorithm();

    String hash(String data);
}
