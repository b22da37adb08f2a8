package khope.migration.domain;

/**
 * 블록 워크스페이스 XML 문서의 최소 구조 검사
 * 비어 있지 않고 루트 xml 여는/닫는 태그 쌍을 포함해야 한다.
 */
public final class WorkspaceDocument {

    public static final String EMPTY = "<xml></xml>";

    private static final String ROOT_OPEN = "<xml";
    private static final String ROOT_CLOSE = "</xml>";

    private WorkspaceDocument() {
    }

    public static boolean isValid(String content) {
        if (content == null || content.isBlank()) {
            return false;
        }
        int open = content.indexOf(ROOT_OPEN);
        int close = content.lastIndexOf(ROOT_CLOSE);
        return open >= 0 && close > open;
    }
}
