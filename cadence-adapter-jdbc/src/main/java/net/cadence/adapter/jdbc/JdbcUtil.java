package net.cadence.adapter.jdbc;

import java.nio.charset.StandardCharsets;
import java.sql.Timestamp;
import java.time.Instant;

public final class JdbcUtil {
    private JdbcUtil() {}

    /** ERROR_MESSAGE 컬럼 한도(UTF-8 바이트). Oracle VARCHAR2 최대 4000 bytes */
    public static final int MAX_MESSAGE_BYTES = 4000;

    public static Timestamp ts(Instant i) { return i == null ? null : Timestamp.from(i); }

    public static Instant toInstant(Timestamp ts) { return ts == null ? null : ts.toInstant(); }

    // CHAR(1) 플래그
    public static String yn(boolean b) { return b ? "Y" : "N"; }

    public static boolean isY(String s) { return "Y".equals(s); }

    /** ERROR_MESSAGE 에 맞게 UTF-8 바이트 기준으로 자름. 코드포인트(서로게이트 쌍) 중간은 자르지 않음 */
    public static String clip(String s) {
        if (s == null || s.length() * 3 <= MAX_MESSAGE_BYTES) return s;
        if (s.getBytes(StandardCharsets.UTF_8).length <= MAX_MESSAGE_BYTES) return s;
        int bytes = 0;
        int end = 0;
        while (end < s.length()) {
            int cp = s.codePointAt(end);
            int size = utf8Length(cp);
            if (bytes + size > MAX_MESSAGE_BYTES) break;
            bytes += size;
            end += Character.charCount(cp);
        }
        return s.substring(0, end);
    }

    private static int utf8Length(int cp) {
        if (cp < 0x80) return 1;
        if (cp < 0x800) return 2;
        if (cp < 0x10000) return 3;
        return 4;
    }
}
