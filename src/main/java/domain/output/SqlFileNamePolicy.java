package domain.output;

import java.util.Locale;

/**
 * File naming policy for generated SQL.
 * <p>
 * &lt;outDir&gt;/&lt;queryId&gt;/&lt;segmentNo&gt;_&lt;statementNo&gt;.sql
 * e.g. q007/2_1.sql  (second question, first statement)
 * <p>
 * NOTE:
 * - segmentNo, statementNo are 1-based
 * - queryId 폴더명은 파일명 안전 문자만 남김 (그 외는 '_')
 */
public final class SqlFileNamePolicy {

    private SqlFileNamePolicy() {
    }

    /**
     * Build output filename: &lt;segmentNo&gt;_&lt;statementNo&gt;.sql
     */
    public static String build(int segmentNo, int statementNo) {
        if (segmentNo < 1) throw new IllegalArgumentException("segmentNo must be >= 1: " + segmentNo);
        if (statementNo < 1) throw new IllegalArgumentException("statementNo must be >= 1: " + statementNo);
        return segmentNo + "_" + statementNo + ".sql";
    }

    /**
     * Query folder name. Blank ids become "unknownQuery".
     */
    public static String queryDirName(String queryId) {
        String s = safePart(queryId, "unknownQuery");
        return limit(s, 120);
    }

    private static String safePart(String raw, String fallback) {
        String s = (raw == null) ? "" : raw.trim();
        if (s.isEmpty()) s = fallback;
        s = s.replace('\n', '_')
                .replace('\r', '_');

        // Keep only filename-safe characters.
        s = s.replaceAll("[^a-zA-Z0-9._-]", "_");

        // avoid hidden/odd files on Windows
        if (s.startsWith(".")) s = "_" + s.substring(1);

        // windows reserved names
        String u = s.toUpperCase(Locale.ROOT);
        if (u.equals("CON") || u.equals("PRN") || u.equals("AUX") || u.equals("NUL")
                || u.matches("COM[1-9]") || u.matches("LPT[1-9]")) {
            s = "_" + s;
        }
        return s;
    }

    private static String limit(String s, int max) {
        if (s == null) return "";
        if (s.length() <= max) return s;
        return s.substring(0, max);
    }
}
