package infra.csv;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Shared reading for the small header-first CSV inputs.
 *
 * <p>The first record is read as the header by hand (BOM stripped, names
 * normalized) instead of using commons-csv header mode, so odd headers
 * (BOM, blanks, case) still resolve.</p>
 */
final class CsvSupport {

    private CsvSupport() {
    }

    /** One data row: 1-based record number (header = 1) and cells by normalized header. */
    static final class CsvRow {
        final long lineNo;
        final Map<String, String> cells;

        CsvRow(long lineNo, Map<String, String> cells) {
            this.lineNo = lineNo;
            this.cells = cells;
        }

        String get(String header) {
            String v = cells.get(norm(header));
            return v == null ? "" : v;
        }

        boolean isBlank() {
            for (String v : cells.values()) {
                if (v != null && !v.isBlank()) return false;
            }
            return true;
        }
    }

    static List<CsvRow> read(Path csvPath, String kind, String... requiredHeaders) {
        if (csvPath == null) throw new IllegalArgumentException(kind + " csv path is null");
        if (!Files.exists(csvPath)) throw new IllegalArgumentException(kind + " csv not found: " + csvPath);

        List<String> headers = new ArrayList<>();
        List<CsvRow> out = new ArrayList<>();

        try (InputStream is = Files.newInputStream(csvPath);
             InputStreamReader reader = new InputStreamReader(is, StandardCharsets.UTF_8);
             CSVParser parser = CSVFormat.DEFAULT
                     .builder()
                     .setTrim(true)
                     .setIgnoreEmptyLines(true)
                     .build()
                     .parse(reader)) {

            Iterator<CSVRecord> it = parser.iterator();
            if (!it.hasNext()) return out;

            CSVRecord headerRec = it.next();
            for (int i = 0; i < headerRec.size(); i++) {
                String h = stripBom(safe(headerRec.get(i))).trim();
                if (h.isBlank()) h = "COL_" + (i + 1);
                headers.add(norm(h));
            }

            long row = 1;
            while (it.hasNext()) {
                CSVRecord rec = it.next();
                row++;
                Map<String, String> cells = new LinkedHashMap<>();
                for (int i = 0; i < headers.size(); i++) {
                    String v = i < rec.size() ? safe(rec.get(i)) : "";
                    cells.putIfAbsent(headers.get(i), v);
                }
                out.add(new CsvRow(row, cells));
            }
        } catch (Exception e) {
            throw new IllegalStateException("Failed to read " + kind + " csv: " + csvPath, e);
        }

        for (String required : requiredHeaders) {
            if (!headers.contains(norm(required))) {
                throw new IllegalArgumentException(kind + " csv missing required column '" + required + "': " + csvPath
                        + " (headers=" + headers + ")");
            }
        }
        return out;
    }

    static String norm(String s) {
        if (s == null) return "";
        return s.trim()
                .toLowerCase(Locale.ROOT)
                .replace(" ", "")
                .replace("_", "");
    }

    private static String stripBom(String s) {
        if (s == null || s.isEmpty()) return "";
        if (s.charAt(0) == '\uFEFF') return s.substring(1);
        return s;
    }

    private static String safe(String s) {
        return s == null ? "" : s;
    }
}
