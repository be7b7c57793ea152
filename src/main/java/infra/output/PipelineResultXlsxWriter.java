package infra.output;

import domain.exec.StatementExecution;
import domain.model.Diagnostic;
import domain.pipeline.QueryRun;
import domain.pipeline.SegmentResult;
import domain.translate.StockSql;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * XLSX report writer.
 *
 * <p>Sheets:
 * <ul>
 *   <li>result: one row per question segment (PARSED/CORRECTED/FAILED)</li>
 *   <li>sql: one row per generated statement, with execution outcome if any</li>
 *   <li>diagnostics: non-fatal diagnostics (standard codes)</li>
 * </ul>
 */
public final class PipelineResultXlsxWriter {

    static final String STATUS_PARSED = "PARSED";
    static final String STATUS_CORRECTED = "CORRECTED";
    static final String STATUS_FAILED = "FAILED";

    private static void writeResultSheet(Workbook wb, List<QueryRun> runs) {
        Sheet sh = wb.createSheet("result");
        int r = 0;
        Row header = sh.createRow(r++);
        header.createCell(0)
                .setCellValue("queryId");
        header.createCell(1)
                .setCellValue("segmentNo");
        header.createCell(2)
                .setCellValue("status");
        header.createCell(3)
                .setCellValue("originalText");
        header.createCell(4)
                .setCellValue("correctedText");
        header.createCell(5)
                .setCellValue("suggestions");
        header.createCell(6)
                .setCellValue("astType");
        header.createCell(7)
                .setCellValue("statementCount");
        header.createCell(8)
                .setCellValue("error");

        for (QueryRun run : runs) {
            for (SegmentResult seg : run.getResult().getSegments()) {
                Row row = sh.createRow(r++);
                row.createCell(0)
                        .setCellValue(nullToEmpty(run.getQueryId()));
                row.createCell(1)
                        .setCellValue(seg.getIndex() + 1);
                row.createCell(2)
                        .setCellValue(status(seg));
                row.createCell(3)
                        .setCellValue(nullToEmpty(seg.getOriginalText()));
                row.createCell(4)
                        .setCellValue(nullToEmpty(seg.getCorrectedText()));
                row.createCell(5)
                        .setCellValue(formatSuggestions(seg.getSuggestions()));
                row.createCell(6)
                        .setCellValue(seg.isParsed() ? seg.getAst().getType().tag() : "");
                row.createCell(7)
                        .setCellValue(seg.getStatements().size());
                row.createCell(8)
                        .setCellValue(nullToEmpty(seg.getError()));
            }
        }
    }

    private static void writeSqlSheet(Workbook wb, List<QueryRun> runs) {
        Sheet sh = wb.createSheet("sql");
        int r = 0;
        Row header = sh.createRow(r++);
        header.createCell(0)
                .setCellValue("queryId");
        header.createCell(1)
                .setCellValue("segmentNo");
        header.createCell(2)
                .setCellValue("statementNo");
        header.createCell(3)
                .setCellValue("sql");
        header.createCell(4)
                .setCellValue("executed");
        header.createCell(5)
                .setCellValue("rowCount");
        header.createCell(6)
                .setCellValue("elapsedMs");
        header.createCell(7)
                .setCellValue("error");

        for (QueryRun run : runs) {
            for (SegmentResult seg : run.getResult().getSegments()) {
                List<StockSql> statements = seg.getStatements();
                List<StatementExecution> executions = seg.getExecutions();
                for (int i = 0; i < statements.size(); i++) {
                    StatementExecution ex = i < executions.size() ? executions.get(i) : null;
                    Row row = sh.createRow(r++);
                    row.createCell(0)
                            .setCellValue(nullToEmpty(run.getQueryId()));
                    row.createCell(1)
                            .setCellValue(seg.getIndex() + 1);
                    row.createCell(2)
                            .setCellValue(i + 1);
                    row.createCell(3)
                            .setCellValue(statements.get(i).render());
                    row.createCell(4)
                            .setCellValue(ex != null);
                    row.createCell(5)
                            .setCellValue(ex == null ? 0 : ex.getRows().size());
                    row.createCell(6)
                            .setCellValue(ex == null ? 0 : ex.getElapsedMs());
                    row.createCell(7)
                            .setCellValue(ex == null ? "" : nullToEmpty(ex.getError()));
                }
            }
        }
    }

    private static void writeDiagnosticsSheet(Workbook wb, List<QueryRun> runs) {
        Sheet sh = wb.createSheet("diagnostics");
        int r = 0;
        Row header = sh.createRow(r++);
        header.createCell(0)
                .setCellValue("queryId");
        header.createCell(1)
                .setCellValue("code");
        header.createCell(2)
                .setCellValue("segment");
        header.createCell(3)
                .setCellValue("position");
        header.createCell(4)
                .setCellValue("message");
        header.createCell(5)
                .setCellValue("detail");

        for (QueryRun run : runs) {
            for (Diagnostic d : run.getAllDiagnostics()) {
                Row row = sh.createRow(r++);
                row.createCell(0)
                        .setCellValue(nullToEmpty(run.getQueryId()));
                row.createCell(1)
                        .setCellValue(d.getCode().name());
                row.createCell(2)
                        .setCellValue(nullToEmpty(d.getSegment()));
                row.createCell(3)
                        .setCellValue(d.getPosition());
                row.createCell(4)
                        .setCellValue(nullToEmpty(d.getMessage()));
                row.createCell(5)
                        .setCellValue(nullToEmpty(d.getDetail()));
            }
        }
    }

    static String status(SegmentResult seg) {
        if (!seg.isParsed()) return STATUS_FAILED;
        return seg.getCorrectedText() == null ? STATUS_PARSED : STATUS_CORRECTED;
    }

    private static String formatSuggestions(Map<String, String> suggestions) {
        if (suggestions == null || suggestions.isEmpty()) return "";
        return suggestions.entrySet().stream()
                .map(e -> e.getKey() + "->" + e.getValue())
                .collect(Collectors.joining(", "));
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    public void write(Path resultXlsx, List<QueryRun> runs) {
        if (resultXlsx == null) throw new IllegalArgumentException("resultXlsx is null");
        if (runs == null) throw new IllegalArgumentException("runs is null");

        try {
            Path parent = resultXlsx.toAbsolutePath()
                    .normalize()
                    .getParent();
            if (parent != null) Files.createDirectories(parent);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to create resultXlsx parent dir: " + resultXlsx, e);
        }

        try (Workbook wb = new XSSFWorkbook()) {
            writeResultSheet(wb, runs);
            writeSqlSheet(wb, runs);
            writeDiagnosticsSheet(wb, runs);

            try (OutputStream os = Files.newOutputStream(resultXlsx)) {
                wb.write(os);
            }
        } catch (Exception e) {
            throw new IllegalStateException("Failed to write xlsx: " + resultXlsx, e);
        }
    }
}
