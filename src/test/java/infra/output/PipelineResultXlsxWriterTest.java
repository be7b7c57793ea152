package infra.output;

import domain.exec.StockQueryException;
import domain.model.Diagnostic;
import domain.model.DiagnosticCode;
import domain.model.QueryRequest;
import domain.pipeline.PipelineResult;
import domain.pipeline.QueryPipeline;
import domain.pipeline.QueryRun;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PipelineResultXlsxWriterTest {

    @TempDir
    Path tempDir;

    private final QueryPipeline pipeline = QueryPipeline.defaults();

    @Test
    void should_write_result_sql_and_diagnostics_sheets() throws Exception {
        PipelineResult first = pipeline.run("Sho all products ? what zzzz qqqq");
        PipelineResult second = pipeline.run("show low stock", sql -> {
            throw new StockQueryException("SQL Error: table not found", sql.render());
        });
        List<QueryRun> runs = List.of(
                new QueryRun(new QueryRequest("q1", first.getOriginalQuery()), first, 3),
                new QueryRun(new QueryRequest("q2", second.getOriginalQuery()), second, 4,
                        List.of(Diagnostic.of(DiagnosticCode.SLOW_QUERY, "show low stock", "slow")))
        );

        Path xlsx = tempDir.resolve("nested").resolve("result.xlsx");
        new PipelineResultXlsxWriter().write(xlsx, runs);
        assertTrue(Files.exists(xlsx));

        try (InputStream is = Files.newInputStream(xlsx);
             XSSFWorkbook wb = new XSSFWorkbook(is)) {

            Sheet result = wb.getSheet("result");
            assertNotNull(result);
            assertEquals("queryId", result.getRow(0).getCell(0).getStringCellValue());
            assertEquals(3, result.getLastRowNum());

            Row corrected = result.getRow(1);
            assertEquals("q1", corrected.getCell(0).getStringCellValue());
            assertEquals(1, (int) corrected.getCell(1).getNumericCellValue());
            assertEquals("CORRECTED", corrected.getCell(2).getStringCellValue());
            assertEquals("show all products", corrected.getCell(4).getStringCellValue());
            assertEquals("Sho->show", corrected.getCell(5).getStringCellValue());
            assertEquals("ListQuery", corrected.getCell(6).getStringCellValue());

            Row failed = result.getRow(2);
            assertEquals("FAILED", failed.getCell(2).getStringCellValue());
            assertEquals(0, (int) failed.getCell(7).getNumericCellValue());
            assertEquals("Could not parse query: what zzzz qqqq", failed.getCell(8).getStringCellValue());

            assertEquals("PARSED", result.getRow(3).getCell(2).getStringCellValue());

            Sheet sql = wb.getSheet("sql");
            assertEquals(2, sql.getLastRowNum());
            assertEquals("SELECT item_id, name, quantity FROM stock ORDER BY name;",
                    sql.getRow(1).getCell(3).getStringCellValue());
            assertFalse(sql.getRow(1).getCell(4).getBooleanCellValue());
            assertEquals("SELECT item_id, name, quantity FROM stock WHERE quantity <= 10 ORDER BY quantity;",
                    sql.getRow(2).getCell(3).getStringCellValue());
            assertTrue(sql.getRow(2).getCell(4).getBooleanCellValue());
            assertEquals("SQL Error: table not found", sql.getRow(2).getCell(7).getStringCellValue());

            Sheet diagnostics = wb.getSheet("diagnostics");
            boolean hasExecutionFailure = false;
            boolean hasSlowQuery = false;
            for (int i = 1; i <= diagnostics.getLastRowNum(); i++) {
                String code = diagnostics.getRow(i).getCell(1).getStringCellValue();
                if (code.equals("EXECUTION_FAILED")) hasExecutionFailure = true;
                if (code.equals("SLOW_QUERY")) hasSlowQuery = true;
            }
            assertTrue(hasExecutionFailure);
            assertTrue(hasSlowQuery);
        }
    }

    @Test
    void should_write_headers_only_for_empty_runs() throws Exception {
        Path xlsx = tempDir.resolve("empty.xlsx");
        new PipelineResultXlsxWriter().write(xlsx, List.of());

        try (InputStream is = Files.newInputStream(xlsx);
             XSSFWorkbook wb = new XSSFWorkbook(is)) {
            assertEquals(0, wb.getSheet("result").getLastRowNum());
            assertEquals(0, wb.getSheet("sql").getLastRowNum());
            assertEquals(0, wb.getSheet("diagnostics").getLastRowNum());
        }
    }

    @Test
    void should_reject_null_arguments() {
        PipelineResultXlsxWriter w = new PipelineResultXlsxWriter();
        assertThrows(IllegalArgumentException.class, () -> w.write(null, List.of()));
        assertThrows(IllegalArgumentException.class, () -> w.write(tempDir.resolve("x.xlsx"), null));
    }
}
