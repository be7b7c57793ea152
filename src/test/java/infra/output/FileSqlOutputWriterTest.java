package infra.output;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class FileSqlOutputWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void should_write_sql_under_query_dir_with_segment_and_statement_name() throws Exception {
        FileSqlOutputWriter w = new FileSqlOutputWriter();

        Path out = tempDir.resolve("output");
        w.write(out, "q1", 2, 1, "SELECT item_id, name, quantity FROM stock ORDER BY name;");

        Path expected = out.resolve("q1").resolve("2_1.sql");
        assertTrue(Files.exists(expected), "expected file not found: " + expected);
        assertEquals("SELECT item_id, name, quantity FROM stock ORDER BY name;\n", Files.readString(expected));
    }

    @Test
    void should_overwrite_existing_file() throws Exception {
        FileSqlOutputWriter w = new FileSqlOutputWriter();
        w.write(tempDir, "q1", 1, 1, "SELECT 1 FROM stock;");
        w.write(tempDir, "q1", 1, 1, "SELECT 2 FROM stock;\n");

        assertEquals("SELECT 2 FROM stock;\n", Files.readString(tempDir.resolve("q1").resolve("1_1.sql")));
    }

    @Test
    void should_reject_null_out_dir() {
        assertThrows(IllegalArgumentException.class,
                () -> new FileSqlOutputWriter().write(null, "q1", 1, 1, "SELECT 1 FROM stock;"));
    }
}
