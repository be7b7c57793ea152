package cli;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class CliPathResolverTest {

    @TempDir
    Path tempDir;

    @Test
    void should_resolve_relative_path_against_base_dir() {
        assertEquals(tempDir.resolve("in").resolve("q.csv").toAbsolutePath().normalize(),
                CliPathResolver.resolvePath(tempDir, "in/q.csv"));
        assertNull(CliPathResolver.resolvePath(tempDir, "  "));
    }

    @Test
    void should_keep_absolute_path_and_apply_default() {
        Path abs = tempDir.resolve("abs.xlsx").toAbsolutePath();
        assertEquals(abs.normalize(), CliPathResolver.resolvePath(Path.of("/elsewhere"), abs.toString()));
        assertEquals(tempDir.resolve("output/sql").toAbsolutePath().normalize(),
                CliPathResolver.resolvePathOrDefault(tempDir, null, "output/sql"));
    }

    @Test
    void should_require_existing_regular_file() throws Exception {
        Path file = Files.writeString(tempDir.resolve("q.csv"), "query\n");
        CliPathResolver.requireRegularFile(file, "input");

        assertThrows(IllegalArgumentException.class,
                () -> CliPathResolver.requireRegularFile(tempDir.resolve("missing.csv"), "input"));
        assertThrows(IllegalArgumentException.class,
                () -> CliPathResolver.requireRegularFile(tempDir, "input"));
    }

    @Test
    void should_create_parent_directories() {
        Path file = tempDir.resolve("a").resolve("b").resolve("result.xlsx");
        CliPathResolver.ensureParentDir(file);
        assertTrue(Files.isDirectory(file.getParent()));
        assertFalse(Files.exists(file));
    }
}
