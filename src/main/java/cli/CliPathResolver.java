package cli;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Path handling for the NL-to-SQL CLI.
 *
 * <p>Relative paths are resolved against the base directory, which comes from
 * {@code --baseDir}, then the {@value #PROP_BASE_DIR} system property, then the
 * working directory.</p>
 */
public final class CliPathResolver {

    public static final String PROP_BASE_DIR = "baseDir";

    private CliPathResolver() {}

    /**
     * Resolves the base directory and publishes it as a system property so
     * later lookups in the same JVM agree.
     */
    public static Path resolveBaseDir(Map<String, String> argv) {
        String raw = (argv == null) ? null : trimToNull(argv.get("baseDir"));
        if (raw == null) raw = trimToNull(System.getProperty(PROP_BASE_DIR));

        Path baseDir = (raw == null)
                ? Paths.get(System.getProperty("user.dir"))
                : againstUserDir(raw);
        baseDir = baseDir.toAbsolutePath().normalize();

        if (raw != null) System.setProperty(PROP_BASE_DIR, baseDir.toString());
        return baseDir;
    }

    /** null for a blank argument. */
    public static Path resolvePath(Path baseDir, String raw) {
        String t = trimToNull(raw);
        if (t == null) return null;

        Path p = Paths.get(t);
        if (!p.isAbsolute()) p = (baseDir == null) ? againstUserDir(t) : baseDir.resolve(p);
        return p.toAbsolutePath().normalize();
    }

    public static Path resolvePathOrDefault(Path baseDir, String raw, String defaultPath) {
        Path p = resolvePath(baseDir, raw);
        return (p != null) ? p : resolvePath(baseDir, defaultPath);
    }

    private static Path againstUserDir(String raw) {
        Path p = Paths.get(raw);
        if (p.isAbsolute()) return p;
        return Paths.get(System.getProperty("user.dir")).resolve(p);
    }

    /**
     * Input files must exist and be regular files.
     */
    public static void requireRegularFile(Path p, String label) {
        if (p == null) throw new IllegalArgumentException(label + " is null");
        if (!Files.exists(p)) throw new IllegalArgumentException(label + " not found: " + p);
        if (!Files.isRegularFile(p)) throw new IllegalArgumentException(label + " is not a file: " + p);
    }

    public static void ensureDir(Path dir) {
        if (dir == null) return;
        try {
            Files.createDirectories(dir);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to create directory: " + dir, e);
        }
    }

    public static void ensureParentDir(Path file) {
        if (file == null) return;
        ensureDir(file.toAbsolutePath().normalize().getParent());
    }

    public static String trimToNull(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }
}
