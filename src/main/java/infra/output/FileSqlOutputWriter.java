package infra.output;

import domain.output.SqlFileNamePolicy;
import domain.output.SqlOutputWriter;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * {@link SqlOutputWriter} that stores generated SQL into files.
 * <p>
 * Output layout:
 * &lt;outDir&gt;/&lt;queryId&gt;/&lt;segmentNo&gt;_&lt;statementNo&gt;.sql
 */
public final class FileSqlOutputWriter implements SqlOutputWriter {

    @Override
    public void write(Path outDir, String queryId, int segmentNo, int statementNo, String sqlText) {
        if (outDir == null) throw new IllegalArgumentException("outDir is null");

        Path targetDir = outDir.resolve(SqlFileNamePolicy.queryDirName(queryId));
        Path file = targetDir.resolve(SqlFileNamePolicy.build(segmentNo, statementNo));

        try {
            Files.createDirectories(targetDir);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to create output directory: " + targetDir, e);
        }

        String text = sqlText == null ? "" : sqlText;
        if (!text.endsWith("\n")) text = text + "\n";
        try {
            Files.writeString(file, text, StandardCharsets.UTF_8);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to write sql file: " + file, e);
        }
    }
}
