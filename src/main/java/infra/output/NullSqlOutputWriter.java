package infra.output;

import domain.output.SqlOutputWriter;

import java.nio.file.Path;

/**
 * No-op implementation (--noSqlOut).
 */
public final class NullSqlOutputWriter implements SqlOutputWriter {
    @Override
    public void write(Path outDir, String queryId, int segmentNo, int statementNo, String sqlText) {
        // sql output disabled
    }
}
