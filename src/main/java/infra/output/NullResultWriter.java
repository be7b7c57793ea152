package infra.output;

import domain.output.ResultWriter;
import domain.pipeline.QueryRun;

import java.nio.file.Path;
import java.util.List;

/**
 * No-op implementation (--noResult).
 */
public final class NullResultWriter implements ResultWriter {
    @Override
    public void write(Path resultXlsx, List<QueryRun> runs) {
        // report disabled
    }
}
