package infra.output;

import java.nio.file.Path;

import java.util.List;

import domain.output.ResultWriter;

import domain.pipeline.QueryRun;

/** PipelineResultXlsxWriter 기반 XLSX 결과 출력 구현체. */
public final class XlsxResultWriter implements ResultWriter {

    private final PipelineResultXlsxWriter delegate;

    public XlsxResultWriter(PipelineResultXlsxWriter delegate) {
        this.delegate = delegate == null ? new PipelineResultXlsxWriter() : delegate;
    }

    @Override
    public void write(Path resultXlsx, List<QueryRun> runs) {
        delegate.write(resultXlsx, runs);
    }
}
