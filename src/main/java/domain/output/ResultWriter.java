package domain.output;

import java.nio.file.Path;
import java.util.List;

import domain.pipeline.QueryRun;

/** 처리 결과 리포트를 저장하는 책임. */
public interface ResultWriter {

    void write(Path resultXlsx, List<QueryRun> runs);
}
