package app;

import domain.correct.ErrorCorrector;
import domain.correct.Vocabulary;
import domain.exec.StockQueryExecutor;
import domain.lexer.TokenRules;
import domain.lexer.Tokenizer;
import domain.model.QueryRequest;
import domain.output.ResultWriter;
import domain.output.SqlOutputWriter;
import domain.parse.CompoundSplitter;
import domain.parse.GrammarParser;
import domain.parse.GrammarRules;
import domain.pipeline.PipelineOptions;
import domain.pipeline.QueryPipeline;
import domain.translate.ProductPredicateTable;
import domain.translate.SqlTranslator;
import infra.csv.ProductPredicateCsvLoader;
import infra.csv.QueryInputCsvLoader;
import infra.jdbc.ConnectionFactory;
import infra.jdbc.JdbcStockQueryExecutor;
import infra.output.FileSqlOutputWriter;
import infra.output.NullResultWriter;
import infra.output.NullSqlOutputWriter;
import infra.output.PipelineResultXlsxWriter;
import infra.output.XlsxResultWriter;

import java.nio.file.Path;
import java.util.List;

/**
 * Object-assembly factory for {@link NlSqlCliApp}.
 * <p>
 * Keeps the CLI app focused on orchestration/logging; object creation and
 * loading live here.
 */
final class NlSqlComponentsFactory {

    ProductPredicateTable createPredicateTable(Path predicatesCsv) {
        if (predicatesCsv == null) return ProductPredicateTable.defaults();
        return new ProductPredicateCsvLoader().loadOnto(ProductPredicateTable.defaults(), predicatesCsv);
    }

    ErrorCorrector createCorrector(double cutoff) {
        return new ErrorCorrector(Vocabulary.defaults(), cutoff);
    }

    QueryPipeline createPipeline(ProductPredicateTable predicates, ErrorCorrector corrector, PipelineOptions options) {
        Tokenizer tokenizer = new Tokenizer(TokenRules.defaults());
        return new QueryPipeline(
                new CompoundSplitter(),
                new GrammarParser(tokenizer, GrammarRules.defaults()),
                corrector,
                new SqlTranslator(predicates),
                options
        );
    }

    StockQueryExecutor createExecutor(String jdbcUrl, String user, String password) {
        if (jdbcUrl == null || jdbcUrl.isBlank()) return null;
        return new JdbcStockQueryExecutor(ConnectionFactory.driverManager(jdbcUrl.trim(), user, password));
    }

    List<QueryRequest> loadRequests(Path inputCsv) {
        return new QueryInputCsvLoader().load(inputCsv);
    }

    SqlOutputWriter createSqlOutputWriter(boolean enable) {
        if (!enable) return new NullSqlOutputWriter();
        return new FileSqlOutputWriter();
    }

    ResultWriter createResultWriter(boolean enable) {
        if (!enable) return new NullResultWriter();
        return new XlsxResultWriter(new PipelineResultXlsxWriter());
    }
}
