package domain.exec;

import domain.translate.StockSql;

import java.util.List;
import java.util.Map;

/**
 * Runs one generated statement against a stock store.
 *
 * <p>Implementations bind {@link StockSql#getParameters()} against
 * {@link StockSql#getTemplate()}; the rendered text is for display only.
 * Locking and pooling are the implementation's business.</p>
 */
@FunctionalInterface
public interface StockQueryExecutor {

    List<Map<String, Object>> execute(StockSql sql) throws StockQueryException;
}
