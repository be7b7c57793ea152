package domain.exec;

import domain.translate.StockSql;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Outcome of running one statement: rows, or the failure message.
 */
public final class StatementExecution {

    private final StockSql sql;
    private final List<Map<String, Object>> rows;
    private final String error;
    private final long elapsedMs;

    private StatementExecution(StockSql sql, List<Map<String, Object>> rows, String error, long elapsedMs) {
        this.sql = sql;
        this.rows = rows;
        this.error = error;
        this.elapsedMs = elapsedMs;
    }

    public static StatementExecution rows(StockSql sql, List<Map<String, Object>> rows, long elapsedMs) {
        List<Map<String, Object>> copy = rows == null ? List.of() : rows.stream()
                .map(r -> Collections.unmodifiableMap(new LinkedHashMap<>(r)))
                .collect(Collectors.toUnmodifiableList());
        return new StatementExecution(sql, copy, null, elapsedMs);
    }

    public static StatementExecution failed(StockSql sql, String error, long elapsedMs) {
        return new StatementExecution(sql, List.of(), error == null || error.isBlank() ? "execution failed" : error, elapsedMs);
    }

    public StockSql getSql() {
        return sql;
    }

    public boolean isSuccess() {
        return error == null;
    }

    public List<Map<String, Object>> getRows() {
        return rows;
    }

    /**
     * @return failure message, null on success
     */
    public String getError() {
        return error;
    }

    public long getElapsedMs() {
        return elapsedMs;
    }
}
