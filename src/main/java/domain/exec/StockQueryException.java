package domain.exec;

/**
 * Failure of a single statement execution.
 */
public class StockQueryException extends Exception {

    private final String sql;

    public StockQueryException(String message, String sql) {
        super(message);
        this.sql = sql == null ? "" : sql;
    }

    public StockQueryException(String message, String sql, Throwable cause) {
        super(message, cause);
        this.sql = sql == null ? "" : sql;
    }

    public String getSql() {
        return sql;
    }
}
