package infra.jdbc;

import domain.exec.StockQueryException;
import domain.exec.StockQueryExecutor;
import domain.translate.SqlTranslator;
import domain.translate.StockSql;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Executes generated statements over JDBC.
 *
 * <p>One connection per statement, closed before returning. Parameters are
 * bound with {@link PreparedStatement#setObject(int, Object)}; the rendered
 * literal text is never sent. Column labels become lowercase map keys.</p>
 */
public final class JdbcStockQueryExecutor implements StockQueryExecutor {

    private final ConnectionFactory connections;
    private final int maxRows;

    public JdbcStockQueryExecutor(ConnectionFactory connections) {
        this(connections, 0);
    }

    /**
     * @param maxRows row cap per statement, 0 = unlimited
     */
    public JdbcStockQueryExecutor(ConnectionFactory connections, int maxRows) {
        if (maxRows < 0) throw new IllegalArgumentException("maxRows must be >= 0: " + maxRows);
        this.connections = Objects.requireNonNull(connections, "connections");
        this.maxRows = maxRows;
    }

    @Override
    public List<Map<String, Object>> execute(StockSql sql) throws StockQueryException {
        if (sql == null) throw new IllegalArgumentException("sql is null");

        String template = sql.getTemplate();
        if (!SqlTranslator.isSafeSelect(template)) {
            throw new StockQueryException("refusing to execute non-SELECT statement", sql.render());
        }

        // some drivers reject a trailing ';' in prepared statements
        String statement = stripTerminator(template);

        try (Connection c = connections.open();
             PreparedStatement ps = c.prepareStatement(statement)) {
            if (maxRows > 0) ps.setMaxRows(maxRows);

            List<Object> params = sql.getParameters();
            for (int i = 0; i < params.size(); i++) {
                ps.setObject(i + 1, params.get(i));
            }

            try (ResultSet rs = ps.executeQuery()) {
                return readRows(rs);
            }
        } catch (SQLException e) {
            throw new StockQueryException("SQL Error: " + e.getMessage(), sql.render(), e);
        }
    }

    private static List<Map<String, Object>> readRows(ResultSet rs) throws SQLException {
        ResultSetMetaData md = rs.getMetaData();
        int cols = md.getColumnCount();
        String[] labels = new String[cols];
        for (int i = 0; i < cols; i++) {
            labels[i] = md.getColumnLabel(i + 1).toLowerCase(Locale.ROOT);
        }

        List<Map<String, Object>> out = new ArrayList<>();
        while (rs.next()) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 0; i < cols; i++) {
                row.put(labels[i], rs.getObject(i + 1));
            }
            out.add(row);
        }
        return out;
    }

    static String stripTerminator(String sql) {
        String s = sql.trim();
        while (s.endsWith(";")) s = s.substring(0, s.length() - 1).trim();
        return s;
    }
}
