package infra.jdbc;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;

/**
 * Source of fresh JDBC connections. The caller closes what it gets.
 */
@FunctionalInterface
public interface ConnectionFactory {

    Connection open() throws SQLException;

    static ConnectionFactory driverManager(String url, String user, String password) {
        if (url == null || url.isBlank()) throw new IllegalArgumentException("jdbc url is blank");
        if (user == null || user.isEmpty()) {
            return () -> DriverManager.getConnection(url);
        }
        return () -> DriverManager.getConnection(url, user, password == null ? "" : password);
    }
}
