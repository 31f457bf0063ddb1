package io.github.yok.csvreconciler.db;

import io.github.yok.csvreconciler.config.ConnectionConfig;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * {@link ConnectionFactory} backed by {@link DriverManager}.
 *
 * <p>
 * When a driver class name is configured it is loaded once, explicitly; when it is blank JDBC 4
 * auto-loading is relied on.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class DriverManagerConnectionFactory implements ConnectionFactory {

    private final String url;
    private final String user;
    private final String password;

    /**
     * Creates a factory for the configured database.
     *
     * @param connectionConfig connection settings
     * @throws IllegalStateException if the configured driver class cannot be loaded
     */
    public DriverManagerConnectionFactory(ConnectionConfig connectionConfig) {
        this.url = connectionConfig.getJdbcUrl();
        this.user = connectionConfig.getUser();
        this.password = connectionConfig.getPassword();
        String driverClass = connectionConfig.getDriverClass();
        if (StringUtils.isNotBlank(driverClass)) {
            try {
                Class.forName(driverClass);
            } catch (ClassNotFoundException e) {
                throw new IllegalStateException("JDBC driver class not found: " + driverClass, e);
            }
        }
        log.info("Connection factory created for {}", url);
    }

    @Override
    public Connection open() throws SQLException {
        return DriverManager.getConnection(url, user, password);
    }
}
