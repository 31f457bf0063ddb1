package io.github.yok.csvreconciler.config;

import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import lombok.ToString;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration class that manages the reporting database connection.<br>
 * Values are normally supplied through environment variables referenced from
 * {@code application.yml}.
 *
 * <pre>
 * connection:
 *   env: ${ENV:}
 *   host: ${POSTGRES_HOST:}
 *   port: ${POSTGRES_PORT:}
 *   database: ${POSTGRES_DB:}
 *   schema: ${POSTGRES_SCHEMA:}
 *   user: ${POSTGRES_USER:}
 *   password: ${POSTGRES_PASSWORD:}
 * </pre>
 *
 * <p>
 * When {@code url} is set it is used as is and {@code host}/{@code port}/{@code database} are
 * optional.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "connection")
@Data
public class ConnectionConfig {

    // Deployment environment name (e.g., "dev"), reported in the startup log
    private String env;

    // Database host name
    private String host;

    // Database port
    private String port;

    // Database name
    private String database;

    // Schema holding the raw, canonical and errors tables
    private String schema;

    // Database user name
    private String user;

    // Database password
    @ToString.Exclude
    private String password;

    // Explicit JDBC URL; overrides host/port/database when set
    private String url;

    // Fully qualified JDBC driver class name
    private String driverClass = "org.postgresql.Driver";

    // Dialect of the target database
    private DialectMode dialect = DialectMode.POSTGRESQL;

    /**
     * Returns the JDBC URL, either the explicit {@code url} or one composed from
     * {@code host}/{@code port}/{@code database}.
     *
     * @return JDBC URL
     */
    public String getJdbcUrl() {
        if (StringUtils.isNotBlank(url)) {
            return url;
        }
        return "jdbc:postgresql://" + host + ":" + port + "/" + database;
    }

    /**
     * Verifies that every required setting is present.
     *
     * <p>
     * Called once at startup, before any entity is processed.
     * </p>
     *
     * @throws IllegalStateException listing every missing setting
     */
    public void validate() {
        List<String> missing = new ArrayList<>();
        require(missing, env, "ENV (connection.env)");
        require(missing, user, "POSTGRES_USER (connection.user)");
        require(missing, password, "POSTGRES_PASSWORD (connection.password)");
        require(missing, schema, "POSTGRES_SCHEMA (connection.schema)");
        if (StringUtils.isBlank(url)) {
            require(missing, database, "POSTGRES_DB (connection.database)");
            require(missing, host, "POSTGRES_HOST (connection.host)");
            require(missing, port, "POSTGRES_PORT (connection.port)");
        }
        if (!missing.isEmpty()) {
            throw new IllegalStateException(
                    "Missing required connection settings: " + String.join(", ", missing));
        }
    }

    private static void require(List<String> missing, String value, String key) {
        if (StringUtils.isBlank(value)) {
            missing.add(key);
        }
    }
}
