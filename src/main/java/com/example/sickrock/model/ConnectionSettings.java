package com.example.sickrock.model;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Where the engine's data lives. A configured {@code host} selects MySQL; otherwise the SQLite file
 * at {@code sqlitePath} is used.
 */
@ConfigurationProperties(prefix = "sickrock.database")
public record ConnectionSettings(
        String host,
        @DefaultValue("3306") int port,
        String name,
        String username,
        String password,
        @DefaultValue("sickrock.db") String sqlitePath,
        @DefaultValue("5") int maximumPoolSize,
        @DefaultValue("5000") int busyTimeoutMillis
) {
    public static ConnectionSettings sqlite(String path) {
        return new ConnectionSettings(null, 3306, null, null, null, path, 5, 5000);
    }

    public boolean useMySql() {
        return host != null && !host.isBlank();
    }

    public String jdbcUrl() {
        if (useMySql()) {
            String base = "jdbc:mysql://" + host.trim() + ":" + port + "/" + (name == null ? "" : name);
            if (isLocalHost(host)) {
                return base + "?useSSL=false&allowPublicKeyRetrieval=true";
            }
            return base;
        }
        return "jdbc:sqlite:" + sqlitePath + "?journal_mode=WAL&busy_timeout=" + busyTimeoutMillis;
    }

    public String driverClassName() {
        return useMySql() ? "com.mysql.cj.jdbc.Driver" : "org.sqlite.JDBC";
    }

    public ConnectionSettings withoutPassword() {
        return new ConnectionSettings(host, port, name, username, "", sqlitePath, maximumPoolSize, busyTimeoutMillis);
    }

    private static boolean isLocalHost(String host) {
        String normalized = host.trim().toLowerCase();
        return normalized.equals("localhost")
                || normalized.equals("127.0.0.1")
                || normalized.equals("::1");
    }
}
