package com.jonathantong.WalShift.config;

import java.net.URI;

/**
 * Connection coordinates of one PostgreSQL database.
 * <p>
 * The JDBC URL feeds the connection pool; host, port and database feed the
 * pg_dump / pg_restore command lines.
 */
public class PostgresEndpoint {

    private static final int DEFAULT_PORT = 5432;

    private final String jdbcUrl;
    private final String host;
    private final int port;
    private final String database;
    private final String username;
    private final String password;

    public PostgresEndpoint(String jdbcUrl, String host, int port, String database, String username, String password) {
        this.jdbcUrl = jdbcUrl;
        this.host = host;
        this.port = port;
        this.database = database;
        this.username = username;
        this.password = password;
    }

    /**
     * Parse a jdbc:postgresql://host[:port]/database[?params] URL
     */
    public static PostgresEndpoint fromJdbcUrl(String jdbcUrl, String username, String password) {
        if (jdbcUrl == null || !jdbcUrl.startsWith("jdbc:postgresql://")) {
            throw new IllegalArgumentException("Not a PostgreSQL JDBC URL: " + jdbcUrl);
        }
        URI uri = URI.create(jdbcUrl.substring("jdbc:".length()));
        String path = uri.getPath();
        if (uri.getHost() == null || path == null || path.length() <= 1) {
            throw new IllegalArgumentException("JDBC URL must name a host and a database: " + jdbcUrl);
        }
        int port = uri.getPort() > 0 ? uri.getPort() : DEFAULT_PORT;
        return new PostgresEndpoint(jdbcUrl, uri.getHost(), port, path.substring(1), username, password);
    }

    /**
     * Same server, different database. Used to reach the maintenance database
     * while the replica database is dropped and recreated.
     */
    public PostgresEndpoint withDatabase(String otherDatabase) {
        String url = "jdbc:postgresql://" + host + ":" + port + "/" + otherDatabase;
        return new PostgresEndpoint(url, host, port, otherDatabase, username, password);
    }

    public String getJdbcUrl() { return jdbcUrl; }
    public String getHost() { return host; }
    public int getPort() { return port; }
    public String getDatabase() { return database; }
    public String getUsername() { return username; }
    public String getPassword() { return password; }

    @Override
    public String toString() {
        return "PostgresEndpoint{" + host + ":" + port + "/" + database + '}';
    }
}
