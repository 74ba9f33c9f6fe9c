package com.jonathantong.WalShift.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;

/**
 * Database configuration for source, target and target-admin PostgreSQL connections
 */
@Configuration
public class DatabaseConfig {

    // Source Database Configuration
    @Value("${walshift.source.db.url:jdbc:postgresql://localhost:5432/source_db}")
    private String sourceDbUrl;

    @Value("${walshift.source.db.username:postgres}")
    private String sourceDbUsername;

    @Value("${walshift.source.db.password:password}")
    private String sourceDbPassword;

    // Target Database Configuration
    @Value("${walshift.target.db.url:jdbc:postgresql://localhost:5433/source_db}")
    private String targetDbUrl;

    @Value("${walshift.target.db.username:postgres}")
    private String targetDbUsername;

    @Value("${walshift.target.db.password:password}")
    private String targetDbPassword;

    // Maintenance database on the target server, used while the replica database is recreated
    @Value("${walshift.target.db.admin-database:postgres}")
    private String targetAdminDatabase;

    @Bean(name = "sourceEndpoint")
    public PostgresEndpoint sourceEndpoint() {
        return PostgresEndpoint.fromJdbcUrl(sourceDbUrl, sourceDbUsername, sourceDbPassword);
    }

    @Bean(name = "targetEndpoint")
    public PostgresEndpoint targetEndpoint() {
        return PostgresEndpoint.fromJdbcUrl(targetDbUrl, targetDbUsername, targetDbPassword);
    }

    @Bean(name = "targetAdminEndpoint")
    public PostgresEndpoint targetAdminEndpoint() {
        return targetEndpoint().withDatabase(targetAdminDatabase);
    }

    /**
     * Source database DataSource. Used for the replication slot, readiness and verification only.
     */
    @Bean(name = "sourceDataSource")
    public DataSource sourceDataSource() {
        return new HikariDataSource(poolConfig(sourceEndpoint(), "SourceDB-Pool", 5, 1));
    }

    /**
     * Target database DataSource. Every consumer thread writes through this pool.
     * No idle minimum: the replica database is dropped and recreated before first use.
     */
    @Bean(name = "targetDataSource")
    @Primary
    public DataSource targetDataSource() {
        return new HikariDataSource(targetPoolConfig());
    }

    @Bean(name = "targetAdminDataSource")
    public DataSource targetAdminDataSource() {
        return new HikariDataSource(poolConfig(targetAdminEndpoint(), "TargetAdmin-Pool", 2, 0));
    }

    @Bean(name = "sourceJdbcTemplate")
    public JdbcTemplate sourceJdbcTemplate(@Qualifier("sourceDataSource") DataSource dataSource) {
        return new JdbcTemplate(dataSource);
    }

    @Bean(name = "targetJdbcTemplate")
    @Primary
    public JdbcTemplate targetJdbcTemplate(@Qualifier("targetDataSource") DataSource dataSource) {
        return new JdbcTemplate(dataSource);
    }

    @Bean(name = "targetAdminJdbcTemplate")
    public JdbcTemplate targetAdminJdbcTemplate(@Qualifier("targetAdminDataSource") DataSource dataSource) {
        return new JdbcTemplate(dataSource);
    }

    HikariConfig targetPoolConfig() {
        HikariConfig config = poolConfig(targetEndpoint(), "TargetDB-Pool", 20, 0);
        // Text values (ISO-8601 timestamps, decimals as strings, uuids) are sent untyped
        // and cast by the server to the column type instead of being rejected as varchar
        config.addDataSourceProperty("stringtype", "unspecified");
        return config;
    }

    static HikariConfig poolConfig(PostgresEndpoint endpoint, String poolName, int maxPoolSize, int minIdle) {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(endpoint.getJdbcUrl());
        config.setUsername(endpoint.getUsername());
        config.setPassword(endpoint.getPassword());
        config.setDriverClassName("org.postgresql.Driver");

        // Connection pool settings
        config.setMaximumPoolSize(maxPoolSize);
        config.setMinimumIdle(minIdle);
        config.setConnectionTimeout(30000);
        config.setIdleTimeout(600000);
        config.setMaxLifetime(1800000);

        // Readiness polling owns the wait for the server, so the pool must not fail at startup
        config.setInitializationFailTimeout(-1);

        // Connection validation
        config.setConnectionTestQuery("SELECT 1");
        config.setValidationTimeout(5000);

        config.setPoolName(poolName);

        return config;
    }
}
