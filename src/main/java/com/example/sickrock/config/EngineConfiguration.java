package com.example.sickrock.config;

import com.example.sickrock.dialect.MySqlDialect;
import com.example.sickrock.dialect.SqlDialect;
import com.example.sickrock.dialect.SqliteDialect;
import com.example.sickrock.model.ConnectionSettings;
import com.example.sickrock.service.MigrationRunner;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the connection pool and the dialect from {@link ConnectionSettings}: MySQL when a host is
 * configured, the SQLite file otherwise. Spring Boot's JDBC auto-configuration supplies the
 * templates and the transaction manager on top of this data source.
 */
@Configuration
@EnableConfigurationProperties({ConnectionSettings.class, EngineProperties.class})
public class EngineConfiguration {

    private static final Logger log = LoggerFactory.getLogger(EngineConfiguration.class);

    @Bean(destroyMethod = "close")
    public HikariDataSource dataSource(ConnectionSettings settings) {
        HikariConfig config = new HikariConfig();
        config.setPoolName("sickrock");
        config.setJdbcUrl(settings.jdbcUrl());
        config.setDriverClassName(settings.driverClassName());
        if (settings.useMySql()) {
            config.setUsername(settings.username());
            config.setPassword(settings.password());
        }
        config.setMaximumPoolSize(settings.maximumPoolSize());
        log.info("Connecting to {} ({})", settings.useMySql() ? "MySQL" : "SQLite", settings.withoutPassword().jdbcUrl());
        return new HikariDataSource(config);
    }

    @Bean
    public SqlDialect sqlDialect(ConnectionSettings settings) {
        return settings.useMySql() ? new MySqlDialect() : new SqliteDialect();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ApplicationRunner metadataMigrations(MigrationRunner migrationRunner) {
        return args -> migrationRunner.migrate();
    }
}
