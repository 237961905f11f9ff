package com.example.sickrock.service;

import com.example.sickrock.dialect.SqlDialect;
import com.example.sickrock.exception.FatalException;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.EncodedResource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.core.io.support.ResourcePatternResolver;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceUtils;
import org.springframework.jdbc.datasource.init.ScriptUtils;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Applies the versioned metadata scripts under {@code db/migration/<dialect>}. Scripts are named
 * {@code NNNN_name.up.sql} with an optional {@code NNNN_name.down.sql} that reverses them; applied
 * versions are recorded in {@code schema_migrations}.
 */
@Service
public class MigrationRunner {

    private static final Pattern SCRIPT_NAME = Pattern.compile("(\\d{4})_([a-z0-9_]+)\\.(up|down)\\.sql");
    private static final String HISTORY_TABLE = "schema_migrations";

    private final DataSource dataSource;
    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final SqlDialect dialect;
    private final SqlLogService logService;
    private final Clock clock;
    private final ResourcePatternResolver resolver = new PathMatchingResourcePatternResolver();

    public MigrationRunner(DataSource dataSource,
                           JdbcTemplate jdbcTemplate,
                           PlatformTransactionManager transactionManager,
                           SqlDialect dialect,
                           SqlLogService logService,
                           Clock clock) {
        this.dataSource = dataSource;
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.dialect = dialect;
        this.logService = logService;
        this.clock = clock;
    }

    public record Migration(int version, String name, Resource up, Resource down) {
    }

    public List<Migration> available() {
        String location = "classpath*:db/migration/" + dialect.kind().name().toLowerCase(Locale.ROOT) + "/*.sql";
        Map<Integer, Resource[]> scripts = new TreeMap<>();
        Map<Integer, String> names = new TreeMap<>();
        try {
            for (Resource resource : resolver.getResources(location)) {
                String filename = resource.getFilename();
                Matcher matcher = filename == null ? null : SCRIPT_NAME.matcher(filename);
                if (matcher == null || !matcher.matches()) {
                    continue;
                }
                int version = Integer.parseInt(matcher.group(1));
                names.put(version, matcher.group(2));
                Resource[] pair = scripts.computeIfAbsent(version, v -> new Resource[2]);
                pair["up".equals(matcher.group(3)) ? 0 : 1] = resource;
            }
        } catch (IOException ex) {
            throw new FatalException("migration", "Unable to list migration scripts at " + location, ex);
        }
        List<Migration> migrations = new ArrayList<>();
        scripts.forEach((version, pair) -> {
            if (pair[0] == null) {
                throw new FatalException("migration", "Migration " + version + " has no up script");
            }
            migrations.add(new Migration(version, names.get(version), pair[0], pair[1]));
        });
        return migrations;
    }

    public int currentVersion() {
        ensureHistoryTable();
        Integer version = jdbcTemplate.queryForObject("SELECT MAX(version) FROM " + HISTORY_TABLE, Integer.class);
        return version == null ? 0 : version;
    }

    /**
     * Applies every migration newer than the current version, each in its own transaction.
     *
     * @return the versions applied
     */
    public List<Integer> migrate() {
        int current = currentVersion();
        List<Integer> applied = new ArrayList<>();
        for (Migration migration : available()) {
            if (migration.version() <= current) {
                continue;
            }
            transactionTemplate.executeWithoutResult(status -> {
                runScript(migration.up());
                jdbcTemplate.update("INSERT INTO " + HISTORY_TABLE + " (version, name, applied_at) VALUES (?, ?, ?)",
                        migration.version(), migration.name(), dialect.timestampParameter(clock.instant()));
            });
            logService.logInfo("Applied migration " + migration.version() + " " + migration.name());
            applied.add(migration.version());
        }
        if (applied.isEmpty()) {
            logService.logInfo("Metadata schema is up to date at version " + current);
        }
        return applied;
    }

    /**
     * Reverts applied migrations newer than {@code version}, newest first.
     */
    public void rollbackTo(int version) {
        int current = currentVersion();
        List<Migration> toRevert = available().stream()
                .filter(m -> m.version() > version && m.version() <= current)
                .sorted(Comparator.comparingInt(Migration::version).reversed())
                .toList();
        for (Migration migration : toRevert) {
            if (migration.down() == null) {
                throw new FatalException("migration", "Migration " + migration.version() + " cannot be reverted");
            }
            transactionTemplate.executeWithoutResult(status -> {
                runScript(migration.down());
                jdbcTemplate.update("DELETE FROM " + HISTORY_TABLE + " WHERE version = ?", migration.version());
            });
            logService.logInfo("Reverted migration " + migration.version() + " " + migration.name());
        }
    }

    private void ensureHistoryTable() {
        String sql = "CREATE TABLE IF NOT EXISTS " + HISTORY_TABLE + " ("
                + "version INTEGER NOT NULL PRIMARY KEY, "
                + "name VARCHAR(191) NOT NULL, "
                + "applied_at DATETIME NOT NULL)";
        jdbcTemplate.execute(sql);
    }

    private void runScript(Resource script) {
        logService.logOperation("-- script " + script.getFilename());
        Connection conn = DataSourceUtils.getConnection(dataSource);
        try {
            ScriptUtils.executeSqlScript(conn, new EncodedResource(script, StandardCharsets.UTF_8));
        } catch (DataAccessException ex) {
            logService.logError("<migration:" + script.getFilename() + ">", ex.getMessage());
            throw new FatalException("migration", "Migration script " + script.getFilename() + " failed", ex);
        } finally {
            DataSourceUtils.releaseConnection(conn, dataSource);
        }
    }
}
