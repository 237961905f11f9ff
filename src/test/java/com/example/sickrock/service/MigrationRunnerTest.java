package com.example.sickrock.service;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MigrationRunnerTest {

    @TempDir
    Path tempDir;

    private SqliteEngineFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = new SqliteEngineFixture(tempDir);
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    private List<String> columnsOf(String table) {
        return fixture.jdbcTemplate.queryForList("SELECT name FROM pragma_table_info('" + table + "')", String.class);
    }

    @Test
    void migratesToLatestVersionOnce() {
        assertThat(fixture.migrationRunner.available())
                .extracting(MigrationRunner.Migration::version)
                .containsExactly(1, 2, 3);
        assertThat(fixture.migrationRunner.currentVersion()).isEqualTo(3);
        assertThat(fixture.migrationRunner.migrate()).isEmpty();
        assertThat(columnsOf("table_views")).contains("view_type");
    }

    @Test
    void rollbackRevertsNewerMigrations() {
        fixture.jdbcTemplate.update("INSERT INTO table_views (table_name, view_name, view_type) VALUES ('contacts', 'Main', 'calendar')");

        fixture.migrationRunner.rollbackTo(1);

        assertThat(fixture.migrationRunner.currentVersion()).isEqualTo(1);
        assertThat(columnsOf("table_views")).doesNotContain("view_type");
        assertThat(fixture.jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM sqlite_master WHERE type = 'table' AND name = 'table_foreign_keys'", Long.class)).isZero();
        assertThat(fixture.jdbcTemplate.queryForObject("SELECT view_name FROM table_views", String.class)).isEqualTo("Main");

        assertThat(fixture.migrationRunner.migrate()).containsExactly(2, 3);
        assertThat(fixture.jdbcTemplate.queryForObject("SELECT view_type FROM table_views", String.class)).isEqualTo("table");
    }
}
