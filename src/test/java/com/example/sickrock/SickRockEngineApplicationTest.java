package com.example.sickrock;

import com.example.sickrock.config.EngineProperties;
import com.example.sickrock.dialect.SqlDialect;
import com.example.sickrock.dialect.SqliteDialect;
import com.example.sickrock.model.ColumnSpec;
import com.example.sickrock.model.EffectiveView;
import com.example.sickrock.model.Item;
import com.example.sickrock.model.ItemQuery;
import com.example.sickrock.model.SemanticType;
import com.example.sickrock.service.ItemService;
import com.example.sickrock.service.MigrationRunner;
import com.example.sickrock.service.SchemaMutationEngine;
import com.example.sickrock.service.ViewResolver;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = "sickrock.engine.lock-timeout=3s")
class SickRockEngineApplicationTest {

    @TempDir
    static Path dataDir;

    @DynamicPropertySource
    static void sqliteFile(DynamicPropertyRegistry registry) {
        registry.add("sickrock.database.host", () -> "");
        registry.add("sickrock.database.sqlite-path", () -> dataDir.resolve("context.db").toString());
    }

    @Autowired
    private SqlDialect dialect;

    @Autowired
    private EngineProperties properties;

    @Autowired
    private MigrationRunner migrationRunner;

    @Autowired
    private SchemaMutationEngine mutationEngine;

    @Autowired
    private ItemService itemService;

    @Autowired
    private ViewResolver viewResolver;

    @Test
    void contextWiresSqliteAndMigratesOnStartup() {
        assertThat(dialect).isInstanceOf(SqliteDialect.class);
        assertThat(properties.lockTimeout()).isEqualTo(Duration.ofSeconds(3));
        assertThat(properties.maxPageSize()).isEqualTo(1000);
        assertThat(migrationRunner.currentVersion()).isEqualTo(3);
    }

    @Test
    void tableToItemToView() {
        mutationEngine.createTable("tasks", "Tasks");
        mutationEngine.addColumn("tasks", ColumnSpec.nullable("title", SemanticType.TEXT));

        Item task = itemService.create("tasks", Map.of("title", "Write release notes"));
        EffectiveView view = viewResolver.getEffectiveView("tasks", null);

        assertThat(itemService.list("tasks", ItemQuery.all())).extracting(Item::id).containsExactly(task.id());
        assertThat(view.visibleColumnNames()).contains("title");
    }
}
