package com.example.sickrock.service;

import com.example.sickrock.config.EngineProperties;
import com.example.sickrock.exception.ConflictException;
import com.example.sickrock.exception.IntegrityException;
import com.example.sickrock.exception.NotFoundException;
import com.example.sickrock.exception.TransientException;
import com.example.sickrock.exception.ValidationException;
import com.example.sickrock.model.ColumnSpec;
import com.example.sickrock.model.ColumnVisibility;
import com.example.sickrock.model.DatabaseTableInfo;
import com.example.sickrock.model.ForeignKeyDeclaration;
import com.example.sickrock.model.Item;
import com.example.sickrock.model.ItemQuery;
import com.example.sickrock.model.SemanticType;
import com.example.sickrock.model.TableConfiguration;
import com.example.sickrock.model.TableStructure;
import com.example.sickrock.model.TableView;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.spy;

class SchemaMutationEngineTest {

    @TempDir
    Path tempDir;

    private SqliteEngineFixture fixture;
    private SchemaMutationEngine engine;
    private ItemService items;

    @BeforeEach
    void setUp() {
        fixture = new SqliteEngineFixture(tempDir);
        engine = fixture.mutationEngine();
        items = fixture.itemService();
        engine.createTable("contacts", "Contacts");
        engine.addColumn("contacts", ColumnSpec.nullable("name", SemanticType.TEXT));
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    private TableStructure structure(String table) {
        return fixture.introspector.getTableStructure(table);
    }

    @Nested
    class Tables {

        @Test
        void createTableAddsSystemColumnsAndConfiguration() {
            TableConfiguration created = engine.createTable("projects", "Projects");

            assertThat(created.id()).isNotNull();
            assertThat(structure("projects").columnNames())
                    .containsExactly(TableStructure.ID_COLUMN, TableStructure.CREATED_COLUMN, TableStructure.UPDATED_COLUMN);
            assertThat(fixture.metadataStore.getConfiguration("projects").title()).isEqualTo("Projects");
        }

        @Test
        void createTableRejectsDuplicatesAndBadNames() {
            assertThatThrownBy(() -> engine.createTable("contacts", "Again"))
                    .isInstanceOf(ConflictException.class);
            assertThatThrownBy(() -> engine.createTable("1contacts", null))
                    .isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> engine.createTable("_sr_shadow_contacts", null))
                    .isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> engine.createTable("table_views", null))
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        void createTableOnlyInConnectedDatabase() {
            TableConfiguration elsewhere = new TableConfiguration(null, "remote", null, 0, "otherdb", null, null);

            assertThatThrownBy(() -> engine.createTable(elsewhere))
                    .isInstanceOf(ValidationException.class)
                    .hasFieldOrPropertyWithValue("field", "db");
            assertThat(fixture.introspector.tableExists("remote")).isFalse();
        }

        @Test
        void renameTableMovesConfigurationViewsAndRows() {
            Item alice = items.create("contacts", Map.of("name", "Alice Johnson"));
            TableView view = fixture.metadataStore.createView(
                    TableView.of("contacts", "Main", List.of(ColumnVisibility.visible("name", 0))).asDefault(true));

            TableConfiguration renamed = engine.renameTable("contacts", "people");

            assertThat(renamed.name()).isEqualTo("people");
            assertThat(fixture.metadataStore.findConfiguration("contacts")).isEmpty();
            assertThat(fixture.introspector.tableExists("contacts")).isFalse();
            assertThat(fixture.metadataStore.getView(view.id()).tableName()).isEqualTo("people");
            assertThat(items.get("people", alice.id()).value("name")).isEqualTo("Alice Johnson");
        }

        @Test
        void renameTableRefusesExistingTarget() {
            engine.createTable("people", null);

            assertThatThrownBy(() -> engine.renameTable("contacts", "people"))
                    .isInstanceOf(ConflictException.class);
            assertThat(fixture.introspector.tableExists("contacts")).isTrue();
        }

        @Test
        void deleteTableRetainsPhysicalTableByDefault() {
            items.create("contacts", Map.of("name", "Alice"));

            engine.deleteTable("contacts");

            assertThat(fixture.metadataStore.findConfiguration("contacts")).isEmpty();
            assertThat(fixture.introspector.listDatabaseTables())
                    .contains(new DatabaseTableInfo("contacts", false, null));
            assertThatThrownBy(() -> items.get("contacts", 1)).isInstanceOf(NotFoundException.class);
        }

        @Test
        void deleteTableDropsWhenConfigured() throws IOException {
            SqliteEngineFixture dropping = new SqliteEngineFixture(Files.createDirectories(tempDir.resolve("drop")),
                    EngineProperties.defaults().withTableDeletionPolicy(EngineProperties.TableDeletionPolicy.DROP),
                    Clock.fixed(SqliteEngineFixture.NOW, ZoneOffset.UTC));
            try {
                SchemaMutationEngine droppingEngine = dropping.mutationEngine();
                droppingEngine.createTable("companies", null);
                droppingEngine.createTable("contacts", null);
                droppingEngine.addColumn("contacts", ColumnSpec.nullable("company_id", SemanticType.INTEGER));
                droppingEngine.createForeignKey("contacts", "company_id", "companies", "id");

                assertThatThrownBy(() -> droppingEngine.deleteTable("companies"))
                        .isInstanceOf(IntegrityException.class);

                droppingEngine.dropForeignKey("contacts", "company_id");
                droppingEngine.deleteTable("companies");

                assertThat(dropping.introspector.tableExists("companies")).isFalse();
                assertThat(dropping.metadataStore.findConfiguration("companies")).isEmpty();
            } finally {
                dropping.close();
            }
        }
    }

    @Nested
    class Columns {

        @Test
        void addRenameDropLeavesNoDanglingReferences() {
            engine.addColumn("contacts", ColumnSpec.nullable("email", SemanticType.TEXT));
            TableView view = fixture.metadataStore.createView(TableView.of("contacts", "Main",
                    List.of(ColumnVisibility.visible("email", 0), ColumnVisibility.visible("name", 1))));
            Item bob = items.create("contacts", Map.of("name", "Bob", "email", "bob@example.com"));

            engine.renameColumn("contacts", "email", "mail");

            assertThat(structure("contacts").hasColumn("email")).isFalse();
            assertThat(items.get("contacts", bob.id()).value("mail")).isEqualTo("bob@example.com");
            assertThat(fixture.metadataStore.getView(view.id()).columns())
                    .extracting(ColumnVisibility::columnName)
                    .containsExactly("mail", "name");

            engine.dropColumn("contacts", "mail");

            assertThat(structure("contacts").hasColumn("mail")).isFalse();
            assertThat(fixture.metadataStore.getView(view.id()).columns())
                    .extracting(ColumnVisibility::columnName)
                    .containsExactly("name");
            assertThat(items.get("contacts", bob.id()).value("name")).isEqualTo("Bob");
        }

        @Test
        void rebuildKeepsIdsAndSequence() {
            Item first = items.create("contacts", Map.of("name", "Alice"));
            Item second = items.create("contacts", Map.of("name", "Bob"));
            items.delete("contacts", second.id());

            engine.addColumn("contacts", ColumnSpec.nullable("email", SemanticType.TEXT));
            engine.dropColumn("contacts", "email");

            assertThat(items.get("contacts", first.id()).value("name")).isEqualTo("Alice");
            assertThat(items.create("contacts", Map.of("name", "Carol")).id()).isGreaterThan(second.id());
        }

        @Test
        void addColumnValidation() {
            items.create("contacts", Map.of("name", "Alice"));

            assertThatThrownBy(() -> engine.addColumn("contacts", ColumnSpec.nullable("name", SemanticType.TEXT)))
                    .isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> engine.addColumn("contacts", new ColumnSpec("code", SemanticType.TEXT, false, false)))
                    .isInstanceOf(ValidationException.class)
                    .hasFieldOrPropertyWithValue("field", "code");
            assertThatThrownBy(() -> engine.addColumn("contacts", ColumnSpec.nullable("bad-name", SemanticType.TEXT)))
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        void timestampColumnWithDefaultOnPopulatedTable() {
            Item alice = items.create("contacts", Map.of("name", "Alice"));

            engine.addColumn("contacts", new ColumnSpec("seen_at", SemanticType.TIMESTAMP, false, true));

            assertThat(structure("contacts").column("seen_at").orElseThrow().nullable()).isFalse();
            assertThat(items.get("contacts", alice.id()).value("seen_at")).isNotNull();
        }

        @Test
        void systemColumnsAreProtected() {
            assertThatThrownBy(() -> engine.dropColumn("contacts", "id"))
                    .isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> engine.renameColumn("contacts", "sr_created", "created"))
                    .isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> engine.changeColumnType("contacts", "sr_updated", SemanticType.TEXT))
                    .isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> engine.dropColumn("contacts", "missing"))
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        void changeColumnTypeConvertsRepresentableData() {
            engine.addColumn("contacts", ColumnSpec.nullable("age", SemanticType.TEXT));
            Item alice = items.create("contacts", Map.of("name", "Alice", "age", "42"));
            items.create("contacts", Map.of("name", "Bob"));

            TableStructure changed = engine.changeColumnType("contacts", "age", SemanticType.INTEGER);

            assertThat(changed.column("age").orElseThrow().valueType()).isEqualTo(SemanticType.INTEGER);
            assertThat(items.get("contacts", alice.id()).value("age")).isEqualTo(42L);
        }

        @Test
        void changeColumnTypeFailsClosedOnIncompatibleData() {
            engine.addColumn("contacts", ColumnSpec.nullable("age", SemanticType.TEXT));
            items.create("contacts", Map.of("name", "Alice", "age", "42"));
            Item bob = items.create("contacts", Map.of("name", "Bob", "age", "forty"));

            assertThatThrownBy(() -> engine.changeColumnType("contacts", "age", SemanticType.INTEGER))
                    .isInstanceOf(ValidationException.class)
                    .hasFieldOrPropertyWithValue("field", "age");

            assertThat(structure("contacts").column("age").orElseThrow().valueType()).isEqualTo(SemanticType.TEXT);
            assertThat(items.get("contacts", bob.id()).value("age")).isEqualTo("forty");
        }

        @Test
        void failedReconcileRollsBackTheRebuild() {
            engine.addColumn("contacts", ColumnSpec.nullable("email", SemanticType.TEXT));
            Item alice = items.create("contacts", Map.of("name", "Alice", "email", "alice@example.com"));
            MetadataStore failing = spy(fixture.metadataStore);
            doThrow(new IllegalStateException("metadata unavailable"))
                    .when(failing).removeColumnReferences(anyString(), anyString());
            SchemaMutationEngine failingEngine = fixture.mutationEngine(failing);

            assertThatThrownBy(() -> failingEngine.dropColumn("contacts", "email"))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessage("metadata unavailable");

            assertThat(structure("contacts").hasColumn("email")).isTrue();
            assertThat(items.get("contacts", alice.id()).value("email")).isEqualTo("alice@example.com");
            assertThat(fixture.introspector.listPhysicalTables()).containsExactly("contacts");
        }

        @Test
        void changeColumnTypeRefusesExponentTextForIntegers() {
            engine.addColumn("contacts", ColumnSpec.nullable("qty", SemanticType.TEXT));
            Item alice = items.create("contacts", Map.of("name", "Alice", "qty", "1e3"));

            assertThatThrownBy(() -> engine.changeColumnType("contacts", "qty", SemanticType.INTEGER))
                    .isInstanceOf(ValidationException.class)
                    .hasFieldOrPropertyWithValue("field", "qty");

            assertThat(structure("contacts").column("qty").orElseThrow().valueType()).isEqualTo(SemanticType.TEXT);
            assertThat(items.get("contacts", alice.id()).value("qty")).isEqualTo("1e3");
        }

        @Test
        void changeColumnTypeToDecimalKeepsEveryDigit() {
            engine.addColumn("contacts", ColumnSpec.nullable("balance", SemanticType.TEXT));
            Item alice = items.create("contacts", Map.of("name", "Alice", "balance", "12345678901234567890.12"));

            engine.changeColumnType("contacts", "balance", SemanticType.DECIMAL);

            assertThat(items.get("contacts", alice.id()).value("balance"))
                    .isEqualTo(new BigDecimal("12345678901234567890.12"));
        }

        @Test
        void changeColumnTypeToTimestampKeepsMilliseconds() {
            engine.addColumn("contacts", ColumnSpec.nullable("seen", SemanticType.TEXT));
            Item alice = items.create("contacts", Map.of("name", "Alice", "seen", "2024-03-01T10:15:30.250Z"));

            engine.changeColumnType("contacts", "seen", SemanticType.TIMESTAMP);

            assertThat(items.get("contacts", alice.id()).value("seen"))
                    .isEqualTo(Instant.parse("2024-03-01T10:15:30.250Z"));
        }

        @Test
        void unknownTablesFailBeforeAnyLockIsTaken() {
            assertThatThrownBy(() -> engine.addColumn(null, ColumnSpec.nullable("x", SemanticType.TEXT)))
                    .isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> engine.dropColumn("ghosts", "name"))
                    .isInstanceOf(NotFoundException.class);
            assertThatThrownBy(() -> engine.renameTable("ghosts", "spirits"))
                    .isInstanceOf(NotFoundException.class);
        }
    }

    @Nested
    class ConcurrentAccess {

        private final ExecutorService executor = Executors.newFixedThreadPool(2);

        @AfterEach
        void stopExecutor() {
            executor.shutdownNow();
        }

        @Test
        void listWaitsForDropColumnAndReadsTheNewStructure() throws Exception {
            engine.addColumn("contacts", ColumnSpec.nullable("email", SemanticType.TEXT));
            items.create("contacts", Map.of("name", "Alice", "email", "alice@example.com"));
            // warm the structure cache while email still exists
            assertThat(items.list("contacts", ItemQuery.all()).get(0).fields()).containsKey("email");

            CountDownLatch reconciling = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            MetadataStore paused = spy(fixture.metadataStore);
            doAnswer(invocation -> {
                reconciling.countDown();
                assertThat(release.await(10, TimeUnit.SECONDS)).isTrue();
                return invocation.callRealMethod();
            }).when(paused).removeColumnReferences(anyString(), anyString());
            SchemaMutationEngine pausedEngine = fixture.mutationEngine(paused);

            Future<TableStructure> drop = executor.submit(() -> pausedEngine.dropColumn("contacts", "email"));
            assertThat(reconciling.await(10, TimeUnit.SECONDS)).isTrue();
            Future<List<Item>> listed = executor.submit(() -> items.list("contacts", ItemQuery.all()));

            Thread.sleep(200);
            assertThat(listed).isNotDone();
            release.countDown();

            assertThat(drop.get(10, TimeUnit.SECONDS).hasColumn("email")).isFalse();
            List<Item> rows = listed.get(10, TimeUnit.SECONDS);
            assertThat(rows).hasSize(1);
            assertThat(rows.get(0).fields()).containsKey("name").doesNotContainKey("email");
        }

        @Test
        void crudReportsTransientFailureWhenTheLockDeadlinePasses() throws Exception {
            SqliteEngineFixture impatient = new SqliteEngineFixture(Files.createDirectories(tempDir.resolve("impatient")),
                    EngineProperties.defaults().withLockTimeout(Duration.ofMillis(100)),
                    Clock.fixed(SqliteEngineFixture.NOW, ZoneOffset.UTC));
            try {
                impatient.mutationEngine().createTable("contacts", "Contacts");
                ItemService impatientItems = impatient.itemService();

                try (TableLockRegistry.Lease ignored = impatient.lockRegistry.acquireExclusive("contacts")) {
                    Future<List<Item>> listed = executor.submit(() -> impatientItems.list("contacts", ItemQuery.all()));

                    assertThatThrownBy(() -> listed.get(10, TimeUnit.SECONDS))
                            .isInstanceOf(ExecutionException.class)
                            .hasCauseInstanceOf(TransientException.class);
                }
                assertThat(impatientItems.list("contacts", ItemQuery.all())).isEmpty();
            } finally {
                impatient.close();
            }
        }
    }

    @Nested
    class ForeignKeys {

        @BeforeEach
        void companies() {
            engine.createTable("companies", "Companies");
            engine.addColumn("contacts", ColumnSpec.nullable("company_id", SemanticType.INTEGER));
        }

        @Test
        void createForeignKeyDeclaresAdvisoryKey() {
            ForeignKeyDeclaration created = engine.createForeignKey("contacts", "company_id", "companies", "id");

            assertThat(created.id()).isNotNull();
            assertThat(created.enforced()).isFalse();
            assertThat(structure("contacts").column("company_id").orElseThrow().type()).isEqualTo(SemanticType.FOREIGN_KEY);
            assertThat(fixture.metadataStore.foreignKeysTo("companies"))
                    .extracting(ForeignKeyDeclaration::id)
                    .containsExactly(created.id());
        }

        @Test
        void createForeignKeyValidatesTarget() {
            assertThatThrownBy(() -> engine.createForeignKey("contacts", "company_id", "vendors", "id"))
                    .isInstanceOf(IntegrityException.class);
            assertThatThrownBy(() -> engine.createForeignKey("contacts", "name", "companies", "id"))
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        void createForeignKeyRefusesOrphans() {
            items.create("contacts", Map.of("name", "Alice", "company_id", 99));

            assertThatThrownBy(() -> engine.createForeignKey("contacts", "company_id", "companies", "id"))
                    .isInstanceOf(IntegrityException.class);
            assertThat(fixture.metadataStore.findForeignKey("contacts", "company_id")).isEmpty();
        }

        @Test
        void secondForeignKeyOnColumnConflicts() {
            engine.createForeignKey("contacts", "company_id", "companies", "id");

            assertThatThrownBy(() -> engine.createForeignKey("contacts", "company_id", "companies", "id"))
                    .isInstanceOf(ConflictException.class);
        }

        @Test
        void keyedColumnsCannotBeDroppedOrRetyped() {
            engine.createForeignKey("contacts", "company_id", "companies", "id");

            assertThatThrownBy(() -> engine.dropColumn("contacts", "company_id"))
                    .isInstanceOf(IntegrityException.class);
            assertThatThrownBy(() -> engine.changeColumnType("contacts", "company_id", SemanticType.TEXT))
                    .isInstanceOf(IntegrityException.class);
        }

        @Test
        void renamingAKeyedColumnRepointsTheDeclaration() {
            engine.createForeignKey("contacts", "company_id", "companies", "id");

            engine.renameColumn("contacts", "company_id", "employer_id");

            assertThat(fixture.metadataStore.findForeignKey("contacts", "employer_id")).isPresent();
            assertThat(fixture.metadataStore.findForeignKey("contacts", "company_id")).isEmpty();
        }

        @Test
        void longColumnNamesGetDistinctLookupIndexes() {
            String primary = "billing_company_reference_used_for_quarterly_statements_primary";
            String backup = "billing_company_reference_used_for_quarterly_statements_backup";
            engine.addColumn("contacts", ColumnSpec.nullable(primary, SemanticType.INTEGER));
            engine.addColumn("contacts", ColumnSpec.nullable(backup, SemanticType.INTEGER));

            ForeignKeyDeclaration first = engine.createForeignKey("contacts", primary, "companies", "id");
            ForeignKeyDeclaration second = engine.createForeignKey("contacts", backup, "companies", "id");

            assertThat(first.indexName()).isNotEqualTo(second.indexName());
            assertThat(lookupIndexes()).contains(first.indexName(), second.indexName());

            engine.dropForeignKey("contacts", primary);

            assertThat(lookupIndexes()).doesNotContain(first.indexName()).contains(second.indexName());
        }

        private List<String> lookupIndexes() {
            return fixture.jdbcTemplate.queryForList(
                    "SELECT name FROM sqlite_master WHERE type = 'index' AND tbl_name = 'contacts'", String.class);
        }

        @Test
        void dropForeignKeyRemovesDeclaration() {
            engine.createForeignKey("contacts", "company_id", "companies", "id");

            engine.dropForeignKey("contacts", "company_id");

            assertThat(fixture.metadataStore.foreignKeysFrom("contacts")).isEmpty();
            assertThatThrownBy(() -> engine.dropForeignKey("contacts", "company_id"))
                    .isInstanceOf(NotFoundException.class);
        }
    }
}
