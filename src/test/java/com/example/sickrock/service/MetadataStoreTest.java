package com.example.sickrock.service;

import com.example.sickrock.exception.ConflictException;
import com.example.sickrock.exception.NotFoundException;
import com.example.sickrock.exception.ValidationException;
import com.example.sickrock.model.ColumnVisibility;
import com.example.sickrock.model.ForeignKeyDeclaration;
import com.example.sickrock.model.SortDirective;
import com.example.sickrock.model.TableConfiguration;
import com.example.sickrock.model.TableConfigurationUpdate;
import com.example.sickrock.model.TableView;
import com.example.sickrock.model.ViewType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MetadataStoreTest {

    @TempDir
    Path tempDir;

    private SqliteEngineFixture fixture;
    private MetadataStore store;

    @BeforeEach
    void setUp() {
        fixture = new SqliteEngineFixture(tempDir);
        store = fixture.metadataStore;
        store.createConfiguration(TableConfiguration.of("contacts", "Contacts"));
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    @Test
    void configurationLifecycle() {
        TableConfiguration created = store.createConfiguration(
                new TableConfiguration(null, "projects", "Projects", 2, null, "New project", "folder"));

        assertThat(store.getConfiguration("projects")).isEqualTo(created);
        assertThat(store.listConfigurations()).extracting(TableConfiguration::name).containsExactly("contacts", "projects");

        TableConfiguration updated = store.updateConfiguration("projects", TableConfigurationUpdate.retitle("All projects"));
        assertThat(updated.title()).isEqualTo("All projects");
        assertThat(updated.createButtonText()).isEqualTo("New project");
        assertThat(store.getConfiguration("projects").title()).isEqualTo("All projects");

        store.deleteConfiguration("projects");
        assertThat(store.findConfiguration("projects")).isEmpty();
        assertThatThrownBy(() -> store.getConfiguration("projects")).isInstanceOf(NotFoundException.class);
    }

    @Test
    void duplicateConfigurationConflicts() {
        assertThatThrownBy(() -> store.createConfiguration(TableConfiguration.of("contacts", "Again")))
                .isInstanceOf(ConflictException.class);
    }

    @Test
    void displayDefaults() {
        TableConfiguration contacts = store.getConfiguration("contacts");

        assertThat(contacts.displayCreateButtonText()).isEqualTo(TableConfiguration.DEFAULT_CREATE_BUTTON_TEXT);
        assertThat(TableConfiguration.of("notes", null).displayTitle()).isEqualTo("notes");
    }

    @Test
    void viewRoundTripKeepsHiddenColumnsAndSorting() {
        TableView saved = store.createView(new TableView(null, "contacts", "Compact", ViewType.CALENDAR, false, List.of(
                new ColumnVisibility("name", true, 0, SortDirective.ASC, 240),
                ColumnVisibility.hidden("email", 1))));

        TableView loaded = store.getView(saved.id());

        assertThat(loaded.viewType()).isEqualTo(ViewType.CALENDAR);
        assertThat(loaded.columns()).containsExactly(
                new ColumnVisibility("name", true, 0, SortDirective.ASC, 240),
                new ColumnVisibility("email", false, 1, null, null));
    }

    @Test
    void onlyOneDefaultViewPerTable() {
        TableView first = store.createView(TableView.of("contacts", "First", List.of()).asDefault(true));
        TableView second = store.createView(TableView.of("contacts", "Second", List.of()).asDefault(true));

        assertThat(store.findDefaultView("contacts").orElseThrow().id()).isEqualTo(second.id());
        assertThat(store.getView(first.id()).isDefault()).isFalse();

        store.setDefaultView("contacts", first.id());
        assertThat(store.listViews("contacts"))
                .filteredOn(TableView::isDefault)
                .extracting(TableView::id)
                .containsExactly(first.id());

        store.updateView(store.getView(second.id()).asDefault(true));
        assertThat(store.listViews("contacts"))
                .filteredOn(TableView::isDefault)
                .extracting(TableView::id)
                .containsExactly(second.id());
    }

    @Test
    void viewNamesAreUniquePerTable() {
        store.createView(TableView.of("contacts", "Main", List.of()));

        assertThatThrownBy(() -> store.createView(TableView.of("contacts", "Main", List.of())))
                .isInstanceOf(ConflictException.class);
        assertThatThrownBy(() -> store.createView(TableView.of("ghosts", "Main", List.of())))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    void viewsCannotListAColumnTwice() {
        assertThatThrownBy(() -> TableView.of("contacts", "Twice",
                List.of(ColumnVisibility.visible("name", 0), ColumnVisibility.visible("NAME", 1))))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void deleteViewRemovesColumns() {
        TableView view = store.createView(TableView.of("contacts", "Main", List.of(ColumnVisibility.visible("name", 0))));

        store.deleteView(view.id());

        assertThat(store.findView(view.id())).isEmpty();
        assertThat(fixture.jdbcTemplate.queryForObject("SELECT COUNT(*) FROM table_view_columns", Long.class)).isZero();
    }

    @Test
    void deletingConfigurationCascadesToViewsAndForeignKeys() {
        store.createConfiguration(TableConfiguration.of("companies", null));
        store.createView(TableView.of("contacts", "Main", List.of(ColumnVisibility.visible("name", 0))));
        store.saveForeignKey(ForeignKeyDeclaration.of("contacts", "company_id", "companies", "id"));

        store.deleteConfiguration("companies");

        assertThat(store.foreignKeysFrom("contacts")).isEmpty();
        assertThat(store.listViews("contacts")).hasSize(1);

        store.deleteConfiguration("contacts");
        assertThat(store.listViews("contacts")).isEmpty();
    }

    @Test
    void columnReferencesFollowRenamesAndDrops() {
        store.createConfiguration(TableConfiguration.of("companies", null));
        TableView view = store.createView(TableView.of("contacts", "Main",
                List.of(ColumnVisibility.visible("company_id", 0), ColumnVisibility.visible("name", 1))));
        store.saveForeignKey(ForeignKeyDeclaration.of("contacts", "company_id", "companies", "id"));

        store.renameColumnReferences("contacts", "company_id", "employer_id");

        assertThat(store.getView(view.id()).columns()).extracting(ColumnVisibility::columnName)
                .containsExactly("employer_id", "name");
        assertThat(store.findForeignKey("contacts", "employer_id")).isPresent();

        store.removeColumnReferences("contacts", "employer_id");

        assertThat(store.getView(view.id()).columns()).extracting(ColumnVisibility::columnName)
                .containsExactly("name");
        assertThat(store.foreignKeysFrom("contacts")).isEmpty();
    }

    @Test
    void columnReferencesMatchRegardlessOfCase() {
        store.createConfiguration(TableConfiguration.of("companies", null));
        TableView view = store.createView(TableView.of("contacts", "Main",
                List.of(ColumnVisibility.visible("Email", 0), ColumnVisibility.visible("Phone", 1),
                        ColumnVisibility.visible("name", 2))));
        store.saveForeignKey(ForeignKeyDeclaration.of("contacts", "Company_Id", "companies", "id"));

        store.removeColumnReferences("contacts", "email");
        store.renameColumnReferences("contacts", "phone", "mobile");
        store.renameColumnReferences("contacts", "company_id", "employer_id");

        assertThat(store.getView(view.id()).columns()).extracting(ColumnVisibility::columnName)
                .containsExactly("mobile", "name");
        assertThat(store.foreignKeysFrom("contacts")).extracting(ForeignKeyDeclaration::columnName)
                .containsExactly("employer_id");
    }

    @Test
    void tableRenameMovesEverything() {
        store.createConfiguration(TableConfiguration.of("companies", null));
        TableView view = store.createView(TableView.of("companies", "Main", List.of()));
        store.saveForeignKey(ForeignKeyDeclaration.of("contacts", "company_id", "companies", "id"));

        store.renameTableReferences("companies", "organisations");

        assertThat(store.findConfiguration("organisations")).isPresent();
        assertThat(store.getView(view.id()).tableName()).isEqualTo("organisations");
        assertThat(store.foreignKeysTo("organisations")).hasSize(1);
        assertThat(store.foreignKeysTo("companies")).isEmpty();
    }

    @Test
    void oneForeignKeyPerColumn() {
        store.saveForeignKey(ForeignKeyDeclaration.of("contacts", "company_id", "companies", "id"));

        assertThatThrownBy(() -> store.saveForeignKey(ForeignKeyDeclaration.of("contacts", "company_id", "vendors", "id")))
                .isInstanceOf(ConflictException.class);
    }
}
