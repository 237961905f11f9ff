package com.example.sickrock.service;

import com.example.sickrock.exception.NotFoundException;
import com.example.sickrock.model.ColumnSort;
import com.example.sickrock.model.ColumnSpec;
import com.example.sickrock.model.ColumnVisibility;
import com.example.sickrock.model.EffectiveColumn;
import com.example.sickrock.model.EffectiveView;
import com.example.sickrock.model.SemanticType;
import com.example.sickrock.model.SortDirective;
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

class ViewResolverTest {

    @TempDir
    Path tempDir;

    private SqliteEngineFixture fixture;
    private ViewResolver resolver;

    @BeforeEach
    void setUp() {
        fixture = new SqliteEngineFixture(tempDir);
        resolver = fixture.viewResolver();
        SchemaMutationEngine engine = fixture.mutationEngine();
        engine.createTable("contacts", "Contacts");
        engine.addColumn("contacts", ColumnSpec.nullable("name", SemanticType.TEXT));
        engine.addColumn("contacts", ColumnSpec.nullable("email", SemanticType.TEXT));
        engine.addColumn("contacts", ColumnSpec.nullable("phone", SemanticType.TEXT));
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    @Test
    void withoutViewsEveryColumnIsVisibleInCatalogOrder() {
        EffectiveView view = resolver.getEffectiveView("contacts", null);

        assertThat(view.viewId()).isNull();
        assertThat(view.viewType()).isEqualTo(ViewType.TABLE);
        assertThat(view.visibleColumnNames())
                .containsExactly("id", "sr_created", "sr_updated", "name", "email", "phone");
    }

    @Test
    void listedColumnsComeFirstThenUnlistedOnes() {
        fixture.metadataStore.createView(TableView.of("contacts", "Main", List.of(
                new ColumnVisibility("email", true, 0, SortDirective.DESC, 200),
                ColumnVisibility.hidden("id", 1),
                ColumnVisibility.visible("name", 1))).asDefault(true));

        EffectiveView view = resolver.getEffectiveView("contacts", null);

        assertThat(view.columns()).extracting(EffectiveColumn::name)
                .containsExactly("email", "id", "name", "sr_created", "sr_updated", "phone");
        assertThat(view.visibleColumnNames()).doesNotContain("id");
        assertThat(view.columns().get(0).width()).isEqualTo(200);
        assertThat(view.sort()).containsExactly(new ColumnSort("email", SortDirective.DESC));
    }

    @Test
    void staleEntriesAreSkipped() {
        TableView saved = fixture.metadataStore.createView(TableView.of("contacts", "Main", List.of(
                ColumnVisibility.visible("fax", 0),
                ColumnVisibility.visible("phone", 1))));

        EffectiveView view = resolver.getEffectiveView("contacts", saved.id());

        assertThat(view.viewId()).isEqualTo(saved.id());
        assertThat(view.columns()).extracting(EffectiveColumn::name).doesNotContain("fax").startsWith("phone");
        assertThat(fixture.logService.recentEntries()).anyMatch(entry -> entry.contains("WRN") && entry.contains("fax"));
    }

    @Test
    void columnsAddedAfterTheViewShowUpAtTheEnd() {
        fixture.metadataStore.createView(TableView.of("contacts", "Main",
                List.of(ColumnVisibility.visible("name", 0))).asDefault(true));
        fixture.mutationEngine().addColumn("contacts", ColumnSpec.nullable("city", SemanticType.TEXT));

        EffectiveView view = resolver.getEffectiveView("contacts", null);

        assertThat(view.columns()).extracting(EffectiveColumn::name).startsWith("name").endsWith("city");
        assertThat(view.visibleColumnNames()).contains("city");
    }

    @Test
    void viewsOfOtherTablesAreNotFound() {
        fixture.mutationEngine().createTable("companies", null);
        TableView foreign = fixture.metadataStore.createView(TableView.of("companies", "Main", List.of()));

        assertThatThrownBy(() -> resolver.getEffectiveView("contacts", foreign.id()))
                .isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> resolver.getEffectiveView("ghosts", null))
                .isInstanceOf(NotFoundException.class);
    }
}
