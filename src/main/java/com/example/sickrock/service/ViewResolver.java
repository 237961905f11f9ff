package com.example.sickrock.service;

import com.example.sickrock.exception.NotFoundException;
import com.example.sickrock.model.ColumnDescriptor;
import com.example.sickrock.model.ColumnVisibility;
import com.example.sickrock.model.EffectiveColumn;
import com.example.sickrock.model.EffectiveView;
import com.example.sickrock.model.TableStructure;
import com.example.sickrock.model.TableView;
import com.example.sickrock.model.ViewType;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Merges a saved view with the live columns of its table. Listed columns come first, by
 * {@code columnOrder} and then catalog position; columns the view does not list follow as visible,
 * in catalog order. Entries for columns that no longer exist are skipped.
 */
@Service
public class ViewResolver {

    static final String IMPLICIT_VIEW_NAME = "All columns";

    private final MetadataStore metadataStore;
    private final SchemaIntrospector introspector;
    private final SqlLogService logService;

    public ViewResolver(MetadataStore metadataStore, SchemaIntrospector introspector, SqlLogService logService) {
        this.metadataStore = metadataStore;
        this.introspector = introspector;
        this.logService = logService;
    }

    /**
     * @param viewId a view of the table, or {@code null} for its default view
     */
    public EffectiveView getEffectiveView(String tableName, Long viewId) {
        metadataStore.getConfiguration(tableName);
        TableStructure structure = introspector.getTableStructure(tableName);
        Optional<TableView> view;
        if (viewId != null) {
            TableView found = metadataStore.getView(viewId);
            if (!found.tableName().equals(tableName)) {
                throw new NotFoundException("View " + viewId + " does not belong to table " + tableName);
            }
            view = Optional.of(found);
        } else {
            view = metadataStore.findDefaultView(tableName);
        }
        return view.map(v -> resolve(structure, v))
                .orElseGet(() -> new EffectiveView(null, IMPLICIT_VIEW_NAME, ViewType.TABLE, unlisted(structure, Set.of())));
    }

    EffectiveView resolve(TableStructure structure, TableView view) {
        Map<String, Integer> positions = new HashMap<>();
        List<ColumnDescriptor> columns = structure.columns();
        for (int i = 0; i < columns.size(); i++) {
            positions.put(key(columns.get(i).name()), i);
        }

        List<ColumnVisibility> listed = new ArrayList<>();
        for (ColumnVisibility entry : view.columns()) {
            if (positions.containsKey(key(entry.columnName()))) {
                listed.add(entry);
            } else {
                logService.logWarning("View " + view.viewName() + " of " + view.tableName()
                        + " lists missing column " + entry.columnName() + "; skipped");
            }
        }
        listed.sort(Comparator.comparingInt(ColumnVisibility::columnOrder)
                .thenComparingInt(entry -> positions.get(key(entry.columnName()))));

        List<EffectiveColumn> result = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (ColumnVisibility entry : listed) {
            ColumnDescriptor column = columns.get(positions.get(key(entry.columnName())));
            seen.add(key(column.name()));
            result.add(new EffectiveColumn(column.name(), entry.visible(), entry.sortOrder(), entry.width()));
        }
        result.addAll(unlisted(structure, seen));
        return new EffectiveView(view.id(), view.viewName(), view.viewType(), result);
    }

    private static List<EffectiveColumn> unlisted(TableStructure structure, Set<String> seen) {
        return structure.columns().stream()
                .filter(c -> !seen.contains(key(c.name())))
                .map(c -> new EffectiveColumn(c.name(), true, null, null))
                .toList();
    }

    private static String key(String name) {
        return name.toLowerCase(Locale.ROOT);
    }
}
