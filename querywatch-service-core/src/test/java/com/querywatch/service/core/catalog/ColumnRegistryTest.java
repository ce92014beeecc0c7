package com.querywatch.service.core.catalog;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.querywatch.service.core.error.ValidationException;
import java.util.List;
import org.junit.jupiter.api.Test;

class ColumnRegistryTest {

    @Test
    void listsEveryColumnInFixedOrder() {
        List<String> names = ColumnRegistry.allColumnNames();
        assertEquals(23, names.size());
        assertEquals("query_id", names.get(0));
        assertEquals("event_time", names.get(2));
        assertEquals("is_initial_query", names.get(names.size() - 1));
    }

    @Test
    void sortableColumnsAreAStrictSubset() {
        assertThat(ColumnRegistry.allColumns())
                .filteredOn(QueryLogColumn::sortable)
                .hasSizeLessThan(ColumnRegistry.allColumns().size())
                .contains(QueryLogColumn.EVENT_TIME, QueryLogColumn.QUERY_DURATION_MS, QueryLogColumn.MEMORY_USAGE);
    }

    @Test
    void freeTextAndArrayColumnsAreNotSortable() {
        assertTrue(ColumnRegistry.isColumn("query"));
        assertFalse(ColumnRegistry.isSortable("query"));
        assertFalse(ColumnRegistry.isSortable("databases"));
        assertFalse(ColumnRegistry.isSortable("tables"));
        assertFalse(ColumnRegistry.isSortable("exception"));
        assertTrue(ColumnRegistry.isSortable("read_bytes"));
    }

    @Test
    void unknownNamesAreNeitherColumnsNorSortable() {
        assertFalse(ColumnRegistry.isColumn("bogus_col"));
        assertFalse(ColumnRegistry.isColumn(null));
        assertFalse(ColumnRegistry.isSortable("bogus_col"));
        assertFalse(ColumnRegistry.isColumn("QUERY_ID"));
    }

    @Test
    void parseProjectionTrimsAndSkipsEmptyEntries() {
        List<QueryLogColumn> columns = ColumnRegistry.parseProjection(" query_id , ,user,");
        assertEquals(List.of(QueryLogColumn.QUERY_ID, QueryLogColumn.USER), columns);
    }

    @Test
    void parseProjectionRejectsUnknownColumnByName() {
        assertThatThrownBy(() -> ColumnRegistry.parseProjection("query_id,bogus_col"))
                .isInstanceOf(ValidationException.class)
                .hasMessage("invalid column: bogus_col")
                .extracting(e -> ((ValidationException) e).kind())
                .isEqualTo(ValidationException.INVALID_COLUMNS);
    }

    @Test
    void parseProjectionRejectsListWithNoColumns() {
        assertThatThrownBy(() -> ColumnRegistry.parseProjection(" , ,"))
                .isInstanceOf(ValidationException.class)
                .hasMessage("at least one valid column is required");
    }
}
