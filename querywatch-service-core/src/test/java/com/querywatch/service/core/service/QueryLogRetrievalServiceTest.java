package com.querywatch.service.core.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.querywatch.service.core.QueryLogFixtures;
import com.querywatch.service.core.config.QueryLogProperties;
import com.querywatch.service.core.error.LogStoreException;
import com.querywatch.service.core.error.QueryLogNotFoundException;
import com.querywatch.service.core.error.SchemaDriftException;
import com.querywatch.service.core.error.StoreOperation;
import com.querywatch.service.core.error.ValidationException;
import com.querywatch.service.core.filter.LimitPolicy;
import com.querywatch.service.core.filter.LogFilter;
import com.querywatch.service.core.filter.LogFilterParser;
import com.querywatch.service.core.model.LogRecord;
import com.querywatch.service.core.query.BucketSpec;
import com.querywatch.service.core.query.BuiltQuery;
import com.querywatch.service.core.spi.LogStore;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.QueryTimeoutException;

class QueryLogRetrievalServiceTest {

    private static final LocalDateTime AT = LocalDateTime.of(2024, 1, 1, 10, 0);

    @Mock
    private LogStore store;

    private QueryLogRetrievalService service;

    @BeforeEach
    void setup() {
        MockitoAnnotations.openMocks(this);
        service = new QueryLogRetrievalService(store, new QueryLogProperties());
    }

    @Test
    void listLogsMaterializesFullRecords() {
        when(store.fetch(any())).thenReturn(List.of(
                QueryLogFixtures.finishedRow("q1", AT), QueryLogFixtures.failedRow("q2", AT.minusMinutes(1))));

        QueryLogPage page = service.listLogs(LogFilter.builder(LimitPolicy.LISTING).build());

        assertEquals(2, page.count());
        assertEquals("q1", page.records().get(0).queryId());
        assertThat(page.records().get(1).isFailed()).isTrue();
    }

    @Test
    void listLogsIgnoresProjectionOnFilter() {
        when(store.fetch(any())).thenReturn(List.of());
        LogFilter filter = LogFilterParser.parse(Map.of("columns", "query_id"), LimitPolicy.LISTING);

        service.listLogs(filter);

        ArgumentCaptor<BuiltQuery> query = ArgumentCaptor.forClass(BuiltQuery.class);
        verify(store).fetch(query.capture());
        assertThat(query.getValue().sql()).startsWith("SELECT query_id, query, event_time");
    }

    @Test
    void projectedListingKeepsRequestedColumnOrder() {
        when(store.fetch(any())).thenReturn(List.<Object[]>of(new Object[] {"analyst", "q1"}));
        LogFilter filter = LogFilterParser.parse(Map.of("columns", "user,query_id"), LimitPolicy.LISTING);

        ProjectedLogPage page = service.listLogsProjected(filter);

        assertEquals(List.of("user", "query_id"), page.columns());
        assertEquals(Map.of("user", "analyst", "query_id", "q1"), page.rows().get(0));
        assertEquals(1, page.count());
    }

    @Test
    void unknownProjectionColumnFailsBeforeAnyStoreCall() {
        LogFilter filter = LogFilter.builder(LimitPolicy.LISTING).build();

        assertThatThrownBy(() -> service.listLogsProjected(filter, List.of("query_id", "bogus_col")))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("bogus_col");
        verifyNoInteractions(store);
    }

    @Test
    void exportRequiresColumns() {
        assertThatThrownBy(() -> service.exportLogs(LogFilter.builder(LimitPolicy.EXPORT).build()))
                .isInstanceOf(ValidationException.class)
                .extracting(e -> ((ValidationException) e).kind())
                .isEqualTo(ValidationException.MISSING_COLUMNS);
        verifyNoInteractions(store);
    }

    @Test
    void aggregateMetricsPicksBucketFromRange() {
        when(store.fetch(any())).thenReturn(List.<Object[]>of(new Object[] {
            LocalDateTime.of(2024, 1, 1, 0, 0), BigInteger.TEN, 12.5, BigInteger.valueOf(40), 100.0, 300L,
            BigInteger.valueOf(1000), BigInteger.ZERO, BigInteger.ONE
        }));
        LogFilter filter = LogFilter.builder(LimitPolicy.LISTING)
                .startTime(Instant.parse("2024-01-01T00:00:00Z"))
                .endTime(Instant.parse("2024-01-15T00:00:00Z"))
                .build();

        MetricsResult result = service.aggregateMetrics(filter);

        assertEquals(BucketSpec.H6, result.bucket());
        assertEquals(1, result.buckets().size());
        assertEquals(10L, result.buckets().get(0).totalQueries());
        ArgumentCaptor<BuiltQuery> query = ArgumentCaptor.forClass(BuiltQuery.class);
        verify(store).fetch(query.capture());
        assertThat(query.getValue().sql()).contains("INTERVAL 6 HOUR");
    }

    @Test
    void listsDatabaseNames() {
        when(store.fetch(any())).thenReturn(List.of(new Object[] {"default"}, new Object[] {"system"}));

        assertEquals(List.of("default", "system"), service.listDatabases());
    }

    @Test
    void getByIdReturnsNewestMatch() {
        when(store.fetch(any())).thenReturn(List.<Object[]>of(QueryLogFixtures.finishedRow("abc123", AT)));

        LogRecord record = service.getById("abc123");

        assertEquals("abc123", record.queryId());
        ArgumentCaptor<BuiltQuery> query = ArgumentCaptor.forClass(BuiltQuery.class);
        verify(store).fetch(query.capture());
        assertThat(query.getValue().sql()).endsWith(" WHERE query_id = ? ORDER BY event_time DESC LIMIT 1");
        assertEquals(List.of("abc123"), query.getValue().args());
    }

    @Test
    void getByIdFindsQueryThatIsStillRunning() {
        Object[] started = QueryLogFixtures.finishedRow("running-q", AT);
        started[4] = "QueryStart";
        when(store.fetch(any())).thenReturn(List.<Object[]>of(started));

        LogRecord record = service.getById("running-q");

        assertEquals("QueryStart", record.type());
        ArgumentCaptor<BuiltQuery> query = ArgumentCaptor.forClass(BuiltQuery.class);
        verify(store).fetch(query.capture());
        assertThat(query.getValue().sql()).doesNotContain("QueryStart");
    }

    @Test
    void getByIdMissIsNotFound() {
        when(store.fetch(any())).thenReturn(List.of());

        assertThatThrownBy(() -> service.getById("nope"))
                .isInstanceOf(QueryLogNotFoundException.class)
                .hasMessage("Query log not found");
    }

    @Test
    void getByIdRequiresId() {
        assertThatThrownBy(() -> service.getById(" "))
                .isInstanceOf(ValidationException.class)
                .hasMessage("query_id is required");
        verifyNoInteractions(store);
    }

    @Test
    void storeFailureIsWrappedWithOperationOnly() {
        when(store.fetch(any())).thenThrow(new QueryTimeoutException("timed out running SELECT ... 'secret'"));

        assertThatThrownBy(() -> service.listLogs(LogFilter.builder(LimitPolicy.LISTING).user("secret").build()))
                .isInstanceOf(LogStoreException.class)
                .hasMessageNotContaining("secret")
                .extracting(e -> ((LogStoreException) e).operation())
                .isEqualTo(StoreOperation.LIST_LOGS);
    }

    @Test
    @ExtendWith(OutputCaptureExtension.class)
    void storeFailureLogNeverCarriesBoundValues(CapturedOutput output) {
        when(store.fetch(any()))
                .thenThrow(new DataAccessResourceFailureException(
                        "Code: 159. Timeout exceeded (in query: SELECT * FROM system.query_log WHERE user = 'alice-secret-token')"));

        assertThatThrownBy(() -> service.listLogs(
                        LogFilter.builder(LimitPolicy.LISTING).user("alice-secret-token").build()))
                .isInstanceOf(LogStoreException.class);

        assertThat(output.getAll())
                .contains("Log store call failed during LIST_LOGS")
                .doesNotContain("alice-secret-token");
    }

    @Test
    @ExtendWith(OutputCaptureExtension.class)
    void pingFailureLogNeverCarriesDriverMessage(CapturedOutput output) {
        doThrow(new DataAccessResourceFailureException("connect to clickhouse://admin:hunter2@db:8123 failed"))
                .when(store)
                .ping();

        assertThatThrownBy(() -> service.ping()).isInstanceOf(LogStoreException.class);

        assertThat(output.getAll()).doesNotContain("hunter2");
    }

    @Test
    void driftingRowFailsTheRequest() {
        Object[] row = QueryLogFixtures.finishedRow("q1", AT);
        row[5] = "1250";
        when(store.fetch(any())).thenReturn(List.<Object[]>of(row));

        assertThatThrownBy(() -> service.listLogs(LogFilter.builder(LimitPolicy.LISTING).build()))
                .isInstanceOf(SchemaDriftException.class);
    }

    @Test
    void pingFailureIsStoreError() {
        doThrow(new QueryTimeoutException("down")).when(store).ping();

        assertThatThrownBy(() -> service.ping())
                .isInstanceOf(LogStoreException.class)
                .extracting(e -> ((LogStoreException) e).operation())
                .isEqualTo(StoreOperation.PING);
    }
}
