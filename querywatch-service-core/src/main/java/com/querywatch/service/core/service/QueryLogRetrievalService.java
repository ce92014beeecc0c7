package com.querywatch.service.core.service;

import com.querywatch.service.core.catalog.ColumnRegistry;
import com.querywatch.service.core.catalog.QueryLogColumn;
import com.querywatch.service.core.config.QueryLogProperties;
import com.querywatch.service.core.error.LogStoreException;
import com.querywatch.service.core.error.QueryLogNotFoundException;
import com.querywatch.service.core.error.StoreOperation;
import com.querywatch.service.core.error.ValidationException;
import com.querywatch.service.core.filter.LogFilter;
import com.querywatch.service.core.materialize.RowMaterializer;
import com.querywatch.service.core.model.LogRecord;
import com.querywatch.service.core.model.MetricBucket;
import com.querywatch.service.core.query.BucketSizer;
import com.querywatch.service.core.query.BucketSpec;
import com.querywatch.service.core.query.BuiltQuery;
import com.querywatch.service.core.query.MetricsQueryBuilder;
import com.querywatch.service.core.query.QueryLogQueryBuilder;
import com.querywatch.service.core.spi.LogStore;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Read-only retrieval over the query log. Stateless: every call validates, builds one parameterized
 * query, runs it once against the {@link LogStore} and materializes the rows.
 */
@Service
@Slf4j
public class QueryLogRetrievalService {

    private final LogStore store;
    private final QueryLogQueryBuilder queryBuilder;
    private final MetricsQueryBuilder metricsBuilder;
    private final BuiltQuery databasesQuery;

    public QueryLogRetrievalService(LogStore store, QueryLogProperties properties) {
        this.store = store;
        QueryLogProperties.Store config = properties.getStore();
        this.queryBuilder = new QueryLogQueryBuilder(config.getQueryLogTable());
        this.metricsBuilder = new MetricsQueryBuilder(config.getQueryLogTable());
        this.databasesQuery = QueryLogQueryBuilder.databaseNames(config.getDatabasesTable());
    }

    /** Full-record listing; any projection on the filter is ignored. */
    public QueryLogPage listLogs(LogFilter filter) {
        Objects.requireNonNull(filter, "filter");
        BuiltQuery query = queryBuilder.build(filter, ColumnRegistry.allColumns());
        List<LogRecord> records = fetch(StoreOperation.LIST_LOGS, query).stream()
                .map(RowMaterializer::toRecord)
                .toList();
        return new QueryLogPage(records, records.size());
    }

    /** Listing restricted to the filter's projection. */
    public ProjectedLogPage listLogsProjected(LogFilter filter) {
        Objects.requireNonNull(filter, "filter");
        if (!filter.hasProjection()) {
            throw new ValidationException(ValidationException.INVALID_COLUMNS, "at least one valid column is required");
        }
        return project(StoreOperation.LIST_LOGS, filter, filter.columns());
    }

    /**
     * Listing restricted to caller-named columns. Unknown names reject the request before the store is
     * touched.
     */
    public ProjectedLogPage listLogsProjected(LogFilter filter, Collection<String> columns) {
        Objects.requireNonNull(filter, "filter");
        return project(StoreOperation.LIST_LOGS, filter, ColumnRegistry.resolveProjection(columns));
    }

    /** Projected rows for CSV export. The column list is mandatory here. */
    public ProjectedLogPage exportLogs(LogFilter filter) {
        Objects.requireNonNull(filter, "filter");
        if (!filter.hasProjection()) {
            throw new ValidationException(
                    ValidationException.MISSING_COLUMNS, "columns parameter is required for CSV export");
        }
        return project(StoreOperation.EXPORT_LOGS, filter, filter.columns());
    }

    public MetricsResult aggregateMetrics(LogFilter filter) {
        Objects.requireNonNull(filter, "filter");
        BucketSpec bucket = BucketSizer.forRange(filter.startTime(), filter.endTime());
        BuiltQuery query = metricsBuilder.build(filter, bucket);
        List<MetricBucket> buckets = fetch(StoreOperation.AGGREGATE_METRICS, query).stream()
                .map(RowMaterializer::toMetricBucket)
                .toList();
        return new MetricsResult(buckets, bucket);
    }

    public List<String> listDatabases() {
        return fetch(StoreOperation.LIST_DATABASES, databasesQuery).stream()
                .map(RowMaterializer::toName)
                .toList();
    }

    /** Most recent record with exactly this id. */
    public LogRecord getById(String queryId) {
        if (queryId == null || queryId.isBlank()) {
            throw new ValidationException(ValidationException.MISSING_PARAMETER, "query_id is required");
        }
        List<Object[]> rows = fetch(StoreOperation.GET_BY_ID, queryBuilder.byId(queryId));
        if (rows.isEmpty()) {
            throw new QueryLogNotFoundException(queryId);
        }
        return RowMaterializer.toRecord(rows.get(0));
    }

    /** Store round trip for readiness probes. */
    public void ping() {
        try {
            store.ping();
        } catch (DataAccessException e) {
            log.error("Log store ping failed ({})", e.getClass().getSimpleName());
            throw new LogStoreException(StoreOperation.PING, e);
        }
    }

    private ProjectedLogPage project(StoreOperation operation, LogFilter filter, List<QueryLogColumn> projection) {
        BuiltQuery query = queryBuilder.build(filter, projection);
        List<Map<String, Object>> rows = fetch(operation, query).stream()
                .map(raw -> RowMaterializer.toProjectedRow(projection, raw))
                .toList();
        List<String> names = projection.stream().map(QueryLogColumn::columnName).toList();
        return new ProjectedLogPage(rows, names, rows.size());
    }

    private List<Object[]> fetch(StoreOperation operation, BuiltQuery query) {
        if (log.isDebugEnabled()) {
            log.debug("{}: {} [{} bound args]", operation, query.sql(), query.args().size());
        }
        try {
            return store.fetch(query);
        } catch (DataAccessException e) {
            // never the cause message: it quotes the query with bound values
            log.error("Log store call failed during {} ({})", operation, e.getClass().getSimpleName());
            throw new LogStoreException(operation, e);
        }
    }
}
