package com.querywatch.controller.rest;

import com.querywatch.controller.rest.export.QueryLogCsvWriter;
import com.querywatch.service.core.filter.LimitPolicy;
import com.querywatch.service.core.filter.LogFilter;
import com.querywatch.service.core.filter.LogFilterParser;
import com.querywatch.service.core.model.LogRecord;
import com.querywatch.service.core.service.MetricsResult;
import com.querywatch.service.core.service.ProjectedLogPage;
import com.querywatch.service.core.service.QueryLogPage;
import com.querywatch.service.core.service.QueryLogRetrievalService;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.HashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/logs")
@Slf4j
@RequiredArgsConstructor
public class QueryLogController {

    static final String CSV_CONTENT_TYPE = "text/csv";
    private static final DateTimeFormatter FILE_STAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

    private final QueryLogRetrievalService service;
    private final QueryLogCsvWriter csvWriter;
    private final Clock clock;

    @GetMapping
    public QueryLogListResponse list(@RequestParam Map<String, String> params) {
        LogFilter filter = LogFilterParser.parse(params, LimitPolicy.LISTING);
        Pagination pagination;
        if (filter.hasProjection()) {
            log.info(
                    "Listing query logs: limit={}, offset={}, columns={}",
                    filter.limit(),
                    filter.offset(),
                    filter.columns().size());
            ProjectedLogPage page = service.listLogsProjected(filter);
            pagination = new Pagination(filter.limit(), filter.offset(), page.count());
            return new QueryLogListResponse(page.rows(), page.columns(), pagination);
        }
        log.info("Listing query logs: limit={}, offset={}", filter.limit(), filter.offset());
        QueryLogPage page = service.listLogs(filter);
        pagination = new Pagination(filter.limit(), filter.offset(), page.count());
        return new QueryLogListResponse(page.records(), null, pagination);
    }

    @GetMapping("/metrics")
    public MetricsResponse metrics(@RequestParam Map<String, String> params) {
        Map<String, String> filterParams = new HashMap<>(params);
        filterParams.remove(LogFilterParser.LIMIT);
        filterParams.remove(LogFilterParser.OFFSET);
        filterParams.remove(LogFilterParser.COLUMNS);
        LogFilter filter = LogFilterParser.parse(filterParams, LimitPolicy.LISTING);
        MetricsResult result = service.aggregateMetrics(filter);
        log.info("Aggregated query metrics: bucket={}, buckets={}", result.bucket().label(), result.buckets().size());
        return MetricsResponse.of(result.buckets(), result.bucket());
    }

    /** Rows are fully fetched before any byte is written, so failures still map to a JSON error. */
    @GetMapping("/export")
    public void export(@RequestParam Map<String, String> params, HttpServletResponse response) throws IOException {
        LogFilter filter = LogFilterParser.parse(params, LimitPolicy.EXPORT);
        ProjectedLogPage page = service.exportLogs(filter);
        log.info("Exporting query logs: limit={}, columns={}, rows={}", filter.limit(), page.columns().size(), page.count());

        String filename = "query_logs_" + FILE_STAMP.format(clock.instant()) + ".csv";
        response.setContentType(CSV_CONTENT_TYPE);
        response.setHeader(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=" + filename);
        csvWriter.write(page.columns(), page.rows(), response.getOutputStream());
        response.flushBuffer();
    }

    @GetMapping("/{id}")
    public LogRecord get(@PathVariable("id") String id) {
        return service.getById(id);
    }
}
