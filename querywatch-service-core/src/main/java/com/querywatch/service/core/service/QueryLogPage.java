package com.querywatch.service.core.service;

import com.querywatch.service.core.model.LogRecord;
import java.util.List;

public record QueryLogPage(List<LogRecord> records, int count) {
    public QueryLogPage {
        records = List.copyOf(records);
    }
}
