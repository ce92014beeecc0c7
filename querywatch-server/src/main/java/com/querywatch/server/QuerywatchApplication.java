package com.querywatch.server;

import com.querywatch.service.core.config.QueryLogProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;

@Slf4j
@SpringBootApplication(scanBasePackages = {"com.querywatch"})
public class QuerywatchApplication {

    private final QueryLogProperties properties;

    public QuerywatchApplication(QueryLogProperties properties) {
        this.properties = properties;
    }

    public static void main(String[] args) {
        SpringApplication.run(QuerywatchApplication.class, args);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void logStoreTarget() {
        QueryLogProperties.Store store = properties.getStore();
        log.info(
                "Serving query logs from {} (databases from {}), query timeout {}, max rows {}",
                store.getQueryLogTable(),
                store.getDatabasesTable(),
                store.getQueryTimeout(),
                store.getMaxRows());
    }
}
