package com.querywatch.service.storage.config;

import com.querywatch.service.core.config.QueryLogProperties;
import javax.sql.DataSource;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

@Configuration
@ConditionalOnClass(JdbcTemplate.class)
public class JdbcConfig {

    /** Every store call carries the configured deadline and row ceiling. */
    @Bean
    @ConditionalOnMissingBean
    public JdbcTemplate jdbcTemplate(DataSource dataSource, QueryLogProperties properties) {
        QueryLogProperties.Store store = properties.getStore();
        JdbcTemplate jdbc = new JdbcTemplate(dataSource);
        jdbc.setQueryTimeout((int) Math.max(1, store.getQueryTimeout().toSeconds()));
        jdbc.setMaxRows(store.getMaxRows());
        return jdbc;
    }
}
