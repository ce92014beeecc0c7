package com.querywatch.controller.rest.config;

import com.querywatch.service.core.config.QueryLogProperties;
import java.time.Clock;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
@RequiredArgsConstructor
public class RestApiConfig implements WebMvcConfigurer {
    private final QueryLogProperties properties;

    /** Lets the browser dashboards on the configured origins call the API. */
    @Override
    public void addCorsMappings(CorsRegistry registry) {
        QueryLogProperties.Cors cors = properties.getApi().getCors();
        registry.addMapping("/**")
                .allowedOrigins(cors.getAllowedOrigins().toArray(String[]::new))
                .allowedMethods(cors.getAllowedMethods().toArray(String[]::new))
                .allowedHeaders("*")
                .allowCredentials(cors.isAllowCredentials());
    }

    /** Stamps export filenames. */
    @Bean
    @ConditionalOnMissingBean
    public Clock systemUtcClock() {
        return Clock.systemUTC();
    }
}
