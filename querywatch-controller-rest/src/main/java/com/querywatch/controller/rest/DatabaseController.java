package com.querywatch.controller.rest;

import com.querywatch.service.core.service.QueryLogRetrievalService;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/databases")
@RequiredArgsConstructor
public class DatabaseController {
    private final QueryLogRetrievalService service;

    @GetMapping
    public Map<String, List<String>> list() {
        return Map.of("databases", service.listDatabases());
    }
}
