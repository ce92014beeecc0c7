package com.querywatch.controller.rest;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

/** Listing envelope. {@code columns} is present only for projected listings. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record QueryLogListResponse(List<?> data, List<String> columns, Pagination pagination) {}
