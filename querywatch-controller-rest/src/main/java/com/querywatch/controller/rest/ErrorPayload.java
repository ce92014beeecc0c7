package com.querywatch.controller.rest;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;

/** Structured error envelope: a machine-readable {@code error} kind plus a human message. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorPayload(String error, String message, String path, Instant timestamp) {}
