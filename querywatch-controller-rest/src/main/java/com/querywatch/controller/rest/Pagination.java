package com.querywatch.controller.rest;

public record Pagination(int limit, long offset, int count) {}
