package com.querywatch.service.core.query;

import java.util.List;

/**
 * Query text with positional {@code ?} placeholders and the arguments bound to them, in placeholder
 * order.
 */
public record BuiltQuery(String sql, List<Object> args) {

    public BuiltQuery {
        args = List.copyOf(args);
    }

    public Object[] argArray() {
        return args.toArray();
    }
}
