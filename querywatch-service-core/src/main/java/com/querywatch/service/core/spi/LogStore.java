package com.querywatch.service.core.spi;

import com.querywatch.service.core.query.BuiltQuery;
import java.util.List;

/**
 * Executes parameterized read queries against the query-log store. Rows come back positionally, in
 * the order of the query's SELECT list, with driver-native values left undecoded.
 */
public interface LogStore {

    List<Object[]> fetch(BuiltQuery query);

    /** Cheap round trip used by readiness checks. */
    void ping();
}
