package com.vidnyan.cpg.application.port.in;

import com.vidnyan.cpg.domain.common.Result;
import com.vidnyan.cpg.domain.query.QueryPlan;
import com.vidnyan.cpg.domain.query.QueryResult;
import com.vidnyan.cpg.domain.query.QuerySpec;

/**
 * Declarative queries over analyzed functions and modules.
 */
public interface QueryCodeUseCase {

    /**
     * Validate, optimize and run a query, serving repeated plans from the query cache.
     */
    Result<QueryResult> execute(QuerySpec spec);

    /**
     * Validate and optimize without running.
     */
    Result<QueryPlan> plan(QuerySpec spec);

    QueryStatistics statistics();

    void invalidateCache();

    record QueryStatistics(long executed, long cacheHits, double averageTimeMs) {}
}
