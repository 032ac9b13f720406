package com.vidnyan.cpg.application.service;

import com.vidnyan.cpg.application.port.in.QueryCodeUseCase;
import com.vidnyan.cpg.application.port.out.QueryRelationProvider;
import com.vidnyan.cpg.config.EngineProperties;
import com.vidnyan.cpg.domain.cache.CacheType;
import com.vidnyan.cpg.domain.common.ErrorCode;
import com.vidnyan.cpg.domain.common.Result;
import com.vidnyan.cpg.domain.query.PerformanceGrade;
import com.vidnyan.cpg.domain.query.QueryExecutor;
import com.vidnyan.cpg.domain.query.QueryMetadata;
import com.vidnyan.cpg.domain.query.QueryOptimizer;
import com.vidnyan.cpg.domain.query.QueryPlan;
import com.vidnyan.cpg.domain.query.QueryResult;
import com.vidnyan.cpg.domain.query.QuerySpec;
import com.vidnyan.cpg.domain.query.Relation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Query engine over analyzed functions and modules.
 * Results are cached in the query cache under the md5 of the normalized plan.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QueryEngineService implements QueryCodeUseCase {

    private final QueryRelationProvider relationProvider;
    private final AnalysisCacheManager cacheManager;
    private final DeadlineExecutor deadlineExecutor;
    private final EngineProperties properties;

    private final AtomicLong executed = new AtomicLong();
    private final AtomicLong cacheHits = new AtomicLong();
    private final AtomicLong totalTimeMs = new AtomicLong();

    @Override
    public Result<QueryPlan> plan(QuerySpec spec) {
        return new QueryOptimizer(properties.getQuery().getAutoLimit()).plan(spec);
    }

    @Override
    public Result<QueryResult> execute(QuerySpec spec) {
        long start = System.nanoTime();
        Result<QueryPlan> planned = plan(spec);
        if (planned.isFailure()) {
            log.debug("Query rejected: {}", planned.error().format());
            return Result.failure(planned.error());
        }
        QueryPlan plan = planned.get();
        if (plan.relation() == Relation.PATTERNS) {
            return Result.failure(ErrorCode.PATTERN_QUERIES_NOT_IMPLEMENTED,
                    "Pattern queries are served by the pattern matcher");
        }
        log.debug("Executing query {} on {} (cost {}, hints {})",
                plan.cacheKey(), plan.relation().wireName(), plan.estimatedCost(), plan.hints());

        Optional<QueryExecutor.Rows> cached = cacheManager.get(CacheType.QUERY, plan.cacheKey(), QueryExecutor.Rows.class);
        QueryExecutor.Rows rows;
        if (cached.isPresent()) {
            rows = cached.get();
            cacheHits.incrementAndGet();
        } else {
            Result<QueryExecutor.Rows> fresh = run(plan);
            if (fresh.isFailure()) {
                log.debug("Query {} failed: {}", plan.cacheKey(), fresh.error().format());
                return Result.failure(fresh.error());
            }
            rows = fresh.get();
            cacheManager.put(CacheType.QUERY, plan.cacheKey(), rows);
        }

        long elapsedMs = elapsedMs(start);
        executed.incrementAndGet();
        totalTimeMs.addAndGet(elapsedMs);

        EngineProperties.Query limits = properties.getQuery();
        QueryMetadata metadata = new QueryMetadata(
                rows.totalCount(),
                elapsedMs,
                cached.isPresent(),
                plan.hints(),
                PerformanceGrade.of(elapsedMs, limits.getExcellentMs(), limits.getGoodMs(), limits.getFairMs()),
                plan.estimatedCost());
        return Result.success(new QueryResult(rows.data(), metadata));
    }

    private Result<QueryExecutor.Rows> run(QueryPlan plan) {
        long timeoutMs = properties.getQuery().getTimeoutMs();
        return deadlineExecutor.call("Query " + plan.cacheKey(), timeoutMs, () -> {
            List<Map<String, Object>> relation = relationProvider.rows(plan.relation());
            return Result.success(QueryExecutor.execute(plan, relation));
        });
    }

    @Override
    public QueryStatistics statistics() {
        long count = executed.get();
        return new QueryStatistics(count, cacheHits.get(), count == 0 ? 0.0 : (double) totalTimeMs.get() / count);
    }

    @Override
    public void invalidateCache() {
        int removed = cacheManager.clear(CacheType.QUERY);
        log.info("Query cache invalidated ({} entries)", removed);
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
