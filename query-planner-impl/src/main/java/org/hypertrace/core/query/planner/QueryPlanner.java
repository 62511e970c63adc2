package org.hypertrace.core.query.planner;

import com.google.common.collect.ImmutableList;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import java.util.List;
import javax.inject.Inject;
import javax.inject.Singleton;
import lombok.extern.slf4j.Slf4j;
import org.hypertrace.core.query.planner.api.HighLevelQuery;
import org.hypertrace.core.query.planner.catalog.Series;
import org.hypertrace.core.query.planner.catalog.SeriesCatalog;
import org.hypertrace.core.query.planner.validation.QueryValidator;

/**
 * Entry point for planning: validates a {@link HighLevelQuery} and turns it into a {@link
 * QueryPlan} over the series of a catalog.
 *
 * <p>Holds no per-query state, so one instance may plan concurrently for many workers.
 */
@Singleton
@Slf4j
public class QueryPlanner {

  private static final String PLANNER_REQUESTS_STATUS_COUNTER =
      "hypertrace.query.planner.requests.status";

  private final QueryValidator queryValidator;
  private final QueryPlanBuilder queryPlanBuilder;

  private final Counter planErrorCounter;
  private final Counter planSuccessCounter;

  @Inject
  public QueryPlanner(QueryValidator queryValidator, QueryPlanBuilder queryPlanBuilder) {
    this.queryValidator = queryValidator;
    this.queryPlanBuilder = queryPlanBuilder;
    this.planErrorCounter = Metrics.counter(PLANNER_REQUESTS_STATUS_COUNTER, "error", "true");
    this.planSuccessCounter = Metrics.counter(PLANNER_REQUESTS_STATUS_COUNTER, "error", "false");
  }

  /** Plans the query over a snapshot of the catalog taken at the time of the call. */
  public QueryPlan plan(HighLevelQuery query, SeriesCatalog catalog)
      throws QueryPlanningException {
    return plan(query, catalog.snapshot());
  }

  /**
   * Plans the query over an already taken snapshot. The snapshot must not change while planning.
   */
  public QueryPlan plan(HighLevelQuery query, List<Series> catalogSnapshot)
      throws QueryPlanningException {
    try {
      queryValidator.validate(query);
      QueryPlan plan = queryPlanBuilder.build(query, ImmutableList.copyOf(catalogSnapshot));
      planSuccessCounter.increment();
      return plan;
    } catch (QueryPlanningException e) {
      log.error("Query planning failed: {}", query, e);
      planErrorCounter.increment();
      throw e;
    }
  }
}
