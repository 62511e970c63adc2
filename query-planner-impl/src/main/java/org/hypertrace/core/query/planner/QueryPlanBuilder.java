package org.hypertrace.core.query.planner;

import static org.hypertrace.core.query.planner.utils.TimeUtil.toEpochNanos;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.hypertrace.core.query.planner.api.HighLevelQuery;
import org.hypertrace.core.query.planner.api.LowLevelQuery;
import org.hypertrace.core.query.planner.api.TimeInterval;
import org.hypertrace.core.query.planner.bucket.TimeBucketer;
import org.hypertrace.core.query.planner.catalog.Series;
import org.hypertrace.core.query.planner.cql.CqlQueryConverter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Combines a {@link HighLevelQuery} with a snapshot of the known series to produce a {@link
 * QueryPlan}: one statement per matching series for every GROUP BY bucket the series has data in.
 */
@Singleton
public class QueryPlanBuilder {

  private static final Logger LOG = LoggerFactory.getLogger(QueryPlanBuilder.class);

  private final TimeBucketer timeBucketer;
  private final CqlQueryConverter queryConverter;
  private final boolean clampToQueryRange;

  @Inject
  public QueryPlanBuilder(
      TimeBucketer timeBucketer, CqlQueryConverter queryConverter, QueryPlannerConfig config) {
    this.timeBucketer = timeBucketer;
    this.queryConverter = queryConverter;
    this.clampToQueryRange = config.getPlannerConfig().isClampToQueryRange();
  }

  public QueryPlan build(HighLevelQuery query, List<Series> seriesChoices)
      throws QueryPlanningException {
    List<TimeInterval> buckets =
        timeBucketer.bucket(query.getTimeStart(), query.getTimeEnd(), query.getGroupByDuration());

    // Every bucket is kept, even if no series ends up in it, so empty buckets read as "no data".
    Map<TimeInterval, List<Series>> bucketedSeries = new LinkedHashMap<>();
    for (TimeInterval bucket : buckets) {
      bucketedSeries.put(bucket, new ArrayList<>());
    }

    for (Series series : seriesChoices) {
      // quick skip if the series doesn't match at all
      if (!series.matchesMeasurementName(query.getMeasurementName())) {
        continue;
      }
      if (!series.matchesFieldName(query.getFieldName())) {
        continue;
      }
      if (!series.matchesTagSets(query.getTagSets())) {
        continue;
      }

      for (TimeInterval bucket : buckets) {
        if (series.matchesTimeInterval(bucket)) {
          bucketedSeries.get(bucket).add(series);
        }
      }
    }

    TimeInterval queryRange = query.getTimeRange();
    Map<TimeInterval, List<LowLevelQuery>> bucketedQueries =
        new LinkedHashMap<>(bucketedSeries.size());
    for (Entry<TimeInterval, List<Series>> entry : bucketedSeries.entrySet()) {
      TimeInterval bucket = entry.getKey();
      // Narrowing the outer buckets to the query range matches InfluxQL rounded GROUP BY time
      // boundaries.
      TimeInterval bounds = clampToQueryRange ? bucket.clampTo(queryRange) : bucket;
      long startNanos;
      long endNanos;
      try {
        startNanos = toEpochNanos(bounds.getStart());
        endNanos = toEpochNanos(bounds.getEnd());
      } catch (ArithmeticException e) {
        throw new QueryPlanningException(
            "Time bucket is out of the representable range: " + bucket, e);
      }

      List<LowLevelQuery> queries = new ArrayList<>(entry.getValue().size());
      for (Series series : entry.getValue()) {
        queries.add(
            queryConverter.toLowLevelQuery(
                query.getAggregationType(),
                series.getTable(),
                series.getId(),
                startNanos,
                endNanos));
      }
      bucketedQueries.put(bucket, queries);
    }

    QueryPlan plan = QueryPlan.create(query.getAggregationType(), bucketedQueries);
    if (LOG.isDebugEnabled()) {
      LOG.debug(
          "Planned query id: {}, label: {} over {} series into {}",
          query.getId(),
          query.getHumanLabel(),
          seriesChoices.size(),
          plan);
    }
    return plan;
  }
}
