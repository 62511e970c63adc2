package org.hypertrace.core.query.planner;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Set;
import java.util.stream.Collectors;
import org.hypertrace.core.query.planner.api.LowLevelQuery;
import org.hypertrace.core.query.planner.api.TimeInterval;

/**
 * The statements needed to answer one high-level query, grouped by GROUP BY time bucket. Every
 * bucket of the query is present, including those without any statement, so that executing the
 * plan can tell an empty bucket from a missing one.
 */
public class QueryPlan {

  private static final Comparator<TimeInterval> BUCKET_ORDER =
      Comparator.comparing(TimeInterval::getStart).thenComparing(TimeInterval::getEnd);

  private final String aggregationType;
  private final Map<TimeInterval, List<LowLevelQuery>> bucketedQueries;

  private QueryPlan(
      String aggregationType, Map<TimeInterval, List<LowLevelQuery>> bucketedQueries) {
    this.aggregationType = aggregationType;
    this.bucketedQueries = bucketedQueries;
  }

  /**
   * Creates a plan from its buckets. Fails if a bucket ends before it starts or if two buckets
   * overlap.
   */
  public static QueryPlan create(
      String aggregationType, Map<TimeInterval, List<LowLevelQuery>> bucketedQueries)
      throws QueryPlanningException {
    ImmutableSortedMap.Builder<TimeInterval, List<LowLevelQuery>> builder =
        ImmutableSortedMap.orderedBy(BUCKET_ORDER);
    for (Entry<TimeInterval, List<LowLevelQuery>> entry : bucketedQueries.entrySet()) {
      if (entry.getKey().isInverted()) {
        throw new QueryPlanningException("Malformed time bucket: " + entry.getKey());
      }
      builder.put(entry.getKey(), ImmutableList.copyOf(entry.getValue()));
    }
    ImmutableSortedMap<TimeInterval, List<LowLevelQuery>> sorted = builder.build();

    TimeInterval previous = null;
    for (TimeInterval bucket : sorted.keySet()) {
      if (previous != null && previous.overlaps(bucket)) {
        throw new QueryPlanningException(
            String.format("Time buckets %s and %s overlap", previous, bucket));
      }
      previous = bucket;
    }
    return new QueryPlan(aggregationType, sorted);
  }

  public String getAggregationType() {
    return aggregationType;
  }

  /** Buckets ordered by start time. */
  public Set<TimeInterval> getBuckets() {
    return bucketedQueries.keySet();
  }

  /** The statements of a bucket, empty for an unknown bucket. */
  public List<LowLevelQuery> getQueries(TimeInterval bucket) {
    return bucketedQueries.getOrDefault(bucket, ImmutableList.of());
  }

  public Map<TimeInterval, List<LowLevelQuery>> getBucketedQueries() {
    return bucketedQueries;
  }

  public int getQueryCount() {
    return bucketedQueries.values().stream().mapToInt(List::size).sum();
  }

  /** The distinct statement texts of the plan, to prepare each of them once before executing. */
  public Set<String> getDistinctStatements() {
    return bucketedQueries.values().stream()
        .flatMap(List::stream)
        .map(LowLevelQuery::getPreparableStatement)
        .collect(Collectors.toUnmodifiableSet());
  }

  @Override
  public String toString() {
    return "QueryPlan{"
        + "aggregationType='"
        + aggregationType
        + '\''
        + ", buckets="
        + bucketedQueries.size()
        + ", queries="
        + getQueryCount()
        + '}';
  }
}
