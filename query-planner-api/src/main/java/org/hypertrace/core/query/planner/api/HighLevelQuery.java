package org.hypertrace.core.query.planner.api;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A high-level aggregation query, usually produced by a bulk query generator, e.g. "the average
 * usage_user of cpu for hosts 1 or 2, per minute, over the last hour".
 *
 * <p>The tag filter is a list of {@link TagGroup}s: predicates inside a group are ANDed and the
 * groups are ORed. An empty filter matches every series.
 */
@Value
@Builder(toBuilder = true)
public class HighLevelQuery {

  // Reporting only
  String humanLabel;
  String humanDescription;
  long id;

  /** e.g. "cpu" */
  @NonNull String measurementName;
  /** e.g. "usage_user" */
  @NonNull String fieldName;
  /** e.g. "avg" or "sum", used literally in the generated statements. */
  @NonNull String aggregationType;

  @NonNull Instant timeStart;
  @NonNull Instant timeEnd;

  /** Width of the GROUP BY time buckets. Zero means the whole range is a single bucket. */
  @NonNull @Builder.Default Duration groupByDuration = Duration.ZERO;

  @Singular List<TagGroup> tagSets;

  public TimeInterval getTimeRange() {
    return TimeInterval.of(timeStart, timeEnd);
  }
}
