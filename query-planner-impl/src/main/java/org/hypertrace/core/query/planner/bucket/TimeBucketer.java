package org.hypertrace.core.query.planner.bucket;

import static org.hypertrace.core.query.planner.utils.TimeUtil.fromEpochNanos;
import static org.hypertrace.core.query.planner.utils.TimeUtil.toEpochNanos;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.hypertrace.core.query.planner.QueryPlannerConfig;
import org.hypertrace.core.query.planner.QueryPlanningException;
import org.hypertrace.core.query.planner.api.TimeInterval;

/**
 * Splits a query time range into the GROUP BY time buckets that cover it. Buckets are ordered,
 * contiguous and never overlap. The last bucket keeps its full width even when it runs past the
 * end of the range; narrowing it is left to whoever binds the bucket into a statement.
 */
@Singleton
public class TimeBucketer {

  private final BucketAlignment alignment;

  @Inject
  public TimeBucketer(QueryPlannerConfig config) {
    this(config.getPlannerConfig().getBucketAlignment());
  }

  public TimeBucketer(BucketAlignment alignment) {
    this.alignment = alignment;
  }

  public BucketAlignment getAlignment() {
    return alignment;
  }

  /**
   * Returns the buckets covering [start, end]. A zero width, or an empty range, yields the single
   * bucket [start, end].
   */
  public List<TimeInterval> bucket(Instant start, Instant end, Duration width)
      throws QueryPlanningException {
    checkRange(start, end, width);
    if (width.isZero() || start.equals(end)) {
      return Collections.singletonList(TimeInterval.of(start, end));
    }

    try {
      long widthNanos = width.toNanos();
      long endNanos = toEpochNanos(end);
      List<TimeInterval> buckets = new ArrayList<>();
      for (long bucketStart = firstBucketStart(toEpochNanos(start), widthNanos);
          bucketStart < endNanos;
          bucketStart = Math.addExact(bucketStart, widthNanos)) {
        buckets.add(
            TimeInterval.of(
                fromEpochNanos(bucketStart),
                fromEpochNanos(Math.addExact(bucketStart, widthNanos))));
      }
      return buckets;
    } catch (ArithmeticException e) {
      throw new QueryPlanningException(
          String.format(
              "Time range [%s, %s] with bucket width %s is out of the representable range",
              start, end, width),
          e);
    }
  }

  /** Number of buckets {@link #bucket} would produce, without materializing them. */
  public long countBuckets(Instant start, Instant end, Duration width)
      throws QueryPlanningException {
    checkRange(start, end, width);
    if (width.isZero() || start.equals(end)) {
      return 1;
    }
    try {
      long widthNanos = width.toNanos();
      long span =
          Math.subtractExact(
              toEpochNanos(end), firstBucketStart(toEpochNanos(start), widthNanos));
      return span / widthNanos + (span % widthNanos == 0 ? 0 : 1);
    } catch (ArithmeticException e) {
      throw new QueryPlanningException(
          String.format(
              "Time range [%s, %s] with bucket width %s is out of the representable range",
              start, end, width),
          e);
    }
  }

  private long firstBucketStart(long startNanos, long widthNanos) {
    switch (alignment) {
      case EPOCH:
        return Math.subtractExact(startNanos, Math.floorMod(startNanos, widthNanos));
      case QUERY_START:
      default:
        return startNanos;
    }
  }

  private static void checkRange(Instant start, Instant end, Duration width)
      throws QueryPlanningException {
    if (end.isBefore(start)) {
      throw new QueryPlanningException(
          String.format("Time range end %s is before its start %s", end, start));
    }
    if (width.isNegative()) {
      throw new QueryPlanningException(
          String.format("Bucket width must not be negative, got: %s", width));
    }
  }
}
