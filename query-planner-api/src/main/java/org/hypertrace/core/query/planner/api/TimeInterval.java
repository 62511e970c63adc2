package org.hypertrace.core.query.planner.api;

import static java.util.Objects.requireNonNull;

import java.time.Duration;
import java.time.Instant;
import lombok.Value;

/**
 * A time range [start, end) used both for GROUP BY buckets and for the window over which a
 * series holds data. Equality is over (start, end) so intervals can key a map.
 *
 * <p>A zero length interval [t, t] is treated as the instant t when testing overlap.
 */
@Value
public class TimeInterval {

  Instant start;
  Instant end;

  private TimeInterval(Instant start, Instant end) {
    this.start = requireNonNull(start, "start");
    this.end = requireNonNull(end, "end");
  }

  public static TimeInterval of(Instant start, Instant end) {
    return new TimeInterval(start, end);
  }

  public static TimeInterval ofEpochNanos(long startNanos, long endNanos) {
    return new TimeInterval(Instant.EPOCH.plusNanos(startNanos), Instant.EPOCH.plusNanos(endNanos));
  }

  public Duration duration() {
    return Duration.between(start, end);
  }

  public boolean isEmpty() {
    return start.equals(end);
  }

  /** True if start is after end; such an interval is never produced by the planner. */
  public boolean isInverted() {
    return start.isAfter(end);
  }

  public boolean contains(Instant instant) {
    return !instant.isBefore(start) && instant.isBefore(end);
  }

  /** Returns whether the two intervals have a non-empty intersection. */
  public boolean overlaps(TimeInterval other) {
    if (isEmpty()) {
      return other.isEmpty() ? start.equals(other.start) : other.contains(start);
    }
    if (other.isEmpty()) {
      return contains(other.start);
    }
    return start.isBefore(other.end) && other.start.isBefore(end);
  }

  /**
   * Narrows this interval to the given range: the start is raised to the range start and the end
   * lowered to the range end where they fall outside of it.
   */
  public TimeInterval clampTo(TimeInterval range) {
    Instant clampedStart = start.isBefore(range.start) ? range.start : start;
    Instant clampedEnd = end.isAfter(range.end) ? range.end : end;
    if (clampedStart.equals(start) && clampedEnd.equals(end)) {
      return this;
    }
    return new TimeInterval(clampedStart, clampedEnd);
  }

  @Override
  public String toString() {
    return "[" + start + ", " + end + ")";
  }
}
