package org.hypertrace.core.query.planner.utils;

import java.time.Instant;
import java.util.concurrent.TimeUnit;

public class TimeUtil {

  private static final long NANOS_PER_SECOND = TimeUnit.SECONDS.toNanos(1);

  /**
   * Nanoseconds since the Unix epoch. Throws {@link ArithmeticException} outside of the years
   * 1677 to 2262, which a signed 64 bit nanosecond count cannot represent.
   */
  public static long toEpochNanos(Instant instant) {
    return Math.addExact(
        Math.multiplyExact(instant.getEpochSecond(), NANOS_PER_SECOND), instant.getNano());
  }

  public static Instant fromEpochNanos(long epochNanos) {
    return Instant.ofEpochSecond(0, epochNanos);
  }
}
