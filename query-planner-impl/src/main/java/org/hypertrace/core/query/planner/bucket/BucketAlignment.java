package org.hypertrace.core.query.planner.bucket;

/** Where GROUP BY bucket boundaries are anchored. */
public enum BucketAlignment {
  /**
   * Boundaries fall on multiples of the bucket width since the Unix epoch, the "rounded GROUP BY
   * time boundaries" of InfluxQL. The first bucket may start before the query.
   */
  EPOCH,
  /** The first bucket starts exactly at the query start. */
  QUERY_START
}
