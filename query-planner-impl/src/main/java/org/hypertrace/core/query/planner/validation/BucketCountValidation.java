package org.hypertrace.core.query.planner.validation;

import javax.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.hypertrace.core.query.planner.QueryPlannerConfig;
import org.hypertrace.core.query.planner.QueryPlannerConfig.BucketCountValidationConfig;
import org.hypertrace.core.query.planner.QueryPlanningException;
import org.hypertrace.core.query.planner.api.HighLevelQuery;
import org.hypertrace.core.query.planner.bucket.TimeBucketer;

/** Bounds the planning cost of a query by the number of GROUP BY buckets it produces. */
@Slf4j
class BucketCountValidation implements QueryValidation {

  private final BucketCountValidationConfig config;
  private final TimeBucketer timeBucketer;

  @Inject
  BucketCountValidation(QueryPlannerConfig queryPlannerConfig, TimeBucketer timeBucketer) {
    this.config = queryPlannerConfig.getBucketCountValidationConfig();
    this.timeBucketer = timeBucketer;
  }

  @Override
  public void validate(HighLevelQuery query) throws QueryPlanningException {
    switch (config.getMode()) {
      case ERROR:
        long bucketCount = countBuckets(query);
        if (isInvalidBucketCount(bucketCount)) {
          throw new QueryPlanningException(generateErrorMessageForBucketCount(bucketCount));
        }
        return;
      case WARN:
        bucketCount = countBuckets(query);
        if (isInvalidBucketCount(bucketCount)) {
          log.warn(
              generateErrorMessageForBucketCount(bucketCount) + ". Allowing due to warn mode.{}{}",
              System.lineSeparator(),
              query);
        }
        return;
      case DISABLED:
      default:
        break;
    }
  }

  private long countBuckets(HighLevelQuery query) throws QueryPlanningException {
    return timeBucketer.countBuckets(
        query.getTimeStart(), query.getTimeEnd(), query.getGroupByDuration());
  }

  private String generateErrorMessageForBucketCount(long bucketCount) {
    return String.format(
        "Query would produce %s time buckets, at most %s are allowed",
        bucketCount, config.getMax());
  }

  private boolean isInvalidBucketCount(long bucketCount) {
    return bucketCount > config.getMax();
  }
}
