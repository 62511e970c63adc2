package org.hypertrace.core.query.planner.validation;

import static org.hypertrace.core.query.planner.QueryPlannerConfig.BucketCountValidationConfig.BucketCountValidationMode.DISABLED;
import static org.hypertrace.core.query.planner.QueryPlannerConfig.BucketCountValidationConfig.BucketCountValidationMode.ERROR;
import static org.hypertrace.core.query.planner.QueryPlannerConfig.BucketCountValidationConfig.BucketCountValidationMode.WARN;
import static org.hypertrace.core.query.planner.QueryPlannerTestUtils.cpuQuery;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.RETURNS_DEEP_STUBS;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import org.hypertrace.core.query.planner.QueryPlannerConfig;
import org.hypertrace.core.query.planner.QueryPlannerConfig.BucketCountValidationConfig.BucketCountValidationMode;
import org.hypertrace.core.query.planner.QueryPlanningException;
import org.hypertrace.core.query.planner.bucket.BucketAlignment;
import org.hypertrace.core.query.planner.bucket.TimeBucketer;
import org.junit.jupiter.api.Test;

class BucketCountValidationTest {
  private final TimeBucketer timeBucketer = new TimeBucketer(BucketAlignment.EPOCH);

  @Test
  void doesNotValidateIfDisabled() {
    BucketCountValidation validation =
        new BucketCountValidation(buildConfig(10, DISABLED), timeBucketer);
    assertDoesNotThrow(() -> validation.validate(cpuQuery(0, 1000, 1).build()));
  }

  @Test
  void doesNotErrorOnTooManyBucketsIfWarnMode() {
    BucketCountValidation validation =
        new BucketCountValidation(buildConfig(10, WARN), timeBucketer);
    assertDoesNotThrow(() -> validation.validate(cpuQuery(0, 1000, 1).build()));
  }

  @Test
  void allowsBucketCountAtMax() {
    BucketCountValidation validation =
        new BucketCountValidation(buildConfig(10, ERROR), timeBucketer);
    assertDoesNotThrow(() -> validation.validate(cpuQuery(0, 100, 10).build()));
    assertDoesNotThrow(() -> validation.validate(cpuQuery(0, 1000, 0).build()));
  }

  @Test
  void errorsOnTooManyBuckets() {
    BucketCountValidation validation =
        new BucketCountValidation(buildConfig(10, ERROR), timeBucketer);
    // epoch alignment rounds the first bucket down to 0, adding an 11th bucket
    assertThrows(
        QueryPlanningException.class, () -> validation.validate(cpuQuery(5, 105, 10).build()));
  }

  QueryPlannerConfig buildConfig(long max, BucketCountValidationMode mode) {
    QueryPlannerConfig mockConfig = mock(QueryPlannerConfig.class, RETURNS_DEEP_STUBS);
    when(mockConfig.getBucketCountValidationConfig().getMax()).thenReturn(max);
    when(mockConfig.getBucketCountValidationConfig().getMode()).thenReturn(mode);
    return mockConfig;
  }
}
