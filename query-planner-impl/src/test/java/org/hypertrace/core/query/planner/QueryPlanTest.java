package org.hypertrace.core.query.planner;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.hypertrace.core.query.planner.api.LowLevelQuery;
import org.hypertrace.core.query.planner.api.Params;
import org.hypertrace.core.query.planner.api.TimeInterval;
import org.junit.jupiter.api.Test;

class QueryPlanTest {

  private static final LowLevelQuery CPU_QUERY =
      LowLevelQuery.of(
          "SELECT sum(value) FROM cpu WHERE series_id = ? AND timestamp_ns >= ? AND timestamp_ns < ?",
          Params.newBuilder().addStringParam("s1").addLongParam(0L).addLongParam(60L).build());
  private static final LowLevelQuery MEM_QUERY =
      LowLevelQuery.of(
          "SELECT sum(value) FROM mem WHERE series_id = ? AND timestamp_ns >= ? AND timestamp_ns < ?",
          Params.newBuilder().addStringParam("s2").addLongParam(0L).addLongParam(60L).build());

  @Test
  public void testAccessors() throws QueryPlanningException {
    Map<TimeInterval, List<LowLevelQuery>> buckets = new HashMap<>();
    buckets.put(TimeInterval.ofEpochNanos(60, 120), List.of());
    buckets.put(TimeInterval.ofEpochNanos(0, 60), List.of(CPU_QUERY, MEM_QUERY));

    QueryPlan plan = QueryPlan.create("sum", buckets);

    assertEquals("sum", plan.getAggregationType());
    assertEquals(
        List.of(TimeInterval.ofEpochNanos(0, 60), TimeInterval.ofEpochNanos(60, 120)),
        new ArrayList<>(plan.getBuckets()));
    assertEquals(2, plan.getQueryCount());
    assertTrue(plan.getQueries(TimeInterval.ofEpochNanos(60, 120)).isEmpty());
    assertTrue(plan.getQueries(TimeInterval.ofEpochNanos(500, 600)).isEmpty());
    assertEquals(
        Set.of(CPU_QUERY.getPreparableStatement(), MEM_QUERY.getPreparableStatement()),
        plan.getDistinctStatements());
  }

  @Test
  public void testPlanIsDetachedFromInput() throws QueryPlanningException {
    List<LowLevelQuery> queries = new ArrayList<>(List.of(CPU_QUERY));
    Map<TimeInterval, List<LowLevelQuery>> buckets = new HashMap<>();
    buckets.put(TimeInterval.ofEpochNanos(0, 60), queries);

    QueryPlan plan = QueryPlan.create("sum", buckets);
    queries.add(MEM_QUERY);
    buckets.put(TimeInterval.ofEpochNanos(60, 120), List.of());

    assertEquals(1, plan.getBuckets().size());
    assertEquals(List.of(CPU_QUERY), plan.getQueries(TimeInterval.ofEpochNanos(0, 60)));
    assertThrows(
        UnsupportedOperationException.class,
        () -> plan.getQueries(TimeInterval.ofEpochNanos(0, 60)).add(MEM_QUERY));
  }

  @Test
  public void testOverlappingBucketsAreRejected() {
    Map<TimeInterval, List<LowLevelQuery>> buckets =
        Map.of(TimeInterval.ofEpochNanos(0, 60), List.of(), TimeInterval.ofEpochNanos(30, 90), List.of());

    assertThrows(QueryPlanningException.class, () -> QueryPlan.create("sum", buckets));
  }

  @Test
  public void testMalformedBucketIsRejected() {
    Map<TimeInterval, List<LowLevelQuery>> buckets =
        Map.of(TimeInterval.ofEpochNanos(60, 0), List.of());

    assertThrows(QueryPlanningException.class, () -> QueryPlan.create("sum", buckets));
  }

  @Test
  public void testSingleDegenerateBucket() throws QueryPlanningException {
    QueryPlan plan = QueryPlan.create("sum", Map.of(TimeInterval.ofEpochNanos(5, 5), List.of()));

    assertEquals(Set.of(TimeInterval.ofEpochNanos(5, 5)), plan.getBuckets());
  }
}
