package org.hypertrace.core.query.planner.util;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.hypertrace.core.query.planner.api.HighLevelQuery;
import org.hypertrace.core.query.planner.api.TagGroup;
import org.hypertrace.core.query.planner.api.TagPredicate;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class HighLevelQueryUtilTest {
  @Test
  public void testCreateTagSets() {
    List<TagGroup> tagSets =
        HighLevelQueryUtil.createTagSets(List.of(List.of("a=1", "b=2"), List.of("c=3")));
    Assertions.assertEquals(
        List.of(
            TagGroup.of(TagPredicate.of("a", "1"), TagPredicate.of("b", "2")),
            TagGroup.of(TagPredicate.of("c", "3"))),
        tagSets);
  }

  @Test
  public void testCreateValueInTagSets() {
    List<TagGroup> tagSets =
        HighLevelQueryUtil.createValueInTagSets("hostname", List.of("host_1", "host_7"));
    Assertions.assertEquals(2, tagSets.size());
    Assertions.assertEquals(
        TagGroup.of(TagPredicate.of("hostname", "host_7")), tagSets.get(1));
  }

  @Test
  public void testCreateAggregationQuery() {
    HighLevelQuery query =
        HighLevelQueryUtil.createAggregationQuery(
                "cpu", "usage_user", "max", 0L, 3_600_000L, Duration.ofMinutes(1))
            .tagSet(HighLevelQueryUtil.createTagGroup("hostname=host_3"))
            .build();

    Assertions.assertEquals("cpu", query.getMeasurementName());
    Assertions.assertEquals("usage_user", query.getFieldName());
    Assertions.assertEquals("max", query.getAggregationType());
    Assertions.assertEquals(Instant.EPOCH, query.getTimeStart());
    Assertions.assertEquals(Instant.ofEpochSecond(3600), query.getTimeEnd());
    Assertions.assertEquals(Duration.ofMinutes(1), query.getGroupByDuration());
    Assertions.assertEquals(1, query.getTagSets().size());
  }
}
