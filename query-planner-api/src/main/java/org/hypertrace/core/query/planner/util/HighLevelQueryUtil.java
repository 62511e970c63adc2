package org.hypertrace.core.query.planner.util;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;
import org.hypertrace.core.query.planner.api.HighLevelQuery;
import org.hypertrace.core.query.planner.api.TagGroup;
import org.hypertrace.core.query.planner.api.TagPredicate;

/**
 * Utility methods to easily create a {@link HighLevelQuery} and its tag filter.
 */
public class HighLevelQueryUtil {

  /** Converts grouped raw {@code key=value} strings into a tag filter, one group per inner list. */
  public static List<TagGroup> createTagSets(Collection<? extends Collection<String>> rawTagSets) {
    return rawTagSets.stream().map(TagGroup::parse).collect(Collectors.toUnmodifiableList());
  }

  /** Creates a tag group requiring every given {@code key=value} string. */
  public static TagGroup createTagGroup(String... keyValues) {
    return TagGroup.parse(Arrays.asList(keyValues));
  }

  /** Creates a filter matching series tagged with any of the given values for one tag key. */
  public static List<TagGroup> createValueInTagSets(String key, Collection<String> values) {
    return values.stream()
        .map(value -> TagGroup.of(TagPredicate.of(key, value)))
        .collect(Collectors.toUnmodifiableList());
  }

  public static HighLevelQuery.HighLevelQueryBuilder createAggregationQuery(
      String measurementName,
      String fieldName,
      String aggregationType,
      long startMillis,
      long endMillis,
      Duration groupByDuration) {
    return HighLevelQuery.builder()
        .measurementName(measurementName)
        .fieldName(fieldName)
        .aggregationType(aggregationType)
        .timeStart(Instant.ofEpochMilli(startMillis))
        .timeEnd(Instant.ofEpochMilli(endMillis))
        .groupByDuration(groupByDuration);
  }
}
