package org.hypertrace.core.query.planner.catalog;

import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import org.hypertrace.core.query.planner.api.TagGroup;
import org.hypertrace.core.query.planner.api.TimeInterval;

/**
 * A physical series known to hold data: one measurement, field and tag combination stored under
 * a row id in a table, over a known time window.
 */
@Value
@Builder
public class Series {

  /** Storage table holding the series rows, e.g. "measurements_2016_01_01" */
  @NonNull String table;
  /** Row key of the series inside its table */
  @NonNull String id;

  @NonNull String measurementName;
  @NonNull String fieldName;
  @Singular Map<String, String> tags;

  /** Window in which the series is known to contain data */
  @NonNull TimeInterval timeInterval;

  public boolean matchesMeasurementName(String name) {
    return measurementName.equals(name);
  }

  public boolean matchesFieldName(String name) {
    return fieldName.equals(name);
  }

  /**
   * Matches when any one of the groups is fully satisfied by this series' tags. An empty list
   * of groups matches every series.
   */
  public boolean matchesTagSets(List<TagGroup> tagSets) {
    if (tagSets.isEmpty()) {
      return true;
    }
    for (TagGroup group : tagSets) {
      if (group.test(tags)) {
        return true;
      }
    }
    return false;
  }

  public boolean matchesTimeInterval(TimeInterval interval) {
    return timeInterval.overlaps(interval);
  }
}
