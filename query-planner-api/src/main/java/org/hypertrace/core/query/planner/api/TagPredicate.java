package org.hypertrace.core.query.planner.api;

import com.google.common.base.Preconditions;
import java.util.Map;
import lombok.NonNull;
import lombok.Value;

/** Exact match of a single tag key against a value, e.g. {@code hostname=host_1}. */
@Value(staticConstructor = "of")
public class TagPredicate {

  private static final char SEPARATOR = '=';

  @NonNull String key;
  @NonNull String value;

  /** Parses the {@code key=value} form emitted by query generators. */
  public static TagPredicate parse(String keyValue) {
    int index = keyValue.indexOf(SEPARATOR);
    Preconditions.checkArgument(
        index > 0, "Tag predicate must be of the form key=value, got: %s", keyValue);
    return of(keyValue.substring(0, index), keyValue.substring(index + 1));
  }

  public boolean test(Map<String, String> tags) {
    return value.equals(tags.get(key));
  }

  @Override
  public String toString() {
    return key + SEPARATOR + value;
  }
}
