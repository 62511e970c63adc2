package org.hypertrace.core.query.planner.api;

import com.google.common.collect.ImmutableSet;
import java.util.Collection;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.Value;

/**
 * A conjunction of tag predicates. A query's tag filter is a list of groups which are ORed
 * together, so a tag set matches the filter when at least one group is fully satisfied.
 */
@Value
public class TagGroup {

  Set<TagPredicate> predicates;

  private TagGroup(Collection<TagPredicate> predicates) {
    this.predicates = ImmutableSet.copyOf(predicates);
  }

  public static TagGroup of(TagPredicate... predicates) {
    return new TagGroup(ImmutableSet.copyOf(predicates));
  }

  public static TagGroup of(Collection<TagPredicate> predicates) {
    return new TagGroup(predicates);
  }

  /** Builds a group from raw {@code key=value} strings. */
  public static TagGroup parse(Collection<String> keyValues) {
    return new TagGroup(
        keyValues.stream().map(TagPredicate::parse).collect(Collectors.toList()));
  }

  /** A group without predicates is satisfied by any tag set. */
  public boolean test(Map<String, String> tags) {
    return predicates.stream().allMatch(predicate -> predicate.test(tags));
  }

  @Override
  public String toString() {
    return predicates.toString();
  }
}
