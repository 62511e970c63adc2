package org.hypertrace.core.query.planner.catalog;

import java.util.List;

/**
 * Registry of the series known to exist in storage, consulted when planning instead of asking
 * storage for its metadata.
 */
public interface SeriesCatalog {

  /**
   * Returns an immutable copy of the registered series. Later registrations are not visible in a
   * snapshot already taken.
   */
  List<Series> snapshot();
}
