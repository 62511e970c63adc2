package org.hypertrace.core.query.planner;

/**
 * Raised when a query cannot be planned: an invalid time range, a bucket computation that
 * overflows, or an inconsistent plan. A query that matches no series is not an error.
 */
public class QueryPlanningException extends Exception {

  public QueryPlanningException(String message) {
    super(message);
  }

  public QueryPlanningException(String message, Throwable cause) {
    super(message, cause);
  }
}
