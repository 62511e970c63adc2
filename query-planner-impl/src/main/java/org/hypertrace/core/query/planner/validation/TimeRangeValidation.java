package org.hypertrace.core.query.planner.validation;

import org.hypertrace.core.query.planner.QueryPlanningException;
import org.hypertrace.core.query.planner.api.HighLevelQuery;

class TimeRangeValidation implements QueryValidation {
  @Override
  public void validate(HighLevelQuery query) throws QueryPlanningException {
    if (query.getTimeEnd().isBefore(query.getTimeStart())) {
      throw new QueryPlanningException(
          String.format(
              "Query end time %s is before its start time %s",
              query.getTimeEnd(), query.getTimeStart()));
    }
    if (query.getGroupByDuration().isNegative()) {
      throw new QueryPlanningException(
          "Query group by duration must not be negative, got: " + query.getGroupByDuration());
    }
  }
}
