package org.hypertrace.core.query.planner.validation;

import org.hypertrace.core.query.planner.QueryPlanningException;
import org.hypertrace.core.query.planner.api.HighLevelQuery;

public interface QueryValidation {
  void validate(HighLevelQuery query) throws QueryPlanningException;
}
