package org.hypertrace.core.query.planner.validation;

import java.util.Set;
import javax.inject.Inject;
import org.hypertrace.core.query.planner.QueryPlanningException;
import org.hypertrace.core.query.planner.api.HighLevelQuery;

/**
 * Query validator invokes each registered validation, passing only if all of them pass.
 * Validations may be performed in any order. The first failing validation's error is passed to
 * the caller.
 */
public class QueryValidator {
  private final Set<QueryValidation> validations;

  @Inject
  public QueryValidator(Set<QueryValidation> validations) {
    this.validations = validations;
  }

  public void validate(HighLevelQuery query) throws QueryPlanningException {
    for (QueryValidation validation : validations) {
      validation.validate(query);
    }
  }
}
