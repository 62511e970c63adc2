package org.hypertrace.core.query.planner.api;

import java.util.List;
import lombok.NonNull;
import lombok.Value;

/**
 * A prepared statement and the params to bind to it. The statement text carries the aggregation
 * and the table name, while the series id and the time bounds are always bound params, so one
 * statement can be prepared once and executed for many series and buckets.
 */
@Value(staticConstructor = "of")
public class LowLevelQuery {

  @NonNull String preparableStatement;
  @NonNull Params params;

  public List<Object> getArguments() {
    return params.getArguments();
  }
}
