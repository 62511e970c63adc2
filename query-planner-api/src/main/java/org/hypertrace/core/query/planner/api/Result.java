package org.hypertrace.core.query.planner.api;

import lombok.NonNull;
import lombok.Value;

/** The aggregate computed for one GROUP BY bucket by whatever executed the plan. */
@Value(staticConstructor = "of")
public class Result {

  @NonNull TimeInterval timeInterval;
  double value;

  @Override
  public String toString() {
    return timeInterval + ": " + value;
  }
}
