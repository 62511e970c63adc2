package org.hypertrace.core.query.planner.validation;

import com.google.inject.AbstractModule;
import com.google.inject.multibindings.Multibinder;

public class QueryValidationModule extends AbstractModule {
  @Override
  protected void configure() {
    Multibinder<QueryValidation> validationMultibinder =
        Multibinder.newSetBinder(binder(), QueryValidation.class);
    validationMultibinder.addBinding().to(TimeRangeValidation.class);
    validationMultibinder.addBinding().to(BucketCountValidation.class);
  }
}
