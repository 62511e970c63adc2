package org.hypertrace.core.query.planner;

import com.google.inject.AbstractModule;
import com.typesafe.config.Config;
import org.hypertrace.core.query.planner.validation.QueryValidationModule;

public class QueryPlannerModule extends AbstractModule {

  private final QueryPlannerConfig config;

  public QueryPlannerModule(Config config) {
    this(new QueryPlannerConfig(config));
  }

  QueryPlannerModule(QueryPlannerConfig config) {
    this.config = config;
  }

  @Override
  protected void configure() {
    bind(QueryPlannerConfig.class).toInstance(this.config);
    install(new QueryValidationModule());
  }
}
