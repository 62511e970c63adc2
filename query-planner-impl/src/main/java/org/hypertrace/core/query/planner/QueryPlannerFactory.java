package org.hypertrace.core.query.planner;

import com.google.inject.Guice;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

public class QueryPlannerFactory {
  private static final String QUERY_PLANNER_CONFIG = "queryPlanner";

  /** Builds a planner from the {@code queryPlanner} section of the application config. */
  public static QueryPlanner create() {
    Config appConfig = ConfigFactory.load();
    return create(appConfig.getConfig(QUERY_PLANNER_CONFIG));
  }

  public static QueryPlanner create(Config config) {
    return Guice.createInjector(new QueryPlannerModule(config)).getInstance(QueryPlanner.class);
  }
}
