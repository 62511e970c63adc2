package org.hypertrace.core.query.planner;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import lombok.Value;
import lombok.experimental.NonFinal;
import org.hypertrace.core.query.planner.bucket.BucketAlignment;

@Value
@NonFinal
public class QueryPlannerConfig {

  private static final String DEFAULT_CONFIG_PATH = "queryPlanner";
  private static final String CONFIG_PATH_PLANNER = "planner";
  private static final String CONFIG_PATH_BUCKET_COUNT_VALIDATION = "validation.bucketCount";

  PlannerConfig plannerConfig;
  BucketCountValidationConfig bucketCountValidationConfig;

  /**
   * Reads the planner settings from the given config, falling back to the defaults shipped in
   * reference.conf for anything it leaves out.
   */
  public QueryPlannerConfig(Config config) {
    Config resolved =
        config
            .withFallback(ConfigFactory.defaultReference().getConfig(DEFAULT_CONFIG_PATH))
            .resolve();
    this.plannerConfig = new PlannerConfig(resolved.getConfig(CONFIG_PATH_PLANNER));
    this.bucketCountValidationConfig =
        new BucketCountValidationConfig(resolved.getConfig(CONFIG_PATH_BUCKET_COUNT_VALIDATION));
  }

  public static QueryPlannerConfig defaults() {
    return new QueryPlannerConfig(ConfigFactory.empty());
  }

  @Value
  @NonFinal
  public static class PlannerConfig {
    private static final String CONFIG_PATH_BUCKET_ALIGNMENT = "bucketAlignment";
    private static final String CONFIG_PATH_CLAMP_TO_QUERY_RANGE = "clampToQueryRange";
    private static final String CONFIG_PATH_STATEMENT = "statement";

    BucketAlignment bucketAlignment;
    boolean clampToQueryRange;
    StatementConfig statementConfig;

    private PlannerConfig(Config config) {
      this.bucketAlignment = config.getEnum(BucketAlignment.class, CONFIG_PATH_BUCKET_ALIGNMENT);
      this.clampToQueryRange = config.getBoolean(CONFIG_PATH_CLAMP_TO_QUERY_RANGE);
      this.statementConfig = new StatementConfig(config.getConfig(CONFIG_PATH_STATEMENT));
    }
  }

  @Value
  @NonFinal
  public static class StatementConfig {
    private static final String CONFIG_PATH_VALUE_COLUMN = "valueColumn";
    private static final String CONFIG_PATH_SERIES_ID_COLUMN = "seriesIdColumn";
    private static final String CONFIG_PATH_TIMESTAMP_COLUMN = "timestampColumn";

    String valueColumn;
    String seriesIdColumn;
    String timestampColumn;

    private StatementConfig(Config config) {
      this.valueColumn = config.getString(CONFIG_PATH_VALUE_COLUMN);
      this.seriesIdColumn = config.getString(CONFIG_PATH_SERIES_ID_COLUMN);
      this.timestampColumn = config.getString(CONFIG_PATH_TIMESTAMP_COLUMN);
    }
  }

  @Value
  @NonFinal
  public static class BucketCountValidationConfig {
    private static final String CONFIG_PATH_MAX = "max";
    private static final String CONFIG_PATH_MODE = "mode";
    long max;
    BucketCountValidationMode mode;

    private BucketCountValidationConfig(Config config) {
      this.max = config.getLong(CONFIG_PATH_MAX);
      this.mode = config.getEnum(BucketCountValidationMode.class, CONFIG_PATH_MODE);
    }

    public enum BucketCountValidationMode {
      DISABLED,
      WARN,
      ERROR
    }
  }
}
