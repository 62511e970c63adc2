package org.hypertrace.core.query.planner.cql;

import javax.inject.Inject;
import javax.inject.Singleton;
import org.hypertrace.core.query.planner.QueryPlannerConfig;
import org.hypertrace.core.query.planner.QueryPlannerConfig.StatementConfig;
import org.hypertrace.core.query.planner.api.LowLevelQuery;
import org.hypertrace.core.query.planner.api.Params;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts one (series, bucket) pair of a plan into a prepared CQL aggregation statement.
 *
 * <p>The aggregation and table name come from trusted configuration and are written into the
 * statement text. The series id and the time bounds are always bound as params, so the text only
 * depends on the aggregation and the table and can be prepared once per pair.
 */
@Singleton
public class CqlQueryConverter {

  private static final Logger LOG = LoggerFactory.getLogger(CqlQueryConverter.class);

  private static final String QUESTION_MARK = "?";

  private final StatementConfig statementConfig;

  @Inject
  public CqlQueryConverter(QueryPlannerConfig config) {
    this.statementConfig = config.getPlannerConfig().getStatementConfig();
  }

  public LowLevelQuery toLowLevelQuery(
      String aggregationType,
      String tableName,
      String seriesId,
      long timeStartNanos,
      long timeEndNanos) {
    Params params =
        Params.newBuilder()
            .addStringParam(seriesId)
            .addLongParam(timeStartNanos)
            .addLongParam(timeEndNanos)
            .build();
    return LowLevelQuery.of(toStatement(aggregationType, tableName), params);
  }

  /**
   * e.g. {@code SELECT avg(value) FROM measurements WHERE series_id = ? AND timestamp_ns >= ? AND
   * timestamp_ns < ?}
   */
  public String toStatement(String aggregationType, String tableName) {
    StringBuilder cqlBuilder = new StringBuilder("SELECT ");
    cqlBuilder
        .append(aggregationType)
        .append("(")
        .append(statementConfig.getValueColumn())
        .append(")");

    cqlBuilder.append(" FROM ").append(tableName);

    cqlBuilder
        .append(" WHERE ")
        .append(statementConfig.getSeriesIdColumn())
        .append(" = ")
        .append(QUESTION_MARK);
    cqlBuilder
        .append(" AND ")
        .append(statementConfig.getTimestampColumn())
        .append(" >= ")
        .append(QUESTION_MARK);
    cqlBuilder
        .append(" AND ")
        .append(statementConfig.getTimestampColumn())
        .append(" < ")
        .append(QUESTION_MARK);

    if (LOG.isTraceEnabled()) {
      LOG.trace("Built CQL statement: {}", cqlBuilder);
    }
    return cqlBuilder.toString();
  }
}
