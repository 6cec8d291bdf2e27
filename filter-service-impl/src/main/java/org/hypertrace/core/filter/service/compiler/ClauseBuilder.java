package org.hypertrace.core.filter.service.compiler;

import java.util.ArrayList;
import java.util.List;
import org.hypertrace.core.filter.service.api.Params;
import org.hypertrace.core.filter.service.column.ResolvedColumn;

/**
 * Accumulates a SQL fragment from three kinds of pieces: fixed SQL text written in this package,
 * column expressions from the column resolver, and user values. User values never enter the SQL
 * text; each becomes a {@code ?} placeholder with a bound param.
 */
class ClauseBuilder {
  private final StringBuilder sql = new StringBuilder();
  private final List<Object> values = new ArrayList<>();

  ClauseBuilder sql(String fixed) {
    sql.append(fixed);
    return this;
  }

  ClauseBuilder column(ResolvedColumn column) {
    sql.append(column.getExpression());
    return this;
  }

  ClauseBuilder value(String value) {
    sql.append('?');
    values.add(value);
    return this;
  }

  ClauseBuilder value(long value) {
    sql.append('?');
    values.add(value);
    return this;
  }

  ClauseBuilder value(double value) {
    sql.append('?');
    values.add(value);
    return this;
  }

  /** Appends another builder's SQL and values, keeping placeholder order. */
  ClauseBuilder append(ClauseBuilder other) {
    sql.append(other.sql);
    values.addAll(other.values);
    return this;
  }

  boolean isEmpty() {
    return sql.length() == 0;
  }

  String getSql() {
    return sql.toString();
  }

  Params buildParams() {
    Params.Builder builder = Params.newBuilder();
    for (Object value : values) {
      if (value instanceof Long) {
        builder.addLongParam((Long) value);
      } else if (value instanceof Double) {
        builder.addDoubleParam((Double) value);
      } else {
        builder.addStringParam((String) value);
      }
    }
    return builder.build();
  }
}
