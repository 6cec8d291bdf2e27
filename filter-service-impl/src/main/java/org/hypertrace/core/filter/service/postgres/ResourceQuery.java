package org.hypertrace.core.filter.service.postgres;

import lombok.Value;
import org.hypertrace.core.filter.service.api.Params;
import org.hypertrace.core.filter.service.api.SqlStatements;

/** A SQL statement with its bound params. */
@Value
public class ResourceQuery {
  String statement;
  Params params;

  public String getResolvedStatement() {
    return SqlStatements.resolve(statement, params);
  }
}
