package org.hypertrace.core.filter.service.column;

import lombok.Value;
import org.hypertrace.core.filter.service.api.KeywordType;

/** A column expression taken from a resource's column tables, safe to embed in SQL. */
@Value
public class ResolvedColumn {
  String expression;
  KeywordType type;

  public boolean isNumeric() {
    return type.isNumeric();
  }
}
