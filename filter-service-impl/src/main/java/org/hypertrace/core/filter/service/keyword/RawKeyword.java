package org.hypertrace.core.filter.service.keyword;

import javax.annotation.Nullable;
import lombok.Value;

/** One whitespace separated part of a filter string, before its value is typed. */
@Value
class RawKeyword {
  static final char NO_CHAR = 0;

  @Nullable String column;

  /** Relation operator between column and value, {@link #NO_CHAR} without a column. */
  char operator;

  /** Bare {@code =} or {@code ~} in front of a column-less part, else {@link #NO_CHAR}. */
  char prefix;

  String value;
  boolean quoted;
}
