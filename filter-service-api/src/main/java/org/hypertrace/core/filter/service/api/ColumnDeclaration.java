package org.hypertrace.core.filter.service.api;

import javax.annotation.Nullable;
import lombok.NonNull;
import lombok.Value;

/**
 * Maps a filter-facing column name to the SQL expression that backs it. A filter name starting
 * with {@code _} keeps the column filterable under the name without the underscore.
 */
@Value
public class ColumnDeclaration {
  @NonNull String select;
  @Nullable String filter;
  @NonNull KeywordType type;

  public static ColumnDeclaration of(String select, @Nullable String filter, KeywordType type) {
    return new ColumnDeclaration(select, filter, type);
  }

  /** The name the column is exposed under in a SELECT list. */
  public String getAlias() {
    return filter != null ? filter : select;
  }
}
