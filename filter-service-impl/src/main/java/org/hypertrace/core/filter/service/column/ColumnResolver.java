package org.hypertrace.core.filter.service.column;

import java.util.List;
import java.util.Optional;
import org.hypertrace.core.filter.service.api.ColumnDeclaration;
import org.hypertrace.core.filter.service.api.ResourceColumns;

/**
 * Maps filter column names to column expressions. Select columns are searched before where
 * columns; within each table a declared filter name wins over a raw select expression.
 */
public final class ColumnResolver {

  private ColumnResolver() {}

  public static Optional<ResolvedColumn> resolve(ResourceColumns columns, String name) {
    return resolve(columns.getSelectColumns(), columns.getWhereColumns(), name);
  }

  public static Optional<ResolvedColumn> resolve(
      List<ColumnDeclaration> selectColumns, List<ColumnDeclaration> whereColumns, String name) {
    if (name == null || name.isEmpty()) {
      return Optional.empty();
    }
    Optional<ResolvedColumn> resolved = search(selectColumns, name);
    return resolved.isPresent() ? resolved : search(whereColumns, name);
  }

  private static Optional<ResolvedColumn> search(List<ColumnDeclaration> columns, String name) {
    for (ColumnDeclaration column : columns) {
      String filter = column.getFilter();
      if (filter != null
          && (filter.equals(name) || (filter.startsWith("_") && filter.substring(1).equals(name)))) {
        return Optional.of(toResolved(column));
      }
    }
    for (ColumnDeclaration column : columns) {
      if (column.getSelect().equals(name)) {
        return Optional.of(toResolved(column));
      }
    }
    return Optional.empty();
  }

  private static ResolvedColumn toResolved(ColumnDeclaration column) {
    return new ResolvedColumn(column.getSelect(), column.getType());
  }
}
