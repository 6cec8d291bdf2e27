package org.hypertrace.core.filter.service.postgres;

import java.util.List;
import java.util.stream.Collectors;
import org.hypertrace.core.filter.service.api.ColumnDeclaration;
import org.hypertrace.core.filter.service.api.CompiledFilter;

/** Renders the listing and counting statements for a compiled filter. */
public final class ResourceQueryBuilder {

  private ResourceQueryBuilder() {}

  /** The SELECT list of the columns, each aliased by its filter name. */
  public static String buildSelect(List<ColumnDeclaration> selectColumns) {
    if (selectColumns.isEmpty()) {
      return "''";
    }
    return selectColumns.stream()
        .map(column -> column.getSelect() + " AS " + column.getAlias())
        .collect(Collectors.joining(", "));
  }

  public static ResourceQuery list(
      String table, List<ColumnDeclaration> selectColumns, CompiledFilter filter) {
    StringBuilder sql =
        new StringBuilder("SELECT ")
            .append(buildSelect(selectColumns))
            .append(" FROM ")
            .append(table);
    filter.getWhereClause().ifPresent(where -> sql.append(" WHERE ").append(where));
    if (!filter.getOrderClause().isEmpty()) {
      sql.append(" ORDER BY ").append(filter.getOrderClause());
    }
    if (filter.getMaxRows() > 0) {
      sql.append(" LIMIT ").append(filter.getMaxRows());
    }
    if (filter.getFirstRow() > 0) {
      sql.append(" OFFSET ").append(filter.getFirstRow());
    }
    return new ResourceQuery(sql.toString(), filter.getParams());
  }

  public static ResourceQuery count(String table, CompiledFilter filter) {
    StringBuilder sql = new StringBuilder("SELECT count(*) FROM ").append(table);
    filter.getWhereClause().ifPresent(where -> sql.append(" WHERE ").append(where));
    return new ResourceQuery(sql.toString(), filter.getParams());
  }
}
