package org.hypertrace.core.filter.service.api;

import com.google.common.base.Preconditions;
import java.util.List;
import lombok.Value;

/** The column tables of one resource type. */
@Value
public class ResourceColumns {
  List<String> filterColumns;
  List<ColumnDeclaration> selectColumns;
  List<ColumnDeclaration> whereColumns;

  public ResourceColumns(
      List<String> filterColumns,
      List<ColumnDeclaration> selectColumns,
      List<ColumnDeclaration> whereColumns) {
    Preconditions.checkArgument(
        !selectColumns.isEmpty() || !whereColumns.isEmpty(),
        "A resource needs at least one select or where column");
    this.filterColumns = List.copyOf(filterColumns);
    this.selectColumns = List.copyOf(selectColumns);
    this.whereColumns = List.copyOf(whereColumns);
  }

  /** True when the name, or its private {@code _name} form, is a declared filter column. */
  public boolean isFilterColumn(String name) {
    return filterColumns.contains(name) || filterColumns.contains("_" + name);
  }
}
