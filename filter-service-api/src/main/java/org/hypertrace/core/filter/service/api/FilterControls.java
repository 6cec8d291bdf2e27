package org.hypertrace.core.filter.service.api;

import lombok.Value;

/** Pagination and sort settings of a filter, for listings that do not compile a WHERE clause. */
@Value
public class FilterControls {
  /** Zero-based offset of the first row. */
  int first;

  /** Page size, {@code -1} for unlimited. */
  int maxRows;

  String sortField;
  boolean sortAscending;
}
