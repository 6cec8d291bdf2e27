package org.hypertrace.core.filter.service;

import java.util.Optional;
import javax.annotation.Nullable;
import org.hypertrace.core.filter.service.api.CompiledFilter;
import org.hypertrace.core.filter.service.api.FilterControls;
import org.hypertrace.core.filter.service.api.ReportFilterControls;
import org.hypertrace.core.filter.service.api.ResourceColumns;
import org.hypertrace.core.filter.service.postgres.ResourceQuery;

/** Entry points used by resource listing and counting operations. */
public interface FilterService {

  /** Compiles the filter against the registered definition of the resource type. */
  CompiledFilter compileFilter(
      String resourceType, String filter, boolean trash, boolean ignoreRowCap);

  /** Compiles the filter against column tables supplied by the caller. */
  CompiledFilter compileFilter(
      String resourceType,
      String filter,
      ResourceColumns columns,
      boolean trash,
      boolean ignoreRowCap);

  String cleanFilter(String filter, @Nullable String dropColumn, boolean ignoreRowCap);

  FilterControls filterControls(String filter);

  ReportFilterControls reportFilterControls(String filter);

  Optional<String> filterTermValue(String filter, String column);

  int applyOverrides(String filter);

  int minQod(String filter);

  /** The page of resources matching the filter. */
  ResourceQuery listQuery(String resourceType, String filter, boolean trash, boolean ignoreRowCap);

  /** The number of resources matching the filter, ignoring pagination. */
  ResourceQuery countQuery(String resourceType, String filter, boolean trash);
}
