package org.hypertrace.core.filter.service;

import java.util.Optional;
import javax.annotation.Nullable;
import javax.inject.Inject;
import javax.inject.Singleton;
import lombok.extern.slf4j.Slf4j;
import org.hypertrace.core.filter.service.api.CompiledFilter;
import org.hypertrace.core.filter.service.api.FilterControls;
import org.hypertrace.core.filter.service.api.ReportFilterControls;
import org.hypertrace.core.filter.service.api.ResourceColumns;
import org.hypertrace.core.filter.service.compiler.FilterClauseCompiler;
import org.hypertrace.core.filter.service.controls.FilterControlsExtractor;
import org.hypertrace.core.filter.service.normalizer.FilterNormalizer;
import org.hypertrace.core.filter.service.postgres.ResourceQuery;
import org.hypertrace.core.filter.service.postgres.ResourceQueryBuilder;
import org.hypertrace.core.filter.service.resource.ResourceDefinition;
import org.hypertrace.core.filter.service.resource.ResourceRegistry;

@Slf4j
@Singleton
class FilterServiceImpl implements FilterService {
  private final ResourceRegistry resourceRegistry;
  private final FilterClauseCompiler compiler;
  private final FilterNormalizer normalizer;
  private final FilterControlsExtractor controlsExtractor;

  @Inject
  FilterServiceImpl(
      ResourceRegistry resourceRegistry,
      FilterClauseCompiler compiler,
      FilterNormalizer normalizer,
      FilterControlsExtractor controlsExtractor) {
    this.resourceRegistry = resourceRegistry;
    this.compiler = compiler;
    this.normalizer = normalizer;
    this.controlsExtractor = controlsExtractor;
  }

  @Override
  public CompiledFilter compileFilter(
      String resourceType, String filter, boolean trash, boolean ignoreRowCap) {
    return compiler.compile(resourceRegistry.get(resourceType), filter, trash, ignoreRowCap);
  }

  @Override
  public CompiledFilter compileFilter(
      String resourceType,
      String filter,
      ResourceColumns columns,
      boolean trash,
      boolean ignoreRowCap) {
    return compiler.compile(resourceType, filter, columns, trash, ignoreRowCap);
  }

  @Override
  public String cleanFilter(String filter, @Nullable String dropColumn, boolean ignoreRowCap) {
    return normalizer.clean(filter, dropColumn, ignoreRowCap);
  }

  @Override
  public FilterControls filterControls(String filter) {
    return controlsExtractor.filterControls(filter);
  }

  @Override
  public ReportFilterControls reportFilterControls(String filter) {
    return controlsExtractor.reportFilterControls(filter);
  }

  @Override
  public Optional<String> filterTermValue(String filter, String column) {
    return controlsExtractor.filterTermValue(filter, column);
  }

  @Override
  public int applyOverrides(String filter) {
    return controlsExtractor.applyOverrides(filter);
  }

  @Override
  public int minQod(String filter) {
    return controlsExtractor.minQod(filter);
  }

  @Override
  public ResourceQuery listQuery(
      String resourceType, String filter, boolean trash, boolean ignoreRowCap) {
    ResourceDefinition resource = resourceRegistry.get(resourceType);
    CompiledFilter compiled = compiler.compile(resource, filter, trash, ignoreRowCap);
    ResourceQuery query =
        ResourceQueryBuilder.list(
            resource.getTable(trash), resource.getColumns().getSelectColumns(), compiled);
    log.debug("List query for {}: {}", resourceType, query.getResolvedStatement());
    return query;
  }

  @Override
  public ResourceQuery countQuery(String resourceType, String filter, boolean trash) {
    ResourceDefinition resource = resourceRegistry.get(resourceType);
    CompiledFilter compiled = compiler.compile(resource, filter, trash, true);
    ResourceQuery query = ResourceQueryBuilder.count(resource.getTable(trash), compiled);
    log.debug("Count query for {}: {}", resourceType, query.getResolvedStatement());
    return query;
  }
}
