package org.hypertrace.core.filter.service.compiler;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import javax.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.hypertrace.core.filter.service.FilterServiceConfig.FilterConfig;
import org.hypertrace.core.filter.service.api.CompiledFilter;
import org.hypertrace.core.filter.service.api.Keyword;
import org.hypertrace.core.filter.service.api.KeywordType;
import org.hypertrace.core.filter.service.api.ResourceColumns;
import org.hypertrace.core.filter.service.column.ColumnResolver;
import org.hypertrace.core.filter.service.column.ResolvedColumn;
import org.hypertrace.core.filter.service.keyword.FilterKeywords;
import org.hypertrace.core.filter.service.keyword.FilterTokenizer;
import org.hypertrace.core.filter.service.pagination.RowLimits;
import org.hypertrace.core.filter.service.resource.ResourceDefinition;
import org.hypertrace.core.filter.service.resource.ResourceTypes;
import org.hypertrace.core.filter.service.sort.SortClauseBuilder;

/**
 * Compiles a filter string into a parameterized WHERE clause, ORDER BY terms and pagination.
 *
 * <p>Terms are joined left to right without grouping: OR by default, AND after an {@code and}
 * keyword, and {@code not} negates the next term only.
 */
@Slf4j
public class FilterClauseCompiler {

  private final FilterTokenizer tokenizer;
  private final SortClauseBuilder sortClauseBuilder;
  private final RowLimits rowLimits;
  private final FilterConfig filterConfig;

  @Inject
  public FilterClauseCompiler(
      FilterTokenizer tokenizer,
      SortClauseBuilder sortClauseBuilder,
      RowLimits rowLimits,
      FilterConfig filterConfig) {
    this.tokenizer = tokenizer;
    this.sortClauseBuilder = sortClauseBuilder;
    this.rowLimits = rowLimits;
    this.filterConfig = filterConfig;
  }

  public CompiledFilter compile(
      ResourceDefinition resource, String filter, boolean trash, boolean ignoreRowCap) {
    return compile(
        resource.getType(),
        resource.getTable(trash),
        resource.getColumns(),
        resource.getSortTemplates(),
        resource.getDefaultOrder(),
        filter,
        trash,
        ignoreRowCap);
  }

  /** Compiles against column tables supplied by the caller, without per-type sort templates. */
  public CompiledFilter compile(
      String resourceType,
      String filter,
      ResourceColumns columns,
      boolean trash,
      boolean ignoreRowCap) {
    return compile(
        resourceType,
        trash ? ResourceTypes.trashTableName(resourceType) : ResourceTypes.tableName(resourceType),
        columns,
        Map.of(),
        Optional.empty(),
        filter,
        trash,
        ignoreRowCap);
  }

  private CompiledFilter compile(
      String resourceType,
      String table,
      ResourceColumns columns,
      Map<String, String> sortTemplates,
      Optional<String> defaultOrder,
      String filter,
      boolean trash,
      boolean ignoreRowCap) {
    List<Keyword> keywords = tokenizer.split(filter);

    ClauseBuilder where = new ClauseBuilder();
    List<String> permissions = new ArrayList<>();
    String owner = null;
    long first = 1;
    long rows = FilterKeywords.ROWS_PER_PAGE_SENTINEL;

    boolean firstTerm = true;
    boolean lastWasAnd = false;
    boolean lastWasNot = false;
    boolean lastWasRe = false;

    for (Keyword keyword : keywords) {
      if (keyword.isOperator()) {
        if (keyword.isOperator("and")) {
          lastWasAnd = true;
        } else if (keyword.isOperator("not")) {
          lastWasNot = true;
        } else if (keyword.isOperator("re") || keyword.isOperator("regexp")) {
          lastWasRe = true;
        }
        continue;
      }

      String column = keyword.getColumn();
      Optional<ClauseBuilder> term;
      boolean negatedInside = false;
      if (column == null) {
        term =
            FreeTextClauseConverter.convert(
                keyword,
                columns,
                filterConfig.getEnumeratedColumns(),
                lastWasRe && !keyword.isEqual(),
                lastWasNot);
        negatedInside = true;
      } else if (FilterKeywords.FIRST.equals(column)) {
        if (keyword.getType() == KeywordType.INTEGER) {
          first = keyword.getIntegerValue();
        }
        continue;
      } else if (FilterKeywords.ROWS.equals(column)) {
        if (keyword.getType() == KeywordType.INTEGER) {
          rows = keyword.getIntegerValue();
        }
        continue;
      } else if (FilterKeywords.isControl(column)) {
        continue;
      } else if (FilterKeywords.PERMISSION.equals(column)) {
        permissions.add(keyword.getString());
        term = Optional.empty();
      } else if (FilterKeywords.OWNER.equals(column)) {
        if (owner == null) {
          owner = keyword.getString();
        }
        term = Optional.empty();
      } else if (TagClauseConverter.isTagColumn(column)) {
        term = TagClauseConverter.convert(keyword, resourceType, table, trash);
      } else {
        Optional<ResolvedColumn> resolved = ColumnResolver.resolve(columns, column);
        if (resolved.isEmpty()) {
          unknownColumn(resourceType, column);
        }
        term = resolved.map(found -> ColumnClauseConverter.convert(keyword, found));
      }

      if (term.isPresent()) {
        where
            .sql(JoinPrefix.of(firstTerm, lastWasAnd, lastWasNot && !negatedInside))
            .append(term.get());
        firstTerm = false;
      }
      lastWasAnd = false;
      lastWasNot = false;
      lastWasRe = false;
    }

    CompiledFilter compiled =
        CompiledFilter.builder()
            .whereClause(where.isEmpty() ? Optional.empty() : Optional.of(where.getSql().trim()))
            .params(where.buildParams())
            .orderClause(sortClauseBuilder.build(keywords, columns, sortTemplates, defaultOrder))
            .firstRow(RowLimits.firstRow(first))
            .maxRows(rowLimits.maxRows(rows, ignoreRowCap))
            .permissions(List.copyOf(permissions))
            .ownerFilter(Optional.ofNullable(owner))
            .build();
    if (log.isDebugEnabled()) {
      log.debug(
          "Compiled filter [{}] for {}: where [{}], order [{}], first {}, max {}",
          filter,
          resourceType,
          compiled.getResolvedWhereClause().orElse(""),
          compiled.getOrderClause(),
          compiled.getFirstRow(),
          compiled.getMaxRows());
    }
    return compiled;
  }

  private void unknownColumn(String resourceType, String column) {
    switch (filterConfig.getUnknownColumnMode()) {
      case ERROR:
        throw new InvalidFilterColumnException(resourceType, column);
      case WARN:
        log.warn("Skipping unknown filter column '{}' for resource type {}", column, resourceType);
        break;
      default:
        log.debug("Skipping unknown filter column '{}' for resource type {}", column, resourceType);
        break;
    }
  }
}
