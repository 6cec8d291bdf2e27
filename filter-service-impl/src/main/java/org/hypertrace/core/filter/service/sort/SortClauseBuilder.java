package org.hypertrace.core.filter.service.sort;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.hypertrace.core.filter.service.FilterServiceConfig.SortCategoryConfig;
import org.hypertrace.core.filter.service.api.Keyword;
import org.hypertrace.core.filter.service.api.ResourceColumns;
import org.hypertrace.core.filter.service.column.ColumnResolver;
import org.hypertrace.core.filter.service.column.ResolvedColumn;
import org.hypertrace.core.filter.service.keyword.FilterKeywords;

/**
 * Builds ORDER BY terms from sort keywords.
 *
 * <p>The first applicable sort keyword is rendered through a sort expression template: the
 * resource type's own template for the column, else the template of the column's category, else
 * an ordering derived from the declared column type. Templates reference the resolved column as
 * {@code {column}} and may place the direction with {@code {direction}}. Later sort keywords are
 * appended as plain tie-breakers.
 */
public class SortClauseBuilder {

  static final String COLUMN_PLACEHOLDER = "{column}";
  static final String DIRECTION_PLACEHOLDER = "{direction}";

  private final Map<String, String> categoryTemplates;

  public SortClauseBuilder(List<SortCategoryConfig> categories) {
    Map<String, String> templates = new HashMap<>();
    for (SortCategoryConfig category : categories) {
      category
          .getColumns()
          .forEach(column -> templates.putIfAbsent(column, category.getTemplate()));
    }
    this.categoryTemplates = Map.copyOf(templates);
  }

  /** ORDER BY terms without the keyword, empty when nothing applies. */
  public String build(
      List<Keyword> keywords,
      ResourceColumns columns,
      Map<String, String> typeTemplates,
      Optional<String> defaultOrder) {
    StringBuilder order = new StringBuilder();
    for (Keyword keyword : keywords) {
      if (!FilterKeywords.isSort(keyword.getColumn())) {
        continue;
      }
      String field = keyword.getString();
      if (!columns.isFilterColumn(field)) {
        continue;
      }
      String direction = FilterKeywords.SORT.equals(keyword.getColumn()) ? "ASC" : "DESC";
      Optional<ResolvedColumn> column = ColumnResolver.resolve(columns, field);

      if (order.length() == 0) {
        primary(field, column, direction, typeTemplates).ifPresent(order::append);
      } else if (column.isPresent()) {
        order.append(", ").append(column.get().getExpression()).append(' ').append(direction);
      }
    }
    if (order.length() == 0 && defaultOrder.isPresent()) {
      return defaultOrder.get();
    }
    return order.toString();
  }

  private Optional<String> primary(
      String field,
      Optional<ResolvedColumn> column,
      String direction,
      Map<String, String> typeTemplates) {
    String template = typeTemplates.getOrDefault(field, categoryTemplates.get(field));
    if (template != null) {
      if (template.contains(COLUMN_PLACEHOLDER) && column.isEmpty()) {
        return Optional.empty();
      }
      return Optional.of(render(template, column.map(ResolvedColumn::getExpression), direction));
    }
    return column.map(
        resolved ->
            render(typeTemplate(resolved), Optional.of(resolved.getExpression()), direction));
  }

  private static String typeTemplate(ResolvedColumn column) {
    switch (column.getType()) {
      case INTEGER:
        return "CAST({column} AS NUMERIC)";
      case DOUBLE:
        return "CAST({column} AS REAL)";
      case STRING:
        return "lower({column})";
      default:
        return COLUMN_PLACEHOLDER;
    }
  }

  static String render(String template, Optional<String> column, String direction) {
    String expression =
        column.isPresent() ? template.replace(COLUMN_PLACEHOLDER, column.get()) : template;
    if (expression.contains(DIRECTION_PLACEHOLDER)) {
      return expression.replace(DIRECTION_PLACEHOLDER, direction);
    }
    return expression + " " + direction;
  }
}
