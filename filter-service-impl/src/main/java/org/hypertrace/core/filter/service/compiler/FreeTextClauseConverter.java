package org.hypertrace.core.filter.service.compiler;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.hypertrace.core.filter.service.api.Keyword;
import org.hypertrace.core.filter.service.api.ResourceColumns;
import org.hypertrace.core.filter.service.column.ColumnResolver;
import org.hypertrace.core.filter.service.column.ResolvedColumn;

/**
 * Converts a column-less term into a condition over every filter column of the resource: an OR of
 * matches, or when negated an AND of non-matches that also accepts NULL.
 */
final class FreeTextClauseConverter {

  private FreeTextClauseConverter() {}

  /** Empty when no filter column can match the term. */
  static Optional<ClauseBuilder> convert(
      Keyword keyword,
      ResourceColumns columns,
      Map<String, List<String>> enumeratedColumns,
      boolean regexp,
      boolean negate) {
    ClauseBuilder terms = new ClauseBuilder();
    for (String filterColumn : columns.getFilterColumns()) {
      if (TagClauseConverter.isTagColumn(filterColumn)) {
        continue;
      }
      boolean contains = !keyword.isEqual() && !regexp;
      if (contains && !applicable(filterColumn, keyword.getString(), enumeratedColumns)) {
        continue;
      }
      Optional<ResolvedColumn> column = ColumnResolver.resolve(columns, filterColumn);
      if (column.isEmpty()) {
        continue;
      }
      if (!terms.isEmpty()) {
        terms.sql(negate ? " AND " : " OR ");
      }
      terms.append(match(keyword, column.get(), regexp, negate));
    }
    if (terms.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(new ClauseBuilder().sql("(").append(terms).sql(")"));
  }

  private static ClauseBuilder match(
      Keyword keyword, ResolvedColumn column, boolean regexp, boolean negate) {
    ClauseBuilder match = new ClauseBuilder();
    if (negate) {
      match.sql("(").column(column).sql(" IS NULL OR ");
    }
    if (keyword.isEqual()) {
      if (keyword.getType().isNumeric() && column.isNumeric()) {
        match.sql("CAST(").column(column).sql(negate ? " AS NUMERIC) != " : " AS NUMERIC) = ");
        ColumnClauseConverter.numericValue(match, keyword);
      } else {
        ColumnClauseConverter.textCast(match, column)
            .sql(negate ? " != " : " = ")
            .value(keyword.getString());
      }
    } else if (regexp) {
      ColumnClauseConverter.textCast(match, column)
          .sql(negate ? " !~ " : " ~ ")
          .value(keyword.getString());
    } else {
      ColumnClauseConverter.textCast(match, column)
          .sql(negate ? " NOT ILIKE " : " ILIKE ")
          .value(ColumnClauseConverter.contains(keyword.getString()));
    }
    if (negate) {
      match.sql(")");
    }
    return match;
  }

  /**
   * A column with a known value set only takes part when one of its values contains the search
   * text.
   */
  static boolean applicable(
      String filterColumn, String text, Map<String, List<String>> enumeratedColumns) {
    String name = filterColumn.startsWith("_") ? filterColumn.substring(1) : filterColumn;
    List<String> tokens = enumeratedColumns.get(name);
    if (tokens == null) {
      return true;
    }
    String needle = text.toLowerCase(Locale.ROOT);
    return tokens.stream().anyMatch(token -> token.toLowerCase(Locale.ROOT).contains(needle));
  }
}
