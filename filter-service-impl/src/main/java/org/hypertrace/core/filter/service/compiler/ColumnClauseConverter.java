package org.hypertrace.core.filter.service.compiler;

import java.util.Optional;
import org.hypertrace.core.filter.service.api.Keyword;
import org.hypertrace.core.filter.service.api.KeywordRelation;
import org.hypertrace.core.filter.service.api.KeywordType;
import org.hypertrace.core.filter.service.column.ResolvedColumn;
import org.hypertrace.core.filter.service.resource.ResourceTypes;

/** Converts a column relation keyword into a parenthesized condition. */
final class ColumnClauseConverter {

  private static final String ID_SUFFIX = "_id";

  private ColumnClauseConverter() {}

  static ClauseBuilder convert(Keyword keyword, ResolvedColumn column) {
    Optional<String> foreignType = foreignResourceType(keyword.getColumn());
    if (foreignType.isPresent()) {
      return convertForeignId(keyword, column, foreignType.get());
    }

    ClauseBuilder clause = new ClauseBuilder().sql("(");
    KeywordRelation relation = keyword.getRelation();
    switch (relation) {
      case COLUMN_APPROX:
        textCast(clause, column).sql(" ILIKE ").value(contains(keyword.getString()));
        break;
      case COLUMN_REGEXP:
        textCast(clause, column).sql(" ~ ").value(keyword.getString());
        break;
      case COLUMN_EQUAL:
      case COLUMN_ABOVE:
      case COLUMN_BELOW:
        String operator = comparisonOperator(relation);
        if (keyword.getType().isNumeric() && column.isNumeric()) {
          clause.sql("CAST(").column(column).sql(" AS NUMERIC) ").sql(operator).sql(" ");
          numericValue(clause, keyword);
        } else {
          textCast(clause, column).sql(" ").sql(operator).sql(" ").value(keyword.getString());
          if (relation == KeywordRelation.COLUMN_EQUAL && keyword.getString().isEmpty()) {
            clause.sql(" OR ").column(column).sql(" IS NULL");
          }
        }
        break;
      default:
        throw new IllegalArgumentException("Not a column relation: " + relation);
    }
    return clause.sql(")");
  }

  /**
   * The resource type referenced by a {@code <type>_id} column, which filters by the UUID of the
   * referenced resource.
   */
  static Optional<String> foreignResourceType(String column) {
    if (column == null
        || !column.endsWith(ID_SUFFIX)
        || column.equals("nvt_id")
        || column.equals("result_id")) {
      return Optional.empty();
    }
    String type = column.substring(0, column.length() - ID_SUFFIX.length());
    return ResourceTypes.isValid(type) ? Optional.of(type) : Optional.empty();
  }

  private static ClauseBuilder convertForeignId(
      Keyword keyword, ResolvedColumn column, String foreignType) {
    String table = ResourceTypes.tableName(foreignType);
    ClauseBuilder clause = new ClauseBuilder().sql("(");
    KeywordRelation relation = keyword.getRelation();
    if (relation == KeywordRelation.COLUMN_EQUAL) {
      if (keyword.getString().isEmpty()) {
        // No reference at all.
        return clause
            .column(column)
            .sql(" IS NULL OR ")
            .column(column)
            .sql(" = 0)");
      }
      return clause
          .column(column)
          .sql(" = (SELECT id FROM " + table + " WHERE uuid = ")
          .value(keyword.getString())
          .sql("))");
    }
    clause.column(column).sql(" IN (SELECT id FROM " + table + " WHERE uuid ");
    switch (relation) {
      case COLUMN_APPROX:
        clause.sql("ILIKE ").value(contains(keyword.getString()));
        break;
      case COLUMN_REGEXP:
        clause.sql("~ ").value(keyword.getString());
        break;
      default:
        clause.sql(comparisonOperator(relation)).sql(" ").value(keyword.getString());
        break;
    }
    return clause.sql("))");
  }

  static ClauseBuilder textCast(ClauseBuilder clause, ResolvedColumn column) {
    return clause.sql("CAST(").column(column).sql(" AS TEXT)");
  }

  static void numericValue(ClauseBuilder clause, Keyword keyword) {
    if (keyword.getType() == KeywordType.INTEGER) {
      clause.value(keyword.getIntegerValue());
    } else {
      clause.value(keyword.getDoubleValue());
    }
  }

  static String contains(String value) {
    return "%" + value + "%";
  }

  private static String comparisonOperator(KeywordRelation relation) {
    switch (relation) {
      case COLUMN_ABOVE:
        return ">";
      case COLUMN_BELOW:
        return "<";
      default:
        return "=";
    }
  }
}
