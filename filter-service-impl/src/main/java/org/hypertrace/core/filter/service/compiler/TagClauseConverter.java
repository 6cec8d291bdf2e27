package org.hypertrace.core.filter.service.compiler;

import java.util.Optional;
import org.hypertrace.core.filter.service.api.Keyword;
import org.hypertrace.core.filter.service.api.KeywordRelation;
import org.hypertrace.core.filter.service.keyword.FilterKeywords;

/**
 * Expands {@code tag} and {@code tag_id} keywords into an EXISTS condition over the tag tables.
 *
 * <p>A {@code tag} value of the form {@code name=value} matches the tag name and the tag value
 * separately, with the keyword's relation applied to both.
 */
final class TagClauseConverter {

  private static final int LOCATION_TABLE = 0;
  private static final int LOCATION_TRASH = 1;

  private TagClauseConverter() {}

  static boolean isTagColumn(String column) {
    return FilterKeywords.TAG.equals(column) || FilterKeywords.TAG_ID.equals(column);
  }

  /** Empty for relations tags cannot be compared with. */
  static Optional<ClauseBuilder> convert(
      Keyword keyword, String resourceType, String resourceTable, boolean trash) {
    String operator;
    switch (keyword.getRelation()) {
      case COLUMN_EQUAL:
        operator = " = ";
        break;
      case COLUMN_APPROX:
        operator = " ILIKE ";
        break;
      case COLUMN_REGEXP:
        operator = " ~ ";
        break;
      default:
        return Optional.empty();
    }

    ClauseBuilder clause =
        new ClauseBuilder()
            .sql("EXISTS (SELECT 1 FROM tag_resources JOIN tags ON tags.id = tag_resources.tag")
            .sql(" WHERE tag_resources.resource_uuid = " + resourceTable + ".uuid")
            .sql(" AND tag_resources.resource_type = ")
            .value(resourceType)
            .sql(" AND tag_resources.resource_location = ")
            .value((long) (trash ? LOCATION_TRASH : LOCATION_TABLE))
            .sql(" AND tags.active = 1 AND ");

    if (FilterKeywords.TAG_ID.equals(keyword.getColumn())) {
      clause.sql("tags.uuid").sql(operator).value(pattern(keyword, keyword.getString()));
    } else {
      String text = keyword.getString();
      int split = text.indexOf('=');
      String name = split < 0 ? text : text.substring(0, split);
      clause.sql("tags.name").sql(operator).value(pattern(keyword, name));
      if (split >= 0) {
        clause.sql(" AND tags.value").sql(operator).value(pattern(keyword, text.substring(split + 1)));
      }
    }
    return Optional.of(new ClauseBuilder().sql("(").append(clause).sql("))"));
  }

  private static String pattern(Keyword keyword, String text) {
    return keyword.getRelation() == KeywordRelation.COLUMN_APPROX
        ? ColumnClauseConverter.contains(text)
        : text;
  }
}
