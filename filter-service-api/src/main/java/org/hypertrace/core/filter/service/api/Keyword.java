package org.hypertrace.core.filter.service.api;

import java.util.Locale;
import java.util.Set;
import javax.annotation.Nullable;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/** One parsed unit of a filter string. Instances are immutable. */
@Value
@Builder(toBuilder = true)
public class Keyword {
  private static final Set<String> OPERATOR_WORDS = Set.of("and", "or", "not", "re", "regexp");

  /** Absent for free-text terms and logical operators. */
  @Nullable String column;

  @NonNull @Builder.Default String string = "";

  long integerValue;
  double doubleValue;

  @NonNull @Builder.Default KeywordType type = KeywordType.STRING;
  @NonNull @Builder.Default KeywordRelation relation = KeywordRelation.NONE;

  boolean quoted;

  /** Set when a free-text term carried a leading bare {@code =}. */
  boolean equal;

  /** Set when a free-text term carried a leading bare {@code ~}. */
  boolean approx;

  public static boolean isOperatorWord(String text) {
    return OPERATOR_WORDS.contains(text.toLowerCase(Locale.ROOT));
  }

  public boolean hasColumn() {
    return column != null;
  }

  public boolean isOperator() {
    return column == null
        && relation == KeywordRelation.NONE
        && !quoted
        && !equal
        && !approx
        && isOperatorWord(string);
  }

  /** True for the given operator word, e.g. {@code isOperator("and")}. */
  public boolean isOperator(String word) {
    return isOperator() && string.equalsIgnoreCase(word);
  }

  public boolean isFreeText() {
    return column == null && !isOperator();
  }

  /** Matches the column name case-insensitively, including the private {@code _name} form. */
  public boolean matchesColumn(String name) {
    if (column == null || name == null) {
      return false;
    }
    return column.equalsIgnoreCase(name)
        || (column.startsWith("_") && column.substring(1).equalsIgnoreCase(name));
  }
}
