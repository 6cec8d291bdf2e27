package org.hypertrace.core.filter.service.normalizer;

import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nullable;
import javax.inject.Inject;
import org.hypertrace.core.filter.service.api.Keyword;
import org.hypertrace.core.filter.service.api.KeywordRelation;
import org.hypertrace.core.filter.service.api.KeywordType;
import org.hypertrace.core.filter.service.keyword.FilterKeywords;
import org.hypertrace.core.filter.service.keyword.FilterTokenizer;
import org.hypertrace.core.filter.service.pagination.RowLimits;

/**
 * Rewrites filter strings into their canonical form for storage and display. The result reads
 * back into the same keywords, so cleaning twice gives the same string.
 */
public class FilterNormalizer {

  private static final String RELATION_CHARS = "=~<>:";

  private final FilterTokenizer tokenizer;
  private final RowLimits rowLimits;

  @Inject
  public FilterNormalizer(FilterTokenizer tokenizer, RowLimits rowLimits) {
    this.tokenizer = tokenizer;
    this.rowLimits = rowLimits;
  }

  public String clean(String filter, boolean ignoreRowCap) {
    return clean(filter, null, ignoreRowCap);
  }

  /**
   * Cleans the filter, leaving out keywords on {@code dropColumn} (matched case-insensitively and
   * in its {@code _name} form). The {@code rows} value is written as the effective page size: the
   * rows-per-page setting for {@code -2}, then the row cap unless it is ignored.
   */
  public String clean(String filter, @Nullable String dropColumn, boolean ignoreRowCap) {
    List<String> parts = new ArrayList<>();
    for (Keyword keyword : tokenizer.split(filter)) {
      if (dropColumn != null && keyword.matchesColumn(dropColumn)) {
        continue;
      }
      if (FilterKeywords.ROWS.equals(keyword.getColumn())
          && keyword.getType() == KeywordType.INTEGER) {
        int rows = rowLimits.maxRows(keyword.getIntegerValue(), ignoreRowCap);
        parts.add(FilterKeywords.ROWS + "=" + rows);
        continue;
      }
      parts.add(toFilterString(keyword));
    }
    return String.join(" ", parts);
  }

  static String toFilterString(Keyword keyword) {
    if (keyword.isOperator()) {
      return keyword.getString();
    }
    String value = keyword.getString();
    if (keyword.getColumn() != null) {
      String symbol =
          keyword.getRelation() == KeywordRelation.NONE ? "=" : keyword.getRelation().getSymbol();
      boolean quote = keyword.isQuoted() || startsWithQuote(value) || hasWhitespace(value);
      return keyword.getColumn() + symbol + (quote ? quote(value) : value);
    }
    if (keyword.isEqual() || keyword.isApprox()) {
      boolean quote =
          keyword.isQuoted() || value.isEmpty() || startsWithQuote(value) || hasWhitespace(value);
      return (keyword.isEqual() ? "=" : "~") + (quote ? quote(value) : value);
    }
    return needsQuotes(value, keyword.isQuoted()) ? quote(value) : value;
  }

  /** A free-text value must not read back as a column keyword, an operator or a marker. */
  private static boolean needsQuotes(String value, boolean quoted) {
    if (quoted || value.isEmpty() || startsWithQuote(value) || hasWhitespace(value)) {
      return true;
    }
    if (Keyword.isOperatorWord(value)) {
      return true;
    }
    for (int i = 0; i < value.length(); i++) {
      if (RELATION_CHARS.indexOf(value.charAt(i)) >= 0) {
        return true;
      }
    }
    return false;
  }

  private static boolean startsWithQuote(String value) {
    return !value.isEmpty() && (value.charAt(0) == '"' || value.charAt(0) == '\'');
  }

  private static boolean hasWhitespace(String value) {
    return value.chars().anyMatch(Character::isWhitespace);
  }

  private static String quote(String value) {
    return "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
  }
}
