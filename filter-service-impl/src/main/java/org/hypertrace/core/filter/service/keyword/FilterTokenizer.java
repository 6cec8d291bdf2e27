package org.hypertrace.core.filter.service.keyword;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import org.hypertrace.core.filter.service.api.Keyword;
import org.hypertrace.core.filter.service.api.KeywordRelation;
import org.hypertrace.core.filter.service.api.KeywordType;

/**
 * Splits a filter string into keywords.
 *
 * <p>Parts are separated by whitespace outside quotes. A part of the form {@code name<op>value},
 * where {@code op} is one of {@code = ~ > < :}, becomes a column keyword. A value may be wrapped
 * in double or single quotes to keep whitespace and operators literal; inside quotes a backslash
 * escapes the quote character and itself. An unterminated quote runs to the end of the input.
 *
 * <p>The result always holds one {@code first}, one {@code rows} and, when a default sort field
 * is given, at least one sort keyword; missing ones are appended.
 */
public class FilterTokenizer {

  private static final Pattern COLUMN_NAME = Pattern.compile("[A-Za-z0-9_\\-]+");
  private static final String OPERATORS = "=~><:";

  private final KeywordParser parser;
  private final Optional<String> defaultSortField;

  public FilterTokenizer(KeywordParser parser, Optional<String> defaultSortField) {
    this.parser = parser;
    this.defaultSortField = defaultSortField;
  }

  public Optional<String> getDefaultSortField() {
    return defaultSortField;
  }

  public List<Keyword> split(String filter) {
    return split(filter, defaultSortField);
  }

  public List<Keyword> split(String filter, Optional<String> sortField) {
    List<Keyword> keywords = new ArrayList<>();
    Set<String> seenSingleValued = new HashSet<>();
    for (RawKeyword raw : scan(filter == null ? "" : filter)) {
      Keyword keyword = parser.parse(raw);
      String column = keyword.getColumn();
      if (column != null
          && FilterKeywords.SINGLE_VALUED.contains(column)
          && !seenSingleValued.add(column)) {
        continue;
      }
      keywords.add(keyword);
    }
    appendDefaults(keywords, sortField);
    return keywords;
  }

  List<RawKeyword> scan(String filter) {
    List<RawKeyword> parts = new ArrayList<>();
    int length = filter.length();
    int i = 0;
    while (true) {
      while (i < length && Character.isWhitespace(filter.charAt(i))) {
        i++;
      }
      if (i >= length) {
        break;
      }

      char prefix = RawKeyword.NO_CHAR;
      char c = filter.charAt(i);
      if (c == '=' || c == '~') {
        prefix = c;
        i++;
      }

      StringBuilder value = new StringBuilder();
      String column = null;
      char operator = RawKeyword.NO_CHAR;
      boolean quoted = false;
      boolean valueStart = true;
      while (i < length) {
        c = filter.charAt(i);
        if (valueStart && (c == '"' || c == '\'')) {
          quoted = true;
          valueStart = false;
          i = readQuoted(filter, i + 1, c, value);
          continue;
        }
        if (Character.isWhitespace(c)) {
          break;
        }
        if (column == null
            && prefix == RawKeyword.NO_CHAR
            && !quoted
            && OPERATORS.indexOf(c) >= 0
            && COLUMN_NAME.matcher(value).matches()) {
          column = value.toString();
          operator = c;
          value.setLength(0);
          valueStart = true;
          i++;
          continue;
        }
        value.append(c);
        valueStart = false;
        i++;
      }

      // A lone '=' or '~' carries nothing.
      if (column == null && !quoted && value.length() == 0) {
        continue;
      }
      parts.add(new RawKeyword(column, operator, prefix, value.toString(), quoted));
    }
    return parts;
  }

  /** Reads up to the closing quote, returning the index after it or the input length. */
  private static int readQuoted(String filter, int start, char quote, StringBuilder value) {
    int length = filter.length();
    int i = start;
    while (i < length) {
      char c = filter.charAt(i);
      if (c == '\\' && i + 1 < length) {
        char next = filter.charAt(i + 1);
        if (next == quote || next == '\\') {
          value.append(next);
          i += 2;
          continue;
        }
      }
      if (c == quote) {
        return i + 1;
      }
      value.append(c);
      i++;
    }
    return length;
  }

  private static void appendDefaults(List<Keyword> keywords, Optional<String> sortField) {
    boolean hasFirst = false;
    boolean hasRows = false;
    boolean hasSort = false;
    for (Keyword keyword : keywords) {
      String column = keyword.getColumn();
      hasFirst |= FilterKeywords.FIRST.equals(column);
      hasRows |= FilterKeywords.ROWS.equals(column);
      hasSort |= FilterKeywords.isSort(column);
    }
    if (!hasFirst) {
      keywords.add(control(FilterKeywords.FIRST, 1));
    }
    if (!hasRows) {
      keywords.add(control(FilterKeywords.ROWS, FilterKeywords.ROWS_PER_PAGE_SENTINEL));
    }
    if (!hasSort && sortField.isPresent()) {
      keywords.add(
          Keyword.builder()
              .column(FilterKeywords.SORT)
              .string(sortField.get())
              .relation(KeywordRelation.NONE)
              .type(KeywordType.STRING)
              .build());
    }
  }

  private static Keyword control(String column, long value) {
    return Keyword.builder()
        .column(column)
        .string(String.valueOf(value))
        .relation(KeywordRelation.NONE)
        .type(KeywordType.INTEGER)
        .integerValue(value)
        .build();
  }
}
