package org.hypertrace.core.filter.service.controls;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import javax.inject.Inject;
import org.hypertrace.core.filter.service.api.FilterControls;
import org.hypertrace.core.filter.service.api.Keyword;
import org.hypertrace.core.filter.service.api.KeywordType;
import org.hypertrace.core.filter.service.api.ReportFilterControls;
import org.hypertrace.core.filter.service.keyword.FilterKeywords;
import org.hypertrace.core.filter.service.keyword.FilterTokenizer;
import org.hypertrace.core.filter.service.pagination.RowLimits;

/** Reads pagination, sort and report options out of a filter without compiling it. */
public class FilterControlsExtractor {

  private static final String FALLBACK_SORT_FIELD = "name";

  private final FilterTokenizer tokenizer;
  private final RowLimits rowLimits;

  @Inject
  public FilterControlsExtractor(FilterTokenizer tokenizer, RowLimits rowLimits) {
    this.tokenizer = tokenizer;
    this.rowLimits = rowLimits;
  }

  public FilterControls filterControls(String filter) {
    return filterControls(tokenizer.split(filter));
  }

  public ReportFilterControls reportFilterControls(String filter) {
    List<Keyword> keywords = tokenizer.split(filter);

    int overrides = intValue(keywords, FilterKeywords.OVERRIDES).orElse(1);
    int applyOverrides =
        intValue(keywords, FilterKeywords.APPLY_OVERRIDES)
            .or(() -> intValue(keywords, FilterKeywords.OVERRIDES))
            .orElse(1);

    List<String> phrase = new ArrayList<>();
    boolean exact = false;
    for (Keyword keyword : keywords) {
      if (keyword.getColumn() == null) {
        phrase.add(keyword.getString());
        exact |= keyword.isEqual();
      }
    }

    return ReportFilterControls.builder()
        .controls(filterControls(keywords))
        .resultHostsOnly(intValue(keywords, FilterKeywords.RESULT_HOSTS_ONLY).orElse(1))
        .minQod(stringValue(keywords, FilterKeywords.MIN_QOD).orElse(null))
        .levels(stringValue(keywords, FilterKeywords.LEVELS).orElse(null))
        .complianceLevels(stringValue(keywords, FilterKeywords.COMPLIANCE_LEVELS).orElse(null))
        .deltaStates(stringValue(keywords, FilterKeywords.DELTA_STATES).orElse(null))
        .timezone(stringValue(keywords, FilterKeywords.TIMEZONE).orElse(null))
        .notes(intValue(keywords, FilterKeywords.NOTES).orElse(1))
        .overrides(overrides)
        .applyOverrides(applyOverrides)
        .searchPhrase(String.join(" ", phrase))
        .searchPhraseExact(exact)
        .build();
  }

  /**
   * Value of the first keyword on the column, matched case-insensitively and in its {@code _name}
   * form.
   */
  public Optional<String> filterTermValue(String filter, String column) {
    return tokenizer.split(filter).stream()
        .filter(keyword -> keyword.matchesColumn(column))
        .map(Keyword::getString)
        .findFirst();
  }

  /** 1 unless the filter sets {@code apply_overrides=0}; 0 when it is absent. */
  public int applyOverrides(String filter) {
    return filterTermValue(filter, FilterKeywords.APPLY_OVERRIDES)
        .map(value -> "0".equals(value) ? 0 : 1)
        .orElse(FilterKeywords.APPLY_OVERRIDES_DEFAULT);
  }

  public int minQod(String filter) {
    return filterTermValue(filter, FilterKeywords.MIN_QOD)
        .map(FilterControlsExtractor::leadingInt)
        .orElse(FilterKeywords.MIN_QOD_DEFAULT);
  }

  private FilterControls filterControls(List<Keyword> keywords) {
    long first =
        find(keywords, FilterKeywords.FIRST)
            .filter(keyword -> keyword.getType() == KeywordType.INTEGER)
            .map(Keyword::getIntegerValue)
            .orElse(1L);
    long rows =
        find(keywords, FilterKeywords.ROWS)
            .filter(keyword -> keyword.getType() == KeywordType.INTEGER)
            .map(Keyword::getIntegerValue)
            .orElse((long) FilterKeywords.ROWS_PER_PAGE_SENTINEL);

    String sortField = tokenizer.getDefaultSortField().orElse(FALLBACK_SORT_FIELD);
    boolean ascending = true;
    for (Keyword keyword : keywords) {
      if (FilterKeywords.isSort(keyword.getColumn())) {
        sortField = keyword.getString();
        ascending = FilterKeywords.SORT.equals(keyword.getColumn());
        break;
      }
    }
    return new FilterControls(
        RowLimits.firstRow(first), rowLimits.maxRows(rows, false), sortField, ascending);
  }

  private static Optional<Keyword> find(List<Keyword> keywords, String column) {
    return keywords.stream().filter(keyword -> column.equals(keyword.getColumn())).findFirst();
  }

  private static Optional<String> stringValue(List<Keyword> keywords, String column) {
    return find(keywords, column).map(Keyword::getString);
  }

  private static Optional<Integer> intValue(List<Keyword> keywords, String column) {
    return find(keywords, column).map(keyword -> leadingInt(keyword.getString()));
  }

  /** Integer at the start of the text, 0 when there is none. */
  static int leadingInt(String text) {
    int end = 0;
    if (end < text.length() && (text.charAt(end) == '-' || text.charAt(end) == '+')) {
      end++;
    }
    while (end < text.length() && Character.isDigit(text.charAt(end))) {
      end++;
    }
    try {
      return Integer.parseInt(text.substring(0, end));
    } catch (NumberFormatException e) {
      return 0;
    }
  }
}
