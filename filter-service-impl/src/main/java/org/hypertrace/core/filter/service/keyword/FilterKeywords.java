package org.hypertrace.core.filter.service.keyword;

import java.util.List;
import java.util.Set;

/** Column names with a fixed meaning in filter strings. */
public final class FilterKeywords {
  public static final String FIRST = "first";
  public static final String ROWS = "rows";
  public static final String SORT = "sort";
  public static final String SORT_REVERSE = "sort-reverse";
  public static final String PERMISSION = "permission";
  public static final String OWNER = "owner";
  public static final String TAG = "tag";
  public static final String TAG_ID = "tag_id";

  public static final String APPLY_OVERRIDES = "apply_overrides";
  public static final String OVERRIDES = "overrides";
  public static final String NOTES = "notes";
  public static final String RESULT_HOSTS_ONLY = "result_hosts_only";
  public static final String MIN_QOD = "min_qod";
  public static final String LEVELS = "levels";
  public static final String COMPLIANCE_LEVELS = "compliance_levels";
  public static final String DELTA_STATES = "delta_states";
  public static final String TIMEZONE = "timezone";

  public static final String SEVERITY = "severity";
  public static final String NEW_SEVERITY = "new_severity";

  /** Rows value standing for the user's rows-per-page setting. */
  public static final int ROWS_PER_PAGE_SENTINEL = -2;

  public static final int APPLY_OVERRIDES_DEFAULT = 0;
  public static final int MIN_QOD_DEFAULT = 70;

  /** Only the first occurrence of these is kept. */
  public static final List<String> SINGLE_VALUED =
      List.of(
          FIRST,
          ROWS,
          APPLY_OVERRIDES,
          DELTA_STATES,
          LEVELS,
          MIN_QOD,
          NOTES,
          OVERRIDES,
          RESULT_HOSTS_ONLY,
          TIMEZONE);

  public static final Set<String> BOOLEAN_OPTIONS =
      Set.of(APPLY_OVERRIDES, OVERRIDES, NOTES, RESULT_HOSTS_ONLY);

  /** Keywords that steer the listing and never become WHERE conditions. */
  public static final Set<String> CONTROL =
      Set.of(
          FIRST,
          ROWS,
          SORT,
          SORT_REVERSE,
          APPLY_OVERRIDES,
          OVERRIDES,
          NOTES,
          RESULT_HOSTS_ONLY,
          MIN_QOD,
          LEVELS,
          COMPLIANCE_LEVELS,
          DELTA_STATES,
          TIMEZONE);

  private FilterKeywords() {}

  public static boolean isControl(String column) {
    return column != null && CONTROL.contains(column);
  }

  public static boolean isSort(String column) {
    return SORT.equals(column) || SORT_REVERSE.equals(column);
  }
}
