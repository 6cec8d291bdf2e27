package org.hypertrace.core.filter.service.pagination;

import javax.inject.Inject;
import org.hypertrace.core.filter.service.keyword.FilterKeywords;

/** Turns filter pagination values into query offsets and page sizes. */
public class RowLimits {
  private final SettingsProvider settings;

  @Inject
  public RowLimits(SettingsProvider settings) {
    this.settings = settings;
  }

  /** Zero-based offset for a 1-based {@code first} value. */
  public static int firstRow(long first) {
    return (int) Math.max(0, Math.min(Integer.MAX_VALUE, first - 1));
  }

  /**
   * Page size for a {@code rows} value: the rows-per-page setting for {@code -2}, unlimited
   * ({@code -1}) below 1, then capped unless the cap is ignored.
   */
  public int maxRows(long rows, boolean ignoreCap) {
    long max = rows == FilterKeywords.ROWS_PER_PAGE_SENTINEL ? settings.getRowsPerPage() : rows;
    if (max < 1) {
      max = -1;
    }
    return cap((int) Math.min(Integer.MAX_VALUE, max), ignoreCap);
  }

  /** Clamps a page size to the system cap, an unlimited size included. */
  public int cap(int max, boolean ignoreCap) {
    if (ignoreCap) {
      return max;
    }
    int cap = settings.getMaxRowsPerPage();
    if (cap > 0 && (max < 0 || max > cap)) {
      return cap;
    }
    return max;
  }
}
