package org.hypertrace.core.filter.service.pagination;

/** Read-only access to the listing settings of the current user and the system. */
public interface SettingsProvider {

  /** The "Rows Per Page" setting, substituted for {@code rows=-2}. */
  int getRowsPerPage();

  /** The "Max Rows Per Page" cap, zero when listings are not capped. */
  int getMaxRowsPerPage();
}
