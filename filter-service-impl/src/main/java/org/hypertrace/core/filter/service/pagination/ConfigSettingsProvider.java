package org.hypertrace.core.filter.service.pagination;

import javax.inject.Inject;
import javax.inject.Singleton;
import org.hypertrace.core.filter.service.FilterServiceConfig;
import org.hypertrace.core.filter.service.FilterServiceConfig.PaginationConfig;

@Singleton
public class ConfigSettingsProvider implements SettingsProvider {
  private final PaginationConfig paginationConfig;

  @Inject
  ConfigSettingsProvider(FilterServiceConfig config) {
    this.paginationConfig = config.getPaginationConfig();
  }

  @Override
  public int getRowsPerPage() {
    return paginationConfig.getRowsPerPage();
  }

  @Override
  public int getMaxRowsPerPage() {
    return paginationConfig.getMaxRowsPerPage();
  }
}
