package org.hypertrace.core.filter.service;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.typesafe.config.Config;
import java.time.Clock;
import java.time.ZoneId;
import javax.inject.Named;
import javax.inject.Singleton;
import org.hypertrace.core.filter.service.FilterServiceConfig.FilterConfig;
import org.hypertrace.core.filter.service.keyword.FilterTokenizer;
import org.hypertrace.core.filter.service.keyword.KeywordParser;
import org.hypertrace.core.filter.service.pagination.ConfigSettingsProvider;
import org.hypertrace.core.filter.service.pagination.SettingsProvider;
import org.hypertrace.core.filter.service.postgres.PostgresClientFactory;
import org.hypertrace.core.filter.service.postgres.PostgresClientFactory.PostgresClient;
import org.hypertrace.core.filter.service.sort.SortClauseBuilder;

public class FilterServiceModule extends AbstractModule {

  private final FilterServiceConfig config;

  public FilterServiceModule(Config config) {
    this.config = new FilterServiceConfig(config);
  }

  @Override
  protected void configure() {
    bind(FilterServiceConfig.class).toInstance(this.config);
    bind(FilterConfig.class).toInstance(this.config.getFilterConfig());
    bind(Clock.class).toInstance(Clock.systemUTC());
    bind(SettingsProvider.class).to(ConfigSettingsProvider.class);
    bind(FilterService.class).to(FilterServiceImpl.class);
    this.config
        .getDatabaseClientConfig()
        .ifPresent(
            databaseConfig ->
                bind(PostgresClient.class)
                    .toInstance(PostgresClientFactory.createPostgresClient(databaseConfig)));
  }

  @Provides
  @Named(KeywordParser.FILTER_ZONE)
  ZoneId provideFilterZone(FilterConfig filterConfig) {
    return filterConfig.getTimezone();
  }

  @Provides
  @Singleton
  FilterTokenizer provideFilterTokenizer(KeywordParser parser, FilterConfig filterConfig) {
    return new FilterTokenizer(parser, filterConfig.getDefaultSortField());
  }

  @Provides
  @Singleton
  SortClauseBuilder provideSortClauseBuilder(FilterServiceConfig filterServiceConfig) {
    return new SortClauseBuilder(filterServiceConfig.getSortConfig().getCategories());
  }
}
