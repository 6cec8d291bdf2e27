package org.hypertrace.core.filter.service;

import com.typesafe.config.Config;
import java.time.Duration;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.Value;
import lombok.experimental.NonFinal;

@Value
@NonFinal
public class FilterServiceConfig {

  private static final String CONFIG_PATH_PAGINATION = "pagination";
  private static final String CONFIG_PATH_FILTER = "filter";
  private static final String CONFIG_PATH_SORT = "sort";
  private static final String CONFIG_PATH_RESOURCES = "resources";
  private static final String CONFIG_PATH_DATABASE = "database";

  PaginationConfig paginationConfig;
  FilterConfig filterConfig;
  SortConfig sortConfig;
  List<Config> resourceConfigs;
  Optional<DatabaseClientConfig> databaseClientConfig;

  public FilterServiceConfig(Config config) {
    Config resolved = config.resolve();
    this.paginationConfig = new PaginationConfig(resolved.getConfig(CONFIG_PATH_PAGINATION));
    this.filterConfig = new FilterConfig(resolved.getConfig(CONFIG_PATH_FILTER));
    this.sortConfig = new SortConfig(resolved.getConfig(CONFIG_PATH_SORT));
    this.resourceConfigs = List.copyOf(resolved.getConfigList(CONFIG_PATH_RESOURCES));
    this.databaseClientConfig =
        resolved.hasPath(CONFIG_PATH_DATABASE)
            ? Optional.of(new DatabaseClientConfig(resolved.getConfig(CONFIG_PATH_DATABASE)))
            : Optional.empty();
  }

  @Value
  @NonFinal
  public static class PaginationConfig {
    private static final String CONFIG_PATH_ROWS_PER_PAGE = "rowsPerPage";
    private static final String CONFIG_PATH_MAX_ROWS_PER_PAGE = "maxRowsPerPage";
    int rowsPerPage;

    /** Zero disables the cap. */
    int maxRowsPerPage;

    private PaginationConfig(Config config) {
      this.rowsPerPage = config.getInt(CONFIG_PATH_ROWS_PER_PAGE);
      this.maxRowsPerPage = config.getInt(CONFIG_PATH_MAX_ROWS_PER_PAGE);
    }
  }

  @Value
  @NonFinal
  public static class FilterConfig {
    private static final String CONFIG_PATH_DEFAULT_SORT_FIELD = "defaultSortField";
    private static final String CONFIG_PATH_UNKNOWN_COLUMN_MODE = "unknownColumnMode";
    private static final String CONFIG_PATH_ENUMERATED_COLUMNS = "enumeratedColumns";
    private static final String CONFIG_PATH_TIMEZONE = "timezone";

    /** Empty when listings keep table order. */
    Optional<String> defaultSortField;

    UnknownColumnMode unknownColumnMode;

    /** Known value tokens per enumerated column, used to narrow free-text searches. */
    Map<String, List<String>> enumeratedColumns;

    ZoneId timezone;

    private FilterConfig(Config config) {
      String sortField =
          config.hasPath(CONFIG_PATH_DEFAULT_SORT_FIELD)
              ? config.getString(CONFIG_PATH_DEFAULT_SORT_FIELD)
              : "";
      this.defaultSortField = sortField.isEmpty() ? Optional.empty() : Optional.of(sortField);
      this.unknownColumnMode =
          config.hasPath(CONFIG_PATH_UNKNOWN_COLUMN_MODE)
              ? config.getEnum(UnknownColumnMode.class, CONFIG_PATH_UNKNOWN_COLUMN_MODE)
              : UnknownColumnMode.IGNORE;
      Map<String, List<String>> enumerated = new LinkedHashMap<>();
      if (config.hasPath(CONFIG_PATH_ENUMERATED_COLUMNS)) {
        Config enumeratedConfig = config.getConfig(CONFIG_PATH_ENUMERATED_COLUMNS);
        enumeratedConfig
            .root()
            .keySet()
            .forEach(column -> enumerated.put(column, enumeratedConfig.getStringList(column)));
      }
      this.enumeratedColumns = Map.copyOf(enumerated);
      this.timezone =
          config.hasPath(CONFIG_PATH_TIMEZONE)
              ? ZoneId.of(config.getString(CONFIG_PATH_TIMEZONE))
              : ZoneId.of("UTC");
    }

    public enum UnknownColumnMode {
      IGNORE,
      WARN,
      ERROR
    }
  }

  @Value
  @NonFinal
  public static class SortConfig {
    private static final String CONFIG_PATH_CATEGORIES = "categories";

    List<SortCategoryConfig> categories;

    private SortConfig(Config config) {
      this.categories =
          config.hasPath(CONFIG_PATH_CATEGORIES)
              ? config.getConfigList(CONFIG_PATH_CATEGORIES).stream()
                  .map(SortCategoryConfig::new)
                  .collect(Collectors.toUnmodifiableList())
              : List.of();
    }
  }

  /** A sort expression template shared by every column of the category. */
  @Value
  @NonFinal
  public static class SortCategoryConfig {
    private static final String CONFIG_PATH_NAME = "name";
    private static final String CONFIG_PATH_COLUMNS = "columns";
    private static final String CONFIG_PATH_TEMPLATE = "template";
    String name;
    List<String> columns;
    String template;

    private SortCategoryConfig(Config config) {
      this.name = config.getString(CONFIG_PATH_NAME);
      this.columns = List.copyOf(config.getStringList(CONFIG_PATH_COLUMNS));
      this.template = config.getString(CONFIG_PATH_TEMPLATE);
    }
  }

  @Value
  @NonFinal
  public static class DatabaseClientConfig {
    private static final String CONFIG_PATH_NAME = "name";
    private static final String CONFIG_PATH_CONNECTION_STRING = "connectionString";
    private static final String CONFIG_PATH_USER = "user";
    private static final String CONFIG_PATH_PASSWORD = "password";
    private static final String CONFIG_PATH_MAX_CONNECTION_ATTEMPTS = "maxConnectionAttempts";
    private static final String CONFIG_PATH_CONNECTION_RETRY_BACKOFF = "connectionRetryBackoff";
    String name;
    String connectionString;
    Optional<String> user;
    Optional<String> password;
    Optional<Integer> maxConnectionAttempts;
    Optional<Duration> connectionRetryBackoff;

    private DatabaseClientConfig(Config config) {
      this.name = config.hasPath(CONFIG_PATH_NAME) ? config.getString(CONFIG_PATH_NAME) : "default";
      this.connectionString = config.getString(CONFIG_PATH_CONNECTION_STRING);
      this.user =
          config.hasPath(CONFIG_PATH_USER)
              ? Optional.of(config.getString(CONFIG_PATH_USER))
              : Optional.empty();
      this.password =
          config.hasPath(CONFIG_PATH_PASSWORD)
              ? Optional.of(config.getString(CONFIG_PATH_PASSWORD))
              : Optional.empty();
      this.maxConnectionAttempts =
          config.hasPath(CONFIG_PATH_MAX_CONNECTION_ATTEMPTS)
              ? Optional.of(config.getInt(CONFIG_PATH_MAX_CONNECTION_ATTEMPTS))
              : Optional.empty();
      this.connectionRetryBackoff =
          config.hasPath(CONFIG_PATH_CONNECTION_RETRY_BACKOFF)
              ? Optional.of(config.getDuration(CONFIG_PATH_CONNECTION_RETRY_BACKOFF))
              : Optional.empty();
    }
  }
}
