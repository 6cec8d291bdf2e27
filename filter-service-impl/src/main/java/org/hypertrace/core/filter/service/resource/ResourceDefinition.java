package org.hypertrace.core.filter.service.resource;

import com.google.common.base.Preconditions;
import com.typesafe.config.Config;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.Value;
import org.hypertrace.core.filter.service.api.ColumnDeclaration;
import org.hypertrace.core.filter.service.api.KeywordType;
import org.hypertrace.core.filter.service.api.ResourceColumns;

/** Column tables, storage tables and sort overrides of one resource type. */
@Value
public class ResourceDefinition {

  private static final String TYPE_CONFIG_KEY = "type";
  private static final String TABLE_CONFIG_KEY = "table";
  private static final String TRASH_TABLE_CONFIG_KEY = "trashTable";
  private static final String FILTER_COLUMNS_CONFIG_KEY = "filterColumns";
  private static final String SELECT_COLUMNS_CONFIG_KEY = "selectColumns";
  private static final String WHERE_COLUMNS_CONFIG_KEY = "whereColumns";
  private static final String SORT_TEMPLATES_CONFIG_KEY = "sortTemplates";
  private static final String DEFAULT_ORDER_CONFIG_KEY = "defaultOrder";
  private static final String COLUMN_SELECT_CONFIG_KEY = "select";
  private static final String COLUMN_FILTER_CONFIG_KEY = "filter";
  private static final String COLUMN_TYPE_CONFIG_KEY = "type";

  String type;
  String table;
  String trashTable;
  ResourceColumns columns;

  /** Sort expression templates for columns of this type that need a computed ordering. */
  Map<String, String> sortTemplates;

  /** Ordering used when no sort keyword applies. */
  Optional<String> defaultOrder;

  public String getTable(boolean trash) {
    return trash ? trashTable : table;
  }

  public static ResourceDefinition parse(Config config) {
    String type = config.getString(TYPE_CONFIG_KEY);
    Preconditions.checkArgument(ResourceTypes.isValid(type), "Unknown resource type: %s", type);
    String table =
        config.hasPath(TABLE_CONFIG_KEY)
            ? config.getString(TABLE_CONFIG_KEY)
            : ResourceTypes.tableName(type);
    String trashTable =
        config.hasPath(TRASH_TABLE_CONFIG_KEY)
            ? config.getString(TRASH_TABLE_CONFIG_KEY)
            : ResourceTypes.trashTableName(type);

    List<ColumnDeclaration> selectColumns = parseColumns(config, SELECT_COLUMNS_CONFIG_KEY);
    List<ColumnDeclaration> whereColumns = parseColumns(config, WHERE_COLUMNS_CONFIG_KEY);
    List<String> filterColumns =
        config.hasPath(FILTER_COLUMNS_CONFIG_KEY)
            ? config.getStringList(FILTER_COLUMNS_CONFIG_KEY)
            : selectColumns.stream()
                .map(ColumnDeclaration::getFilter)
                .filter(filter -> filter != null)
                .collect(Collectors.toUnmodifiableList());

    Map<String, String> sortTemplates = new HashMap<>();
    if (config.hasPath(SORT_TEMPLATES_CONFIG_KEY)) {
      Config templates = config.getConfig(SORT_TEMPLATES_CONFIG_KEY);
      templates.root().keySet().forEach(key -> sortTemplates.put(key, templates.getString(key)));
    }
    Optional<String> defaultOrder =
        config.hasPath(DEFAULT_ORDER_CONFIG_KEY)
            ? Optional.of(config.getString(DEFAULT_ORDER_CONFIG_KEY))
            : Optional.empty();

    return new ResourceDefinition(
        type,
        table,
        trashTable,
        new ResourceColumns(filterColumns, selectColumns, whereColumns),
        Map.copyOf(sortTemplates),
        defaultOrder);
  }

  private static List<ColumnDeclaration> parseColumns(Config config, String key) {
    if (!config.hasPath(key)) {
      return List.of();
    }
    return config.getConfigList(key).stream()
        .map(
            column ->
                ColumnDeclaration.of(
                    column.getString(COLUMN_SELECT_CONFIG_KEY),
                    column.hasPath(COLUMN_FILTER_CONFIG_KEY)
                        ? column.getString(COLUMN_FILTER_CONFIG_KEY)
                        : null,
                    column.hasPath(COLUMN_TYPE_CONFIG_KEY)
                        ? column.getEnum(KeywordType.class, COLUMN_TYPE_CONFIG_KEY)
                        : KeywordType.STRING))
        .collect(Collectors.toUnmodifiableList());
  }
}
