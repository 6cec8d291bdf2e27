package org.hypertrace.core.filter.service.resource;

import java.util.Set;

/** The resource type names known to the management layer. */
public final class ResourceTypes {

  private static final Set<String> VALID_TYPES =
      Set.of(
          "alert",
          "asset",
          "config",
          "credential",
          "filter",
          "group",
          "host",
          "info",
          "note",
          "os",
          "override",
          "permission",
          "port_list",
          "report",
          "report_config",
          "report_format",
          "result",
          "role",
          "scanner",
          "schedule",
          "tag",
          "target",
          "task",
          "ticket",
          "tls_certificate",
          "user",
          "vuln");

  private ResourceTypes() {}

  public static boolean isValid(String type) {
    return type != null && VALID_TYPES.contains(type);
  }

  /** Resources of a type live in the plural table, e.g. {@code tasks}. */
  public static String tableName(String type) {
    return type + "s";
  }

  public static String trashTableName(String type) {
    return tableName(type) + "_trash";
  }
}
