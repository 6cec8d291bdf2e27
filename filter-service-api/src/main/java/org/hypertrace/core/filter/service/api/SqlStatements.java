package org.hypertrace.core.filter.service.api;

/** Helpers for rendering parameterized statements for logs and display. */
public final class SqlStatements {

  private SqlStatements() {}

  /**
   * Inlines the params into the statement, one per {@code ?} placeholder. The result is meant for
   * logging and display; statements are executed with the params bound.
   */
  public static String resolve(String statement, Params params) {
    if (statement.isEmpty() || params.isEmpty()) {
      return statement;
    }
    StringBuilder sb = new StringBuilder();
    int index = 0;
    for (int i = 0; i < statement.length(); i++) {
      char c = statement.charAt(i);
      if (c == '?' && index < params.size()) {
        sb.append(toLiteral(params.getValue(index++)));
      } else {
        sb.append(c);
      }
    }
    return sb.toString();
  }

  public static String quoteString(String value) {
    return "'" + value.replace("'", "''") + "'";
  }

  private static String toLiteral(Object value) {
    if (value instanceof String) {
      return quoteString((String) value);
    }
    return String.valueOf(value);
  }
}
