package org.hypertrace.core.filter.service.compiler;

/** Thrown for a filter column unknown to the resource when unknown columns are rejected. */
public class InvalidFilterColumnException extends IllegalArgumentException {

  private final String column;

  public InvalidFilterColumnException(String resourceType, String column) {
    super("Invalid filter column '" + column + "' for resource type " + resourceType);
    this.column = column;
  }

  public String getColumn() {
    return column;
  }
}
