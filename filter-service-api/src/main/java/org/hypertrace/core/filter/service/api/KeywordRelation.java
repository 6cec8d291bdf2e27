package org.hypertrace.core.filter.service.api;

public enum KeywordRelation {
  /** Logical operators, control keywords and exact free-text terms. */
  NONE(""),
  /** Free-text "contains" term. */
  APPROX("~"),
  COLUMN_EQUAL("="),
  COLUMN_APPROX("~"),
  COLUMN_ABOVE(">"),
  COLUMN_BELOW("<"),
  COLUMN_REGEXP(":");

  private final String symbol;

  KeywordRelation(String symbol) {
    this.symbol = symbol;
  }

  public String getSymbol() {
    return symbol;
  }

  public boolean isColumnRelation() {
    return this != NONE && this != APPROX;
  }

  public static KeywordRelation fromOperator(char operator) {
    switch (operator) {
      case '=':
        return COLUMN_EQUAL;
      case '~':
        return COLUMN_APPROX;
      case '>':
        return COLUMN_ABOVE;
      case '<':
        return COLUMN_BELOW;
      case ':':
        return COLUMN_REGEXP;
      default:
        throw new IllegalArgumentException("Unsupported relation operator: " + operator);
    }
  }
}
