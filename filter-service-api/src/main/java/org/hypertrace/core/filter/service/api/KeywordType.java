package org.hypertrace.core.filter.service.api;

/** Value type inferred for a keyword, also used as the declared type of a column. */
public enum KeywordType {
  STRING,
  INTEGER,
  DOUBLE,
  UNKNOWN;

  public boolean isNumeric() {
    return this == INTEGER || this == DOUBLE;
  }
}
