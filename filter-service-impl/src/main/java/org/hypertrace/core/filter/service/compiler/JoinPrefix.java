package org.hypertrace.core.filter.service.compiler;

/** The connective placed in front of a compiled term. */
final class JoinPrefix {

  private JoinPrefix() {}

  static String of(boolean firstTerm, boolean lastWasAnd, boolean lastWasNot) {
    if (firstTerm) {
      return lastWasNot ? "NOT " : "";
    }
    if (lastWasAnd) {
      return lastWasNot ? " AND NOT " : " AND ";
    }
    return lastWasNot ? " OR NOT " : " OR ";
  }
}
