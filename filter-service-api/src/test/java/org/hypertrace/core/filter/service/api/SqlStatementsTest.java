package org.hypertrace.core.filter.service.api;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class SqlStatementsTest {

  @Test
  void inlinesParamsInOrder() {
    Params params = Params.newBuilder().addStringParam("foo").addLongParam(1L).build();
    assertEquals(
        "(CAST(name AS TEXT) = 'foo') AND NOT (CAST(active AS NUMERIC) = 1)",
        SqlStatements.resolve(
            "(CAST(name AS TEXT) = ?) AND NOT (CAST(active AS NUMERIC) = ?)", params));
  }

  @Test
  void doublesEmbeddedQuotes() {
    Params params = Params.newBuilder().addStringParam("O'Brien").build();
    assertEquals("name = 'O''Brien'", SqlStatements.resolve("name = ?", params));
  }

  @Test
  void leavesStatementWithoutParamsUntouched() {
    assertEquals("SELECT 1", SqlStatements.resolve("SELECT 1", Params.empty()));
    assertEquals("", SqlStatements.resolve("", Params.empty()));
  }
}
