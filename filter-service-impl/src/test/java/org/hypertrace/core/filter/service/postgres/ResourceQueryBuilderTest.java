package org.hypertrace.core.filter.service.postgres;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;
import java.util.Optional;
import org.hypertrace.core.filter.service.api.ColumnDeclaration;
import org.hypertrace.core.filter.service.api.CompiledFilter;
import org.hypertrace.core.filter.service.api.KeywordType;
import org.hypertrace.core.filter.service.api.Params;
import org.junit.jupiter.api.Test;

class ResourceQueryBuilderTest {

  private static final List<ColumnDeclaration> COLUMNS =
      List.of(
          ColumnDeclaration.of("id", null, KeywordType.INTEGER),
          ColumnDeclaration.of("run_status_name (run_status)", "status", KeywordType.STRING));

  @Test
  public void testSelectList() {
    assertEquals(
        "id AS id, run_status_name (run_status) AS status", ResourceQueryBuilder.buildSelect(COLUMNS));
    assertEquals("''", ResourceQueryBuilder.buildSelect(List.of()));
  }

  @Test
  public void testListWithEverything() {
    CompiledFilter filter =
        CompiledFilter.builder()
            .whereClause(Optional.of("(CAST(name AS TEXT) = ?)"))
            .params(Params.newBuilder().addStringParam("a'b").build())
            .orderClause("lower(name) ASC")
            .firstRow(20)
            .maxRows(10)
            .permissions(List.of())
            .ownerFilter(Optional.empty())
            .build();

    ResourceQuery query = ResourceQueryBuilder.list("tasks", COLUMNS, filter);
    assertEquals(
        "SELECT id AS id, run_status_name (run_status) AS status FROM tasks"
            + " WHERE (CAST(name AS TEXT) = ?) ORDER BY lower(name) ASC LIMIT 10 OFFSET 20",
        query.getStatement());
    assertEquals(
        "SELECT id AS id, run_status_name (run_status) AS status FROM tasks"
            + " WHERE (CAST(name AS TEXT) = 'a''b') ORDER BY lower(name) ASC LIMIT 10 OFFSET 20",
        query.getResolvedStatement());
  }

  @Test
  public void testListWithoutOptionalParts() {
    CompiledFilter filter =
        CompiledFilter.builder()
            .whereClause(Optional.empty())
            .params(Params.empty())
            .orderClause("")
            .firstRow(0)
            .maxRows(-1)
            .permissions(List.of())
            .ownerFilter(Optional.empty())
            .build();

    assertEquals(
        "SELECT id AS id, run_status_name (run_status) AS status FROM tasks_trash",
        ResourceQueryBuilder.list("tasks_trash", COLUMNS, filter).getStatement());
    assertEquals(
        "SELECT count(*) FROM tasks_trash",
        ResourceQueryBuilder.count("tasks_trash", filter).getStatement());
  }
}
