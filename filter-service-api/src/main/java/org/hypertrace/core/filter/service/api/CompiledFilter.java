package org.hypertrace.core.filter.service.api;

import java.util.List;
import java.util.Optional;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Result of compiling a filter string against one resource type.
 *
 * <p>The WHERE clause carries a {@code ?} placeholder for every user supplied value; the values
 * themselves are in {@link #getParams()}, in placeholder order.
 */
@Value
@Builder
public class CompiledFilter {
  /** Empty when no term of the filter produced a condition. */
  @NonNull @Builder.Default Optional<String> whereClause = Optional.empty();

  @NonNull @Builder.Default Params params = Params.empty();

  /** ORDER BY terms without the leading keyword, empty when nothing to sort on. */
  @NonNull @Builder.Default String orderClause = "";

  /** Zero-based offset of the first row. */
  int firstRow;

  /** Page size, {@code -1} for unlimited. */
  int maxRows;

  @NonNull @Builder.Default List<String> permissions = List.of();

  @NonNull @Builder.Default Optional<String> ownerFilter = Optional.empty();

  /** The WHERE clause with its params inlined as SQL literals, for logs and display. */
  public Optional<String> getResolvedWhereClause() {
    return whereClause.map(clause -> SqlStatements.resolve(clause, params));
  }
}
