package org.hypertrace.core.filter.service.api;

import javax.annotation.Nullable;
import lombok.Builder;
import lombok.Value;

/** Filter settings specific to report result listings. */
@Value
@Builder
public class ReportFilterControls {
  FilterControls controls;
  int resultHostsOnly;
  @Nullable String minQod;
  @Nullable String levels;
  @Nullable String complianceLevels;
  @Nullable String deltaStates;
  @Nullable String timezone;
  int notes;
  int overrides;
  int applyOverrides;

  /** Column-less terms joined by single spaces, empty when there are none. */
  String searchPhrase;

  /** Set when any of the search phrase terms asked for an exact match. */
  boolean searchPhraseExact;
}
