package org.hypertrace.core.filter.service.controls;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.Optional;
import org.hypertrace.core.filter.service.api.FilterControls;
import org.hypertrace.core.filter.service.api.ReportFilterControls;
import org.hypertrace.core.filter.service.keyword.FilterTokenizer;
import org.hypertrace.core.filter.service.keyword.KeywordParser;
import org.hypertrace.core.filter.service.pagination.RowLimits;
import org.hypertrace.core.filter.service.pagination.SettingsProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class FilterControlsExtractorTest {

  private FilterControlsExtractor extractor;

  @BeforeEach
  public void setup() {
    SettingsProvider settings = mock(SettingsProvider.class);
    when(settings.getRowsPerPage()).thenReturn(10);
    when(settings.getMaxRowsPerPage()).thenReturn(100);
    extractor =
        new FilterControlsExtractor(
            new FilterTokenizer(
                new KeywordParser(Clock.systemUTC(), ZoneOffset.UTC), Optional.of("name")),
            new RowLimits(settings));
  }

  @Test
  public void testFilterControls() {
    assertEquals(
        new FilterControls(20, 50, "severity", false),
        extractor.filterControls("name=x first=21 rows=50 sort-reverse=severity sort=name"));
  }

  @Test
  public void testFilterControlsDefaults() {
    assertEquals(new FilterControls(0, 10, "name", true), extractor.filterControls(""));
    assertEquals(new FilterControls(0, 100, "name", true), extractor.filterControls("rows=-1"));
    assertEquals(new FilterControls(0, 100, "name", true), extractor.filterControls("rows=900"));
  }

  @Test
  public void testNonNumericPaginationBecomesOne() {
    assertEquals(
        new FilterControls(0, 1, "name", true), extractor.filterControls("first=abc rows=xyz"));
  }

  @Test
  public void testReportFilterControls() {
    ReportFilterControls controls =
        extractor.reportFilterControls(
            "apply_overrides=0 min_qod=50 levels=hml delta_states=cgn timezone=Europe/Berlin"
                + " notes=0 result_hosts_only=0 =openssh ssl");
    assertEquals(0, controls.getApplyOverrides());
    assertEquals(1, controls.getOverrides());
    assertEquals(0, controls.getNotes());
    assertEquals(0, controls.getResultHostsOnly());
    assertEquals("50", controls.getMinQod());
    assertEquals("hml", controls.getLevels());
    assertEquals("cgn", controls.getDeltaStates());
    assertEquals("Europe/Berlin", controls.getTimezone());
    assertNull(controls.getComplianceLevels());
    assertEquals("openssh ssl", controls.getSearchPhrase());
    assertTrue(controls.isSearchPhraseExact());
    assertEquals(new FilterControls(0, 10, "name", true), controls.getControls());
  }

  @Test
  public void testOverridesFallBackForApplyOverrides() {
    ReportFilterControls controls = extractor.reportFilterControls("overrides=0");
    assertEquals(0, controls.getOverrides());
    assertEquals(0, controls.getApplyOverrides());
    assertEquals(1, controls.getNotes());
    assertEquals("", controls.getSearchPhrase());
    assertFalse(controls.isSearchPhraseExact());
  }

  @Test
  public void testFilterTermValue() {
    assertEquals(Optional.of("bob"), extractor.filterTermValue("_owner=bob name=x", "owner"));
    assertEquals(Optional.of("x"), extractor.filterTermValue("NAME=x name=y", "name"));
    assertEquals(Optional.empty(), extractor.filterTermValue("name=x", "comment"));
  }

  @Test
  public void testApplyOverrides() {
    assertEquals(0, extractor.applyOverrides(""));
    assertEquals(0, extractor.applyOverrides("apply_overrides=0"));
    assertEquals(1, extractor.applyOverrides("apply_overrides=1"));
    assertEquals(1, extractor.applyOverrides("apply_overrides=maybe"));
  }

  @Test
  public void testMinQod() {
    assertEquals(70, extractor.minQod(""));
    assertEquals(30, extractor.minQod("min_qod=30"));
    assertEquals(100, extractor.minQod("min_qod=250"));
    assertEquals(0, extractor.minQod("min_qod=abc"));
  }

  @Test
  public void testLeadingInt() {
    assertEquals(42, FilterControlsExtractor.leadingInt("42abc"));
    assertEquals(-3, FilterControlsExtractor.leadingInt("-3"));
    assertEquals(0, FilterControlsExtractor.leadingInt("x"));
    assertEquals(0, FilterControlsExtractor.leadingInt(""));
  }
}
