package org.hypertrace.core.filter.service.pagination;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.Test;

class RowLimitsTest {

  private static RowLimits rowLimits(int rowsPerPage, int maxRowsPerPage) {
    SettingsProvider settings = mock(SettingsProvider.class);
    when(settings.getRowsPerPage()).thenReturn(rowsPerPage);
    when(settings.getMaxRowsPerPage()).thenReturn(maxRowsPerPage);
    return new RowLimits(settings);
  }

  @Test
  public void testFirstRow() {
    assertEquals(0, RowLimits.firstRow(1));
    assertEquals(0, RowLimits.firstRow(0));
    assertEquals(0, RowLimits.firstRow(-7));
    assertEquals(24, RowLimits.firstRow(25));
    assertEquals(Integer.MAX_VALUE, RowLimits.firstRow(Long.MAX_VALUE));
  }

  @Test
  public void testRowsPerPageSetting() {
    RowLimits rowLimits = rowLimits(10, 100);
    assertEquals(10, rowLimits.maxRows(-2, false));
    assertEquals(10, rowLimits.maxRows(-2, true));
  }

  @Test
  public void testCap() {
    RowLimits rowLimits = rowLimits(10, 100);
    assertEquals(50, rowLimits.maxRows(50, false));
    assertEquals(100, rowLimits.maxRows(500, false));
    assertEquals(500, rowLimits.maxRows(500, true));
    assertEquals(100, rowLimits.maxRows(-1, false));
    assertEquals(-1, rowLimits.maxRows(-1, true));
    assertEquals(-1, rowLimits.maxRows(0, true));
  }

  @Test
  public void testNoCapConfigured() {
    RowLimits rowLimits = rowLimits(10, 0);
    assertEquals(-1, rowLimits.maxRows(-1, false));
    assertEquals(5000, rowLimits.maxRows(5000, false));
  }

  @Test
  public void testRowsPerPageAboveCap() {
    assertEquals(20, rowLimits(50, 20).maxRows(-2, false));
  }
}
