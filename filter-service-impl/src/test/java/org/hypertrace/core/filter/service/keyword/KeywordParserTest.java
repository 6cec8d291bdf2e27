package org.hypertrace.core.filter.service.keyword;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import org.hypertrace.core.filter.service.api.Keyword;
import org.hypertrace.core.filter.service.api.KeywordRelation;
import org.hypertrace.core.filter.service.api.KeywordType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class KeywordParserTest {
  // 2024-01-01T00:00:00Z
  private static final long NOW = 1704067200L;

  private KeywordParser parser;
  private FilterTokenizer tokenizer;

  @BeforeEach
  public void setup() {
    parser =
        new KeywordParser(Clock.fixed(Instant.ofEpochSecond(NOW), ZoneOffset.UTC), ZoneOffset.UTC);
    tokenizer = new FilterTokenizer(parser, Optional.empty());
  }

  @Test
  public void testRelativeTimes() {
    assertInteger(NOW - 86400, first("created>-1d"));
    assertInteger(NOW + 2 * 3600, first("created>2h"));
    assertInteger(NOW + 90, first("created>90s"));
    assertInteger(NOW - 30 * 60, first("created>-30m"));
    assertInteger(NOW + 604800, first("created>1w"));
    // 2024-02-01
    assertInteger(1706745600L, first("created>1M"));
    // 2025-01-01
    assertInteger(1735689600L, first("created>1y"));
  }

  @Test
  public void testAbsoluteTimes() {
    assertInteger(1704153600L, first("created>2024-01-02"));
    assertInteger(1704191400L, first("created>2024-01-02T10h30"));
    assertInteger(1704191400L, first("created>2024-01-02t10:30"));
  }

  @Test
  public void testInvalidDateStaysString() {
    Keyword keyword = first("created>2024-13-45");
    assertEquals(KeywordType.STRING, keyword.getType());
    assertEquals("2024-13-45", keyword.getString());
  }

  @Test
  public void testSeverityAliases() {
    assertDouble(0.0, first("severity=Log"));
    assertDouble(-1.0, first("new_severity=\"false positive\""));
    assertDouble(-3.0, first("severity=Error"));
    assertEquals(KeywordType.STRING, first("name=Log").getType());
  }

  @Test
  public void testNumbers() {
    assertInteger(-42L, first("score=-42"));
    assertDouble(1.5, first("score=1.5"));
    assertDouble(1000.0, first("score=1e3"));
    assertDouble(1.0e20, first("score=100000000000000000000"));
    assertEquals(KeywordType.STRING, first("score=NaN").getType());
    assertEquals(KeywordType.STRING, first("score=1.2.3").getType());
  }

  @Test
  public void testFreeTextTyping() {
    Keyword contains = first("5");
    assertEquals(KeywordType.STRING, contains.getType());
    assertEquals(KeywordRelation.APPROX, contains.getRelation());

    Keyword exact = first("=5");
    assertTrue(exact.isEqual());
    assertInteger(5L, exact);
  }

  @Test
  public void testOptionCleanup() {
    assertInteger(100L, first("min_qod=150"));
    assertInteger(0L, first("min_qod=-5"));
    assertInteger(40L, first("min_qod=40"));
    assertInteger(1L, first("apply_overrides=yes"));
    assertInteger(1L, first("overrides=7"));
    assertInteger(0L, first("notes=0"));
    assertEquals("1", first("result_hosts_only=true").getString());
  }

  @Test
  public void testControlKeywordsHaveNoRelation() {
    assertEquals(KeywordRelation.NONE, first("levels>hml").getRelation());
    assertEquals(KeywordRelation.NONE, first("sort~name").getRelation());
    assertEquals(KeywordRelation.COLUMN_ABOVE, first("owner>x").getRelation());
  }

  @Test
  public void testRawKeywordParsing() {
    Keyword keyword =
        parser.parse(new RawKeyword("name", '~', RawKeyword.NO_CHAR, "and", false));
    assertEquals(KeywordRelation.COLUMN_APPROX, keyword.getRelation());
    assertFalse(keyword.isOperator());
  }

  @Test
  public void testApproxPrefixIsKept() {
    Keyword keyword = parser.parse(new RawKeyword(null, RawKeyword.NO_CHAR, '~', "and", false));
    assertTrue(keyword.isApprox());
    assertTrue(keyword.isFreeText());
    assertFalse(
        parser
            .parse(new RawKeyword(null, RawKeyword.NO_CHAR, RawKeyword.NO_CHAR, "x", false))
            .isApprox());
  }

  private Keyword first(String filter) {
    return tokenizer.split(filter).get(0);
  }

  private static void assertInteger(long expected, Keyword keyword) {
    assertEquals(KeywordType.INTEGER, keyword.getType());
    assertEquals(expected, keyword.getIntegerValue());
  }

  private static void assertDouble(double expected, Keyword keyword) {
    assertEquals(KeywordType.DOUBLE, keyword.getType());
    assertEquals(expected, keyword.getDoubleValue(), 0.000001);
  }
}
