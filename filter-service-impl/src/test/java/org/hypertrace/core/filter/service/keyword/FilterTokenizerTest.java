package org.hypertrace.core.filter.service.keyword;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.hypertrace.core.filter.service.api.Keyword;
import org.hypertrace.core.filter.service.api.KeywordRelation;
import org.hypertrace.core.filter.service.api.KeywordType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class FilterTokenizerTest {

  private FilterTokenizer tokenizer;

  @BeforeEach
  public void setup() {
    KeywordParser parser =
        new KeywordParser(
            Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC), ZoneOffset.UTC);
    tokenizer = new FilterTokenizer(parser, Optional.of("name"));
  }

  @Test
  public void testColumnRelations() {
    List<Keyword> keywords = tokenizer.split("name=foo comment~bar severity>5 age<3 uuid:^ab");

    assertKeyword(keywords.get(0), "name", KeywordRelation.COLUMN_EQUAL, "foo");
    assertKeyword(keywords.get(1), "comment", KeywordRelation.COLUMN_APPROX, "bar");
    assertKeyword(keywords.get(2), "severity", KeywordRelation.COLUMN_ABOVE, "5");
    assertEquals(KeywordType.INTEGER, keywords.get(2).getType());
    assertEquals(5L, keywords.get(2).getIntegerValue());
    assertKeyword(keywords.get(3), "age", KeywordRelation.COLUMN_BELOW, "3");
    assertKeyword(keywords.get(4), "uuid", KeywordRelation.COLUMN_REGEXP, "^ab");
  }

  @Test
  public void testDefaultsAreAppended() {
    List<Keyword> keywords = tokenizer.split("");

    assertEquals(3, keywords.size());
    assertKeyword(keywords.get(0), "first", KeywordRelation.NONE, "1");
    assertKeyword(keywords.get(1), "rows", KeywordRelation.NONE, "-2");
    assertEquals(-2L, keywords.get(1).getIntegerValue());
    assertKeyword(keywords.get(2), "sort", KeywordRelation.NONE, "name");
  }

  @Test
  public void testNoDefaultSortWithoutField() {
    List<Keyword> keywords = tokenizer.split("", Optional.empty());
    assertEquals(List.of("first", "rows"), columns(keywords));
  }

  @Test
  public void testExplicitSortSuppressesDefault() {
    List<Keyword> keywords = tokenizer.split("sort-reverse=created");
    assertEquals(List.of("sort-reverse", "first", "rows"), columns(keywords));
    assertEquals(KeywordRelation.NONE, keywords.get(0).getRelation());
  }

  @Test
  public void testQuotedValues() {
    List<Keyword> keywords = tokenizer.split("name=\"foo bar\" 'two words' tag='os=linux'");

    assertKeyword(keywords.get(0), "name", KeywordRelation.COLUMN_EQUAL, "foo bar");
    assertTrue(keywords.get(0).isQuoted());
    assertNull(keywords.get(1).getColumn());
    assertEquals("two words", keywords.get(1).getString());
    assertEquals(KeywordRelation.APPROX, keywords.get(1).getRelation());
    assertTrue(keywords.get(1).isQuoted());
    assertKeyword(keywords.get(2), "tag", KeywordRelation.COLUMN_EQUAL, "os=linux");
  }

  @Test
  public void testApostropheInsideValueIsLiteral() {
    Keyword keyword = tokenizer.split("name=O'Brien").get(0);
    assertKeyword(keyword, "name", KeywordRelation.COLUMN_EQUAL, "O'Brien");
    assertFalse(keyword.isQuoted());
  }

  @Test
  public void testEscapedQuoteInsideQuotes() {
    Keyword keyword = tokenizer.split("comment=\"say \\\"hi\\\" \\\\ now\"").get(0);
    assertEquals("say \"hi\" \\ now", keyword.getString());
  }

  @Test
  public void testUnterminatedQuoteRunsToEnd() {
    List<Keyword> keywords = tokenizer.split("name=\"foo bar rows=5");
    assertKeyword(keywords.get(0), "name", KeywordRelation.COLUMN_EQUAL, "foo bar rows=5");
    assertTrue(keywords.get(0).isQuoted());
    // rows was swallowed by the quote, so the default is appended.
    assertEquals(-2L, keywords.get(2).getIntegerValue());
  }

  @Test
  public void testOperatorsAndQuotedOperatorWords() {
    List<Keyword> keywords = tokenizer.split("a AND not \"or\" re x Regexp");

    assertTrue(keywords.get(0).isFreeText());
    assertTrue(keywords.get(1).isOperator("and"));
    assertTrue(keywords.get(2).isOperator("not"));
    assertTrue(keywords.get(3).isFreeText());
    assertEquals("or", keywords.get(3).getString());
    assertTrue(keywords.get(4).isOperator("re"));
    assertTrue(keywords.get(5).isFreeText());
    assertTrue(keywords.get(6).isOperator("regexp"));
  }

  @Test
  public void testExactFreeText() {
    List<Keyword> keywords = tokenizer.split("=foo ~bar =");

    assertTrue(keywords.get(0).isEqual());
    assertEquals("foo", keywords.get(0).getString());
    assertEquals(KeywordRelation.NONE, keywords.get(0).getRelation());
    assertFalse(keywords.get(0).isApprox());
    assertFalse(keywords.get(1).isEqual());
    assertTrue(keywords.get(1).isApprox());
    assertEquals("bar", keywords.get(1).getString());
    assertEquals(KeywordRelation.APPROX, keywords.get(1).getRelation());
    // The lone '=' is dropped.
    assertEquals("first", keywords.get(2).getColumn());
  }

  @Test
  public void testSingleValuedOptionsKeepFirstOccurrence() {
    List<Keyword> keywords = tokenizer.split("rows=5 rows=20 first=3 first=9 sort=a sort=b");

    assertEquals(List.of("rows", "first", "sort", "sort"), columns(keywords));
    assertEquals(5L, keywords.get(0).getIntegerValue());
    assertEquals(3L, keywords.get(1).getIntegerValue());
  }

  @Test
  public void testPaginationCleanup() {
    List<Keyword> keywords = tokenizer.split("first=0 rows=0");
    assertEquals("1", keywords.get(0).getString());
    assertEquals("1", keywords.get(1).getString());

    assertEquals(-1L, tokenizer.split("rows=-7").get(0).getIntegerValue());
    assertEquals(-2L, tokenizer.split("rows=-2").get(0).getIntegerValue());
  }

  @Test
  public void testNonNumericPaginationBecomesOne() {
    List<Keyword> keywords = tokenizer.split("first=abc rows=xyz");
    assertEquals("1", keywords.get(0).getString());
    assertEquals(1L, keywords.get(0).getIntegerValue());
    assertEquals("1", keywords.get(1).getString());
    assertEquals(1L, keywords.get(1).getIntegerValue());
    assertFalse(keywords.get(1).isQuoted());
  }

  @Test
  public void testValueKeepsLaterOperators() {
    Keyword keyword = tokenizer.split("comment=a=b:c").get(0);
    assertKeyword(keyword, "comment", KeywordRelation.COLUMN_EQUAL, "a=b:c");
  }

  @Test
  public void testColumnNeedsValidName() {
    Keyword keyword = tokenizer.split("a.b=c").get(0);
    assertNull(keyword.getColumn());
    assertEquals("a.b=c", keyword.getString());
  }

  @Test
  public void testEmptyColumnValue() {
    Keyword keyword = tokenizer.split("name=").get(0);
    assertKeyword(keyword, "name", KeywordRelation.COLUMN_EQUAL, "");
  }

  @Test
  public void testNullFilterIsEmpty() {
    assertEquals(3, tokenizer.split(null).size());
  }

  private static List<String> columns(List<Keyword> keywords) {
    return keywords.stream().map(Keyword::getColumn).collect(Collectors.toList());
  }

  private static void assertKeyword(
      Keyword keyword, String column, KeywordRelation relation, String value) {
    assertEquals(column, keyword.getColumn());
    assertEquals(relation, keyword.getRelation());
    assertEquals(value, keyword.getString());
  }
}
