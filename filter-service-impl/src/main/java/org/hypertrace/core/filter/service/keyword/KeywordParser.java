package org.hypertrace.core.filter.service.keyword;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import javax.inject.Inject;
import javax.inject.Named;
import org.hypertrace.core.filter.service.api.Keyword;
import org.hypertrace.core.filter.service.api.KeywordRelation;
import org.hypertrace.core.filter.service.api.KeywordType;

/** Types the value of a raw keyword and normalizes the values of option keywords. */
public class KeywordParser {

  public static final String FILTER_ZONE = "filterZone";

  private static final Pattern INTEGER = Pattern.compile("[-+]?\\d+");
  private static final Pattern DOUBLE =
      Pattern.compile("[-+]?(\\d+\\.\\d*|\\.\\d+|\\d+)([eE][-+]?\\d+)?");
  private static final Pattern RELATIVE_TIME = Pattern.compile("([-+]?\\d+)([smhdwMy])");
  private static final Pattern DATE_TIME =
      Pattern.compile("(\\d{4}-\\d{2}-\\d{2})(?:[tT](\\d{2})[:h](\\d{2}))?");

  private static final Map<String, Double> SEVERITY_ALIASES =
      Map.of("log", 0.0, "false positive", -1.0, "error", -3.0);

  private final Clock clock;
  private final ZoneId zone;

  @Inject
  public KeywordParser(Clock clock, @Named(FILTER_ZONE) ZoneId zone) {
    this.clock = clock;
    this.zone = zone;
  }

  Keyword parse(RawKeyword raw) {
    Keyword.KeywordBuilder builder =
        Keyword.builder().column(raw.getColumn()).string(raw.getValue()).quoted(raw.isQuoted());

    if (raw.getColumn() == null) {
      if (raw.getPrefix() == '=') {
        return typed(builder.equal(true).relation(KeywordRelation.NONE), null, raw.getValue());
      }
      if (raw.getPrefix() == RawKeyword.NO_CHAR
          && !raw.isQuoted()
          && Keyword.isOperatorWord(raw.getValue())) {
        return builder.relation(KeywordRelation.NONE).build();
      }
      return builder
          .approx(raw.getPrefix() == '~')
          .relation(KeywordRelation.APPROX)
          .build();
    }

    KeywordRelation relation =
        FilterKeywords.isControl(raw.getColumn())
            ? KeywordRelation.NONE
            : KeywordRelation.fromOperator(raw.getOperator());
    return cleanup(typed(builder.relation(relation), raw.getColumn(), raw.getValue()));
  }

  private Keyword typed(Keyword.KeywordBuilder builder, String column, String value) {
    if (FilterKeywords.SEVERITY.equals(column) || FilterKeywords.NEW_SEVERITY.equals(column)) {
      Double alias = SEVERITY_ALIASES.get(value.toLowerCase(Locale.ROOT));
      if (alias != null) {
        return builder.type(KeywordType.DOUBLE).doubleValue(alias).build();
      }
    }

    Matcher relative = RELATIVE_TIME.matcher(value);
    if (relative.matches()) {
      try {
        long amount = Long.parseLong(relative.group(1));
        return builder
            .type(KeywordType.INTEGER)
            .integerValue(relativeTime(amount, relative.group(2).charAt(0)))
            .build();
      } catch (NumberFormatException | ArithmeticException | DateTimeException e) {
        return builder.type(KeywordType.STRING).build();
      }
    }

    Matcher date = DATE_TIME.matcher(value);
    if (date.matches()) {
      try {
        LocalDate day = LocalDate.parse(date.group(1));
        LocalTime time =
            date.group(2) == null
                ? LocalTime.MIDNIGHT
                : LocalTime.of(Integer.parseInt(date.group(2)), Integer.parseInt(date.group(3)));
        return builder
            .type(KeywordType.INTEGER)
            .integerValue(LocalDateTime.of(day, time).atZone(zone).toEpochSecond())
            .build();
      } catch (DateTimeException e) {
        return builder.type(KeywordType.STRING).build();
      }
    }

    if (INTEGER.matcher(value).matches()) {
      try {
        return builder.type(KeywordType.INTEGER).integerValue(Long.parseLong(value)).build();
      } catch (NumberFormatException e) {
        // Out of range for a long, still a number.
        return builder.type(KeywordType.DOUBLE).doubleValue(Double.parseDouble(value)).build();
      }
    }

    if (DOUBLE.matcher(value).matches()) {
      return builder.type(KeywordType.DOUBLE).doubleValue(Double.parseDouble(value)).build();
    }

    return builder.type(KeywordType.STRING).build();
  }

  private long relativeTime(long amount, char unit) {
    ZonedDateTime now = ZonedDateTime.now(clock.withZone(zone));
    switch (unit) {
      case 's':
        return Math.addExact(now.toEpochSecond(), amount);
      case 'm':
        return Math.addExact(now.toEpochSecond(), Math.multiplyExact(amount, 60L));
      case 'h':
        return Math.addExact(now.toEpochSecond(), Math.multiplyExact(amount, 3600L));
      case 'd':
        return Math.addExact(now.toEpochSecond(), Math.multiplyExact(amount, 86400L));
      case 'w':
        return Math.addExact(now.toEpochSecond(), Math.multiplyExact(amount, 604800L));
      case 'M':
        return now.plusMonths(amount).toEpochSecond();
      case 'y':
        return now.plusYears(amount).toEpochSecond();
      default:
        throw new IllegalArgumentException("Unknown time unit: " + unit);
    }
  }

  private Keyword cleanup(Keyword keyword) {
    String column = keyword.getColumn();
    boolean integer = keyword.getType() == KeywordType.INTEGER;
    long value = keyword.getIntegerValue();

    if (FilterKeywords.FIRST.equals(column)) {
      if (!integer || value <= 0) {
        return withInteger(keyword, 1);
      }
    } else if (FilterKeywords.ROWS.equals(column)) {
      if (!integer || value == 0) {
        return withInteger(keyword, 1);
      }
      if (integer && value < FilterKeywords.ROWS_PER_PAGE_SENTINEL) {
        return withInteger(keyword, -1);
      }
    } else if (FilterKeywords.MIN_QOD.equals(column)) {
      if (integer && value < 0) {
        return withInteger(keyword, 0);
      }
      if (integer && value > 100) {
        return withInteger(keyword, 100);
      }
    } else if (FilterKeywords.BOOLEAN_OPTIONS.contains(column)) {
      if (!integer || (value != 0 && value != 1)) {
        return withInteger(keyword, 1);
      }
    }
    return keyword;
  }

  private static Keyword withInteger(Keyword keyword, long value) {
    return keyword.toBuilder()
        .string(String.valueOf(value))
        .type(KeywordType.INTEGER)
        .integerValue(value)
        .quoted(false)
        .build();
  }
}
