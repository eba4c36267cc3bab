package io.playgroundx.persistence.mapping;

import io.playgroundx.persistence.ValidationException;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Field extractors for hand-written {@link RowDecoder}s. */
public final class Rows {
  private Rows() {}

  public static <T> List<T> decodeAll(List<Row> rows, RowDecoder<T> decoder) {
    Objects.requireNonNull(decoder, "decoder");
    if (rows == null || rows.isEmpty()) return List.of();
    List<T> out = new ArrayList<>(rows.size());
    for (Row r : rows) out.add(decoder.decode(r));
    return out;
  }

  public static Object require(Row row, String column) {
    Objects.requireNonNull(row, "row");
    if (!row.has(column)) throw new ValidationException(column, "Missing field '" + column + "'");
    Object v = row.get(column);
    if (v == null) throw new ValidationException(column, "Field '" + column + "' must not be null");
    return v;
  }

  public static String requireString(Row row, String column) {
    Object v = require(row, column);
    if (v instanceof CharSequence cs) return cs.toString();
    throw wrongType(column, "string", v);
  }

  /** Null-tolerant variant; the column must still be present. */
  public static String optionalString(Row row, String column) {
    if (!row.has(column)) throw new ValidationException(column, "Missing field '" + column + "'");
    Object v = row.get(column);
    if (v == null) return null;
    if (v instanceof CharSequence cs) return cs.toString();
    throw wrongType(column, "string", v);
  }

  public static long requireLong(Row row, String column) {
    Object v = require(row, column);
    if (v instanceof Long l) return l;
    if (v instanceof Integer || v instanceof Short || v instanceof Byte) return ((Number) v).longValue();
    if (v instanceof java.math.BigInteger bi) {
      try { return bi.longValueExact(); } catch (ArithmeticException e) { throw wrongType(column, "long", v); }
    }
    if (v instanceof java.math.BigDecimal bd) {
      try { return bd.longValueExact(); } catch (ArithmeticException e) { throw wrongType(column, "long", v); }
    }
    throw wrongType(column, "long", v);
  }

  public static int requireInt(Row row, String column) {
    long l = requireLong(row, column);
    if (l < Integer.MIN_VALUE || l > Integer.MAX_VALUE) throw wrongType(column, "int", row.get(column));
    return (int) l;
  }

  /**
   * Accepts {@link java.sql.Timestamp}, {@link LocalDateTime}, {@link OffsetDateTime},
   * {@link ZonedDateTime} and {@link Instant}. Zoned values are normalized to UTC.
   */
  public static LocalDateTime requireDateTime(Row row, String column) {
    Object v = require(row, column);
    if (v instanceof LocalDateTime ldt) return ldt;
    if (v instanceof java.sql.Timestamp ts) return ts.toLocalDateTime();
    if (v instanceof OffsetDateTime odt) return odt.withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime();
    if (v instanceof ZonedDateTime zdt) return zdt.withZoneSameInstant(ZoneOffset.UTC).toLocalDateTime();
    if (v instanceof Instant i) return LocalDateTime.ofInstant(i, ZoneOffset.UTC);
    if (v instanceof java.sql.Date d) return d.toLocalDate().atStartOfDay();
    if (v instanceof LocalDate ld) return ld.atStartOfDay();
    throw wrongType(column, "timestamp", v);
  }

  private static ValidationException wrongType(String column, String expected, Object actual) {
    return new ValidationException(column,
        "Field '" + column + "' expected " + expected + " but got " + actual.getClass().getName());
  }
}
