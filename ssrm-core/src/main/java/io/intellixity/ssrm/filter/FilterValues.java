package io.intellixity.ssrm.filter;

import com.fasterxml.jackson.databind.JsonNode;
import io.intellixity.ssrm.error.ValidationException;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/** Converts JSON operands into the Java values carried by {@link Condition}s and group keys. */
public final class FilterValues {
  private static final DateTimeFormatter GRID_DATE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

  private FilterValues() {}

  /** JSON scalar to String / Integer / Long / Double / BigDecimal / Boolean / null. */
  public static Object scalar(JsonNode n, String label) {
    if (n == null || n.isNull() || n.isMissingNode()) return null;
    if (n.isTextual()) return n.asText();
    if (n.isBoolean()) return n.booleanValue();
    if (n.isIntegralNumber()) return n.canConvertToInt() ? (Object) n.intValue() : (Object) n.longValue();
    if (n.isBigDecimal()) return n.decimalValue();
    if (n.isNumber()) return n.doubleValue();
    throw new ValidationException(label + " must be a scalar value but was " + n.getNodeType());
  }

  /** Numeric operand; numeric strings are accepted. */
  public static Number number(JsonNode n, String label) {
    if (n == null || n.isNull() || n.isMissingNode()) {
      throw new ValidationException(label + " is required");
    }
    if (n.isIntegralNumber()) return n.canConvertToLong() ? (Number) n.longValue() : (Number) n.decimalValue();
    if (n.isNumber()) return n.doubleValue();
    if (n.isTextual()) {
      try {
        BigDecimal d = new BigDecimal(n.asText().trim());
        return (d.scale() <= 0) ? (Number) d.longValueExact() : (Number) d.doubleValue();
      } catch (NumberFormatException | ArithmeticException e) {
        throw new ValidationException(label + " must be numeric but was '" + n.asText() + "'", e);
      }
    }
    throw new ValidationException(label + " must be numeric but was " + n.getNodeType());
  }

  /** Day-granular operand: {@code yyyy-MM-dd}, {@code yyyy-MM-dd HH:mm:ss} or an ISO instant, read as UTC. */
  public static LocalDate date(JsonNode n, String label) {
    if (n == null || n.isNull() || n.isMissingNode() || !n.isTextual() || n.asText().isBlank()) {
      throw new ValidationException(label + " must be a date string");
    }
    String s = n.asText().trim();
    try {
      if (s.length() == 10) return LocalDate.parse(s);
      if (s.length() == 19 && s.charAt(10) == ' ') return LocalDateTime.parse(s, GRID_DATE_TIME).toLocalDate();
      return LocalDate.ofInstant(Instant.parse(s), ZoneOffset.UTC);
    } catch (DateTimeParseException e) {
      throw new ValidationException(label + " is not a valid date: '" + s + "'", e);
    }
  }

  public static String text(JsonNode n, String label) {
    if (n == null || n.isNull() || n.isMissingNode()) {
      throw new ValidationException(label + " is required");
    }
    if (!n.isValueNode()) throw new ValidationException(label + " must be a string");
    return n.asText();
  }
}
