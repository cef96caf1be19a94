package io.github.cyfko.formstate.core.utils;

import io.github.cyfko.formstate.core.model.Attachment;
import io.github.cyfko.formstate.core.model.Coding;
import io.github.cyfko.formstate.core.model.ItemType;
import io.github.cyfko.formstate.core.model.Quantity;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import java.util.Optional;

/**
 * Type conformance, coercion and comparison of answer values.
 * <p>
 * Answer values are plain Java objects whose class depends on the {@link ItemType} of the item
 * (see the constants of that enum). Expression results come back from the evaluator in whatever
 * shape it produces; {@link #coerce(ItemType, Object)} brings them to the item's value class
 * before they are written as answers.
 * </p>
 *
 * <h2>Key Methods</h2>
 * <ul>
 *   <li>{@link #conforms(ItemType, Object)} - checks a value against an item type</li>
 *   <li>{@link #coerce(ItemType, Object)} - converts an expression result to an answer value</li>
 *   <li>{@link #sameValue(Object, Object)} - equality used for options and enable conditions</li>
 *   <li>{@link #compare(Object, Object)} - ordering of numbers, temporals, strings and quantities</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>
 * All methods are stateless and thread-safe.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class AnswerValues {

    private AnswerValues() {
        // Utility class
    }

    /**
     * Checks whether a value can be an answer of an item of the given type.
     *
     * @param type  item type
     * @param value candidate answer value
     * @return false for null values and for groups and display items
     */
    public static boolean conforms(ItemType type, Object value) {
        if (value == null) return false;
        return switch (type) {
            case GROUP, DISPLAY -> false;
            case BOOLEAN -> value instanceof Boolean;
            case DECIMAL -> value instanceof Number;
            case INTEGER -> isIntegral(value);
            case DATE -> value instanceof LocalDate;
            case DATE_TIME -> value instanceof LocalDateTime || value instanceof OffsetDateTime
                    || value instanceof ZonedDateTime || value instanceof Instant;
            case TIME -> value instanceof LocalTime;
            case STRING, TEXT, URL, REFERENCE -> value instanceof String;
            case CHOICE, OPEN_CHOICE -> value instanceof Coding || value instanceof String
                    || isIntegral(value) || value instanceof LocalDate || value instanceof LocalTime;
            case ATTACHMENT -> value instanceof Attachment;
            case QUANTITY -> value instanceof Quantity;
        };
    }

    private static boolean isIntegral(Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short
                || value instanceof Byte || value instanceof BigInteger) {
            return true;
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.signum() == 0 || decimal.stripTrailingZeros().scale() <= 0;
        }
        return false;
    }

    /**
     * Converts a value to the value class of the item type.
     *
     * @param type  target item type
     * @param value value to convert, typically an expression result
     * @return the converted value, empty when the value cannot represent an answer of that type
     */
    public static Optional<Object> coerce(ItemType type, Object value) {
        if (value == null || !type.isQuestion()) return Optional.empty();
        try {
            Object converted = switch (type) {
                case BOOLEAN -> toBoolean(value);
                case DECIMAL -> toDecimal(value);
                case INTEGER -> toInteger(value);
                case DATE -> value instanceof String s ? LocalDate.parse(s.trim()) : value;
                case DATE_TIME -> value instanceof String s ? parseDateTime(s.trim()) : value;
                case TIME -> value instanceof String s ? LocalTime.parse(s.trim()) : value;
                case STRING, TEXT, URL, REFERENCE -> toText(value);
                case QUANTITY -> value instanceof Number number ? Quantity.of(toDecimal(number), null) : value;
                default -> value;
            };
            return conforms(type, converted) ? Optional.of(converted) : Optional.empty();
        } catch (DateTimeParseException | NumberFormatException | ArithmeticException e) {
            return Optional.empty();
        }
    }

    private static Object toBoolean(Object value) {
        if (value instanceof String s) {
            String normalized = s.trim().toLowerCase();
            if (normalized.equals("true")) return Boolean.TRUE;
            if (normalized.equals("false")) return Boolean.FALSE;
        }
        return value;
    }

    private static Object toDecimal(Object value) {
        if (value instanceof BigDecimal) return value;
        if (value instanceof BigInteger bigInteger) return new BigDecimal(bigInteger);
        if (value instanceof Double || value instanceof Float) return BigDecimal.valueOf(((Number) value).doubleValue());
        if (value instanceof Number number) return BigDecimal.valueOf(number.longValue());
        if (value instanceof String s) return new BigDecimal(s.trim());
        if (value instanceof Quantity quantity && quantity.hasValue()) return quantity.value();
        return value;
    }

    private static BigDecimal toDecimal(Number number) {
        return (BigDecimal) toDecimal((Object) number);
    }

    private static Object toInteger(Object value) {
        Object decimal = toDecimal(value);
        if (decimal instanceof BigDecimal bd) {
            long exact = bd.longValueExact();
            if (exact >= Integer.MIN_VALUE && exact <= Integer.MAX_VALUE) {
                return (int) exact;
            }
            return exact;
        }
        return value;
    }

    private static Object toText(Object value) {
        if (value instanceof Coding coding) {
            return coding.display() != null ? coding.display() : coding.code();
        }
        if (value instanceof Number || value instanceof Boolean) {
            return String.valueOf(value);
        }
        return value;
    }

    private static Object parseDateTime(String text) {
        try {
            return OffsetDateTime.parse(text);
        } catch (DateTimeParseException e) {
            return LocalDateTime.parse(text);
        }
    }

    /**
     * Equality of answer values. Codings match on system and code, numbers on their numeric value
     * regardless of class, and a coding matches a string equal to its code.
     */
    public static boolean sameValue(Object a, Object b) {
        if (a == null || b == null) return a == b;
        if (a instanceof Coding ca && b instanceof Coding cb) return ca.sameConcept(cb);
        if (a instanceof Coding ca && b instanceof String sb) return ca.code().equals(sb);
        if (a instanceof String sa && b instanceof Coding cb) return cb.code().equals(sa);
        if (a instanceof Number && b instanceof Number) {
            return ((BigDecimal) toDecimal(a)).compareTo((BigDecimal) toDecimal(b)) == 0;
        }
        if (a instanceof Quantity qa && b instanceof Quantity qb) {
            return Objects.equals(qa.unit(), qb.unit()) && qa.hasValue() && qb.hasValue()
                    && qa.value().compareTo(qb.value()) == 0;
        }
        return a.equals(b);
    }

    /**
     * Orders two answer values.
     * <p>
     * Numbers compare numerically, quantities by value when their units match (or against a
     * plain number), and values of the same {@link Comparable} class (dates, times, strings) by
     * their natural order.
     * </p>
     *
     * @return the comparison result, empty when the values are not comparable
     */
    @SuppressWarnings({"unchecked", "rawtypes"})
    public static Optional<Integer> compare(Object a, Object b) {
        if (a == null || b == null) return Optional.empty();
        Object left = a instanceof Quantity qa ? quantityValue(qa, b) : a;
        Object right = b instanceof Quantity qb ? quantityValue(qb, a) : b;
        if (left == null || right == null) return Optional.empty();
        if (left instanceof Number && right instanceof Number) {
            return Optional.of(((BigDecimal) toDecimal(left)).compareTo((BigDecimal) toDecimal(right)));
        }
        if (left instanceof Comparable && left.getClass().equals(right.getClass())) {
            return Optional.of(((Comparable) left).compareTo(right));
        }
        return Optional.empty();
    }

    private static BigDecimal quantityValue(Quantity quantity, Object other) {
        if (other instanceof Quantity otherQuantity && !Objects.equals(quantity.unit(), otherQuantity.unit())) {
            return null;
        }
        return quantity.value();
    }

    /**
     * @return true when the value is blank text or a quantity without value
     */
    public static boolean isEmpty(Object value) {
        if (value == null) return true;
        if (value instanceof String s) return s.isBlank();
        if (value instanceof Quantity quantity) return !quantity.hasValue();
        return false;
    }
}
