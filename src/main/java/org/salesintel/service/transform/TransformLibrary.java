package org.salesintel.service.transform;

import org.salesintel.models.dto.ReferenceValue;
import org.salesintel.models.dto.TransformResult;
import org.salesintel.models.enums.TransformType;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Applies the named value transforms to raw source values. Each call yields either the converted
 * value or a failure reason; nothing is thrown for bad input.
 */
public final class TransformLibrary {

    private static final Set<String> TRUE_TOKENS = Set.of("true", "yes", "y", "1", "on", "t");
    private static final Set<String> FALSE_TOKENS = Set.of("false", "no", "n", "0", "off", "f");

    private TransformLibrary() {
    }

    public static TransformResult apply(TransformType transform, Object value) {
        TransformType effective = transform == null ? TransformType.NONE : transform;
        if (effective == TransformType.NONE) {
            return TransformResult.success(value);
        }
        if (effective == TransformType.TO_STRING) {
            return TransformResult.success(asText(value));
        }
        if (value == null) {
            return TransformResult.failure(effective.wireName() + ": value is null");
        }
        return switch (effective) {
            case EXTRACT_ID -> asReference(value)
                    .map(reference -> TransformResult.success(reference.id()))
                    .orElseGet(() -> notAReference(effective, value));
            case EXTRACT_NAME -> asReference(value)
                    .map(reference -> TransformResult.success(reference.label()))
                    .orElseGet(() -> notAReference(effective, value));
            case TO_FLOAT -> toFloat(value);
            case TO_INT -> toInt(value);
            case BOOLEAN -> toBoolean(value);
            case DATE_PARSE -> DateValueParser.normalize(value)
                    .map(TransformResult::success)
                    .orElseGet(() -> TransformResult.failure("date_parse: unrecognized date " + describe(value)));
            default -> TransformResult.success(value);
        };
    }

    /**
     * Reads the relational shapes providers return: a {@link ReferenceValue}, an Odoo many2one pair
     * {@code [id, "label"]}, or an object with {@code id} and {@code name} (or {@code display_name}).
     */
    static Optional<ReferenceValue> asReference(Object value) {
        if (value instanceof ReferenceValue reference) {
            return Optional.of(reference);
        }
        if (value instanceof List<?> list) {
            return pair(list.toArray());
        }
        if (value instanceof Object[] array) {
            return pair(array);
        }
        if (value instanceof Map<?, ?> map) {
            Object id = lookup(map, "id");
            Object name = lookup(map, "name");
            if (name == null) {
                name = lookup(map, "display_name");
            }
            if (id == null || name == null) {
                return Optional.empty();
            }
            return Optional.of(new ReferenceValue(id, String.valueOf(name)));
        }
        return Optional.empty();
    }

    private static Optional<ReferenceValue> pair(Object[] elements) {
        if (elements.length != 2 || elements[0] == null) {
            return Optional.empty();
        }
        return Optional.of(new ReferenceValue(elements[0], elements[1] == null ? null : String.valueOf(elements[1])));
    }

    // Salesforce relationship objects capitalize their keys (Id, Name)
    private static Object lookup(Map<?, ?> map, String key) {
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            if (entry.getKey() != null && key.equalsIgnoreCase(entry.getKey().toString())) {
                return entry.getValue();
            }
        }
        return null;
    }

    private static TransformResult notAReference(TransformType transform, Object value) {
        return TransformResult.failure(transform.wireName() + ": expected a reference but got " + describe(value));
    }

    private static String asText(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.toPlainString();
        }
        return String.valueOf(value);
    }

    private static TransformResult toFloat(Object value) {
        Optional<BigDecimal> number = asNumber(value);
        if (number.isEmpty()) {
            return TransformResult.failure("to_float: not numeric " + describe(value));
        }
        double result = number.get().doubleValue();
        if (Double.isInfinite(result)) {
            return TransformResult.failure("to_float: out of range " + describe(value));
        }
        return TransformResult.success(result);
    }

    private static TransformResult toInt(Object value) {
        Optional<BigDecimal> number = asNumber(value);
        if (number.isEmpty()) {
            return TransformResult.failure("to_int: not numeric " + describe(value));
        }
        BigDecimal decimal = number.get();
        int integerDigits = decimal.precision() - decimal.scale();
        if (integerDigits > 19) {
            return TransformResult.failure("to_int: out of range " + describe(value));
        }
        if (integerDigits <= 0) {
            return TransformResult.success(0L);
        }
        BigInteger truncated = decimal.setScale(0, RoundingMode.DOWN).toBigInteger();
        if (truncated.bitLength() > 63) {
            return TransformResult.failure("to_int: out of range " + describe(value));
        }
        return TransformResult.success(truncated.longValueExact());
    }

    private static Optional<BigDecimal> asNumber(Object value) {
        if (value instanceof Boolean) {
            return Optional.empty();
        }
        if (value instanceof BigDecimal decimal) {
            return Optional.of(decimal);
        }
        if (value instanceof BigInteger integer) {
            return Optional.of(new BigDecimal(integer));
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return Optional.empty();
            }
            return Optional.of(BigDecimal.valueOf(d));
        }
        if (value instanceof Number number) {
            return Optional.of(BigDecimal.valueOf(number.longValue()));
        }
        if (value instanceof CharSequence text) {
            String trimmed = text.toString().trim();
            if (trimmed.isEmpty()) {
                return Optional.empty();
            }
            try {
                return Optional.of(new BigDecimal(trimmed));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    private static TransformResult toBoolean(Object value) {
        if (value instanceof Boolean bool) {
            return TransformResult.success(bool);
        }
        if (value instanceof Number) {
            Optional<BigDecimal> number = asNumber(value);
            if (number.isPresent() && number.get().compareTo(BigDecimal.ONE) == 0) {
                return TransformResult.success(true);
            }
            if (number.isPresent() && number.get().signum() == 0) {
                return TransformResult.success(false);
            }
            return TransformResult.failure("boolean: only 1 and 0 are accepted, got " + describe(value));
        }
        if (value instanceof CharSequence text) {
            String token = text.toString().trim().toLowerCase(Locale.ROOT);
            if (TRUE_TOKENS.contains(token)) {
                return TransformResult.success(true);
            }
            if (FALSE_TOKENS.contains(token)) {
                return TransformResult.success(false);
            }
        }
        return TransformResult.failure("boolean: unrecognized token " + describe(value));
    }

    private static String describe(Object value) {
        String text = String.valueOf(value);
        if (text.length() > 60) {
            text = text.substring(0, 57) + "...";
        }
        return "'" + text + "' (" + value.getClass().getSimpleName() + ")";
    }
}
