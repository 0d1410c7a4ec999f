package tech.yump.wrapper.validation;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Shape checks for wrapper ids and create payloads. Runs before any store access and has
 * no side effects.
 */
@Component
public class WrapperValidator {

    public static final long MIN_TTL_SECONDS = 30;
    /** Keeps {@code now + ttl} within an epoch-second {@code long}. */
    public static final long MAX_TTL_SECONDS = Long.MAX_VALUE / 2;

    public static final String FIELD_ID = "id";
    public static final String FIELD_TTL = "ttl";
    public static final String FIELD_VALUE = "value";

    static final String MSG_TTL_TOO_SHORT = "must be greater than 30 seconds";
    static final String MSG_NOT_INTEGER = "value is not a valid integer";
    static final String MSG_REQUIRED = "field required";
    static final String MSG_NOT_STRING = "str type expected";
    static final String MSG_TTL_TOO_LONG = "ensure this value is less than or equal to " + MAX_TTL_SECONDS;
    static final String MSG_ID_INVALID = "id contains invalid characters";

    private static final Pattern ALPHANUMERIC = Pattern.compile("[A-Za-z0-9]+");

    /**
     * Accepts a whole number of seconds, given as a JSON number or a decimal string, that is
     * at least {@value #MIN_TTL_SECONDS} and at most {@link #MAX_TTL_SECONDS}.
     */
    public Validated<Long> validateTtl(Object ttl) {
        if (ttl == null) {
            return Validated.invalid(FieldError.of(FIELD_TTL, MSG_REQUIRED, FieldError.TYPE_MISSING));
        }
        Long seconds = toLong(ttl);
        if (seconds == null) {
            return Validated.invalid(FieldError.of(FIELD_TTL, MSG_NOT_INTEGER, FieldError.TYPE_INTEGER));
        }
        if (seconds < MIN_TTL_SECONDS) {
            return Validated.invalid(FieldError.of(FIELD_TTL, MSG_TTL_TOO_SHORT, FieldError.TYPE_VALUE_ERROR));
        }
        if (seconds > MAX_TTL_SECONDS) {
            return Validated.invalid(FieldError.of(FIELD_TTL, MSG_TTL_TOO_LONG, FieldError.TYPE_NOT_LE));
        }
        return Validated.valid(seconds);
    }

    public Validated<String> validateId(String id) {
        if (id == null) {
            return Validated.invalid(FieldError.of(FIELD_ID, MSG_REQUIRED, FieldError.TYPE_MISSING));
        }
        if (!ALPHANUMERIC.matcher(id).matches()) {
            return Validated.invalid(FieldError.of(FIELD_ID, MSG_ID_INVALID, FieldError.TYPE_VALUE_ERROR));
        }
        return Validated.valid(id);
    }

    /**
     * Validates a create request. Every failing field is reported, ttl first. The value may
     * be an empty string but must be present.
     */
    public Validated<CreateCommand> validateCreatePayload(Object value, Object ttl) {
        List<FieldError> errors = new ArrayList<>();

        Validated<Long> ttlResult = validateTtl(ttl);
        errors.addAll(ttlResult.errors());

        if (value == null) {
            errors.add(FieldError.of(FIELD_VALUE, MSG_REQUIRED, FieldError.TYPE_MISSING));
        } else if (!(value instanceof String)) {
            errors.add(FieldError.of(FIELD_VALUE, MSG_NOT_STRING, FieldError.TYPE_STRING));
        }

        if (!errors.isEmpty()) {
            return Validated.invalid(errors);
        }
        return Validated.valid(new CreateCommand((String) value, ttlResult.get()));
    }

    private static Long toLong(Object ttl) {
        if (ttl instanceof Integer || ttl instanceof Long || ttl instanceof Short || ttl instanceof Byte) {
            return ((Number) ttl).longValue();
        }
        if (ttl instanceof BigInteger big) {
            return big.bitLength() < Long.SIZE ? big.longValue() : null;
        }
        if (ttl instanceof Double || ttl instanceof Float || ttl instanceof BigDecimal) {
            return wholeNumber(ttl.toString());
        }
        if (ttl instanceof String text) {
            try {
                return Long.parseLong(text.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static Long wholeNumber(String number) {
        try {
            return new BigDecimal(number).longValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            return null;
        }
    }
}
