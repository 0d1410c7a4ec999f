package tech.yump.wrapper.validation;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of a validation: either the accepted value or the field errors that rejected it.
 *
 * @param <T> type of the accepted value
 */
public final class Validated<T> {

    private final T value;
    private final List<FieldError> errors;

    private Validated(T value, List<FieldError> errors) {
        this.value = value;
        this.errors = errors;
    }

    public static <T> Validated<T> valid(T value) {
        return new Validated<>(Objects.requireNonNull(value, "value"), List.of());
    }

    public static <T> Validated<T> invalid(FieldError error) {
        return new Validated<>(null, List.of(error));
    }

    public static <T> Validated<T> invalid(List<FieldError> errors) {
        if (errors.isEmpty()) {
            throw new IllegalArgumentException("An invalid result needs at least one field error.");
        }
        return new Validated<>(null, List.copyOf(errors));
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    /**
     * @throws IllegalStateException if this result is invalid
     */
    public T get() {
        if (!isValid()) {
            throw new IllegalStateException("No value present, validation failed: " + errors);
        }
        return value;
    }

    public List<FieldError> errors() {
        return errors;
    }

    public <R> Validated<R> map(Function<? super T, ? extends R> mapper) {
        return isValid() ? valid(mapper.apply(value)) : new Validated<>(null, errors);
    }

    @Override
    public String toString() {
        return isValid() ? "Validated[valid]" : "Validated[errors=" + errors + "]";
    }
}
