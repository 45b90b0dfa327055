package com.hcltech.depvis.common.errorsor;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Either a value or a non-empty list of error messages.
 * Used where every problem should be reported at once instead of failing on the first.
 */
public interface ErrorsOr<T> {

    boolean isValue();

    default boolean isError() {
        return !isValue();
    }

    Optional<T> getValue();

    List<String> getErrors();

    static <T> ErrorsOr<T> lift(T value) {
        return new Value<>(value);
    }

    static <T> ErrorsOr<T> error(String error) {
        return new Errors<>(List.of(error));
    }

    static <T> ErrorsOr<T> errors(List<String> errors) {
        return new Errors<>(errors);
    }

    /** Value if {@code errors} is empty, otherwise all of them. */
    static <T> ErrorsOr<T> valueUnless(List<String> errors, T value) {
        return errors.isEmpty() ? lift(value) : errors(errors);
    }

    default T valueOrThrow() {
        return getValue().orElseThrow(() ->
                new IllegalStateException("Expected value but got errors: " + getErrors()));
    }

    default <U> ErrorsOr<U> flatMap(Function<? super T, ErrorsOr<U>> f) {
        return isError() ? errors(getErrors()) : f.apply(valueOrThrow());
    }


    record Value<T>(T value) implements ErrorsOr<T> {
        public Value {
            Objects.requireNonNull(value, "value");
        }

        @Override public boolean isValue() { return true; }

        @Override public Optional<T> getValue() { return Optional.of(value); }

        @Override public List<String> getErrors() { return List.of(); }
    }

    record Errors<T>(List<String> errors) implements ErrorsOr<T> {
        public Errors {
            errors = List.copyOf(errors);
            if (errors.isEmpty()) throw new IllegalArgumentException("Errors must not be empty");
        }

        @Override public boolean isValue() { return false; }

        @Override public Optional<T> getValue() { return Optional.empty(); }

        @Override public List<String> getErrors() { return errors; }
    }
}
