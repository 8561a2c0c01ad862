package com.demoBank.swapPremium.util;

import java.util.Objects;

/**
 * Result of an operation run under {@link Recovery}: either a value or the failure that
 * was recovered.
 *
 * @param <T> value type
 */
public final class Outcome<T> {

    private final T value;
    private final RuntimeException failure;

    private Outcome(T value, RuntimeException failure) {
        this.value = value;
        this.failure = failure;
    }

    public static <T> Outcome<T> success(T value) {
        return new Outcome<>(value, null);
    }

    public static <T> Outcome<T> failure(RuntimeException failure) {
        return new Outcome<>(null, Objects.requireNonNull(failure, "failure"));
    }

    public boolean isSuccess() {
        return failure == null;
    }

    public boolean isFailure() {
        return failure != null;
    }

    /**
     * @throws IllegalStateException when called on a failure
     */
    public T getValue() {
        if (failure != null) {
            throw new IllegalStateException("Outcome is a failure", failure);
        }
        return value;
    }

    public RuntimeException getFailure() {
        return failure;
    }

    @Override
    public String toString() {
        return isSuccess() ? "Outcome[success=" + value + "]" : "Outcome[failure=" + failure.getMessage() + "]";
    }
}
