package org.villecon.runtime.integrity;

import java.util.Objects;

/**
 * Result of a fallible numeric computation: either a value or the reason it failed.
 *
 * @param <T> the value type.
 */
public final class CalculationResult<T> {

    private final T value;
    private final String failure;

    private CalculationResult(T value, String failure) {
        this.value = value;
        this.failure = failure;
    }

    public static <T> CalculationResult<T> success(T value) {
        return new CalculationResult<>(Objects.requireNonNull(value, "value"), null);
    }

    public static <T> CalculationResult<T> failure(String reason) {
        return new CalculationResult<>(null, Objects.requireNonNull(reason, "reason"));
    }

    public boolean isSuccess() {
        return failure == null;
    }

    /**
     * @return the computed value.
     * @throws IllegalStateException if the computation failed.
     */
    public T get() {
        if (failure != null) {
            throw new IllegalStateException("Calculation failed: " + failure);
        }
        return value;
    }

    public T orElse(T fallback) {
        return failure == null ? value : fallback;
    }

    /**
     * @return the failure reason, or {@code null} on success.
     */
    public String failureReason() {
        return failure;
    }

    @Override
    public String toString() {
        return failure == null ? "Success[" + value + "]" : "Failure[" + failure + "]";
    }
}
