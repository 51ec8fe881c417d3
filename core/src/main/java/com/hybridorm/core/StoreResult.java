package com.hybridorm.core;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * The result of one attempt against a backing store: either a (possibly absent) value or
 * the exception that stopped it.
 */
public final class StoreResult<T> {
    private final T value;
    private final RuntimeException error;

    private StoreResult(T value, RuntimeException error) {
        this.value = value;
        this.error = error;
    }

    public static <T> StoreResult<T> success(T value) {
        return new StoreResult<>(value, null);
    }

    public static <T> StoreResult<T> failure(RuntimeException error) {
        return new StoreResult<>(null, error);
    }

    /**
     * Runs {@code work}, capturing any runtime exception as a failure.
     */
    public static <T> StoreResult<T> attempt(Supplier<T> work) {
        try {
            return success(work.get());
        } catch (RuntimeException e) {
            return failure(e);
        }
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean isFailure() {
        return error != null;
    }

    /**
     * True for a success that carries a value.
     */
    public boolean isPresent() {
        return error == null && value != null;
    }

    public Optional<T> value() {
        return Optional.ofNullable(value);
    }

    public Optional<RuntimeException> error() {
        return Optional.ofNullable(error);
    }

    @Override
    public String toString() {
        return isSuccess() ? "StoreResult[success=" + value + "]" : "StoreResult[failure=" + error + "]";
    }
}
