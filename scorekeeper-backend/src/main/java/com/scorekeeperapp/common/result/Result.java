package com.scorekeeperapp.common.result;

import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of an engine operation: either a value or a {@link ScoringError}.
 * Validation failures travel as values; exceptions are reserved for programming errors.
 */
public final class Result<T> {

    private static final Result<Void> EMPTY_SUCCESS = new Result<>(null, null);

    private final T value;
    private final ScoringError error;

    private Result(T value, ScoringError error) {
        this.value = value;
        this.error = error;
    }

    public static <T> Result<T> success(T value) {
        return new Result<>(value, null);
    }

    public static Result<Void> success() {
        return EMPTY_SUCCESS;
    }

    public static <T> Result<T> failure(ScoringError error) {
        return new Result<>(null, Objects.requireNonNull(error, "error"));
    }

    public static <T> Result<T> failure(ErrorCode code, String message) {
        return failure(new ScoringError(code, message));
    }

    public static <T> Result<T> failure(ErrorCode code, String message, Map<String, Object> details) {
        return failure(new ScoringError(code, message, details));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean isFailure() {
        return error != null;
    }

    public T getValue() {
        if (error != null) {
            throw new IllegalStateException("No value present, result failed with " + error.code());
        }
        return value;
    }

    public ScoringError getError() {
        if (error == null) {
            throw new IllegalStateException("No error present, result succeeded");
        }
        return error;
    }

    public <U> Result<U> map(Function<? super T, ? extends U> mapper) {
        if (error != null) return failure(error);
        return success(mapper.apply(value));
    }

    public <U> Result<U> flatMap(Function<? super T, Result<U>> mapper) {
        if (error != null) return failure(error);
        return mapper.apply(value);
    }

    public <X extends RuntimeException> T orElseThrow(Function<ScoringError, X> exceptionFactory) {
        if (error != null) throw exceptionFactory.apply(error);
        return value;
    }

    @Override
    public String toString() {
        return isSuccess() ? "Success[" + value + "]" : "Failure[" + error.code() + ": " + error.message() + "]";
    }
}
