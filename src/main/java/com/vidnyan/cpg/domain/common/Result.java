package com.vidnyan.cpg.domain.common;

import java.util.function.Function;

/**
 * Explicit success-or-failure outcome.
 * Exactly one of {@code value} and {@code error} is set.
 */
public record Result<T>(T value, AnalysisError error) {

    public static <T> Result<T> success(T value) {
        return new Result<>(value, null);
    }

    public static <T> Result<T> failure(AnalysisError error) {
        return new Result<>(null, error);
    }

    public static <T> Result<T> failure(ErrorCode code, String message) {
        return new Result<>(null, AnalysisError.of(code, message));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean isFailure() {
        return error != null;
    }

    /**
     * Value of a successful result.
     *
     * @throws IllegalStateException when called on a failure
     */
    public T get() {
        if (error != null) {
            throw new IllegalStateException("Result is a failure: " + error.format());
        }
        return value;
    }

    public ErrorCode errorCode() {
        return error != null ? error.code() : null;
    }

    public <R> Result<R> map(Function<? super T, ? extends R> mapper) {
        return isSuccess() ? success(mapper.apply(value)) : failure(error);
    }

    public <R> Result<R> flatMap(Function<? super T, Result<R>> mapper) {
        return isSuccess() ? mapper.apply(value) : failure(error);
    }

    public T orElse(T fallback) {
        return isSuccess() ? value : fallback;
    }
}
