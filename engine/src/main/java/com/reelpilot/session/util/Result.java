package com.reelpilot.session.util;

import java.util.Optional;
import java.util.function.Function;

/**
 * Outcome of a call that crosses the device or ledger boundary. A failed result carries an
 * {@link ErrorKind} so callers can tell a missing element apart from an I/O failure.
 */
public record Result<T>(
    T value,
    ErrorKind errorKind,
    String errorMessage
) {
    public static <T> Result<T> ok(T value) {
        return new Result<>(value, null, null);
    }

    public static Result<Void> done() {
        return new Result<>(null, null, null);
    }

    public static <T> Result<T> err(ErrorKind kind, String message) {
        return new Result<>(null, kind == null ? ErrorKind.FATAL : kind, message);
    }

    public static <T> Result<T> notFound(String message) {
        return err(ErrorKind.NOT_FOUND, message);
    }

    public static <T> Result<T> transientFailure(String message) {
        return err(ErrorKind.TRANSIENT, message);
    }

    public boolean isOk() {
        return errorKind == null;
    }

    public boolean isErr() {
        return errorKind != null;
    }

    public boolean isKind(ErrorKind kind) {
        return errorKind == kind;
    }

    public T orElse(T fallback) {
        return isOk() && value != null ? value : fallback;
    }

    public Optional<T> toOptional() {
        return isOk() ? Optional.ofNullable(value) : Optional.empty();
    }

    public <R> Result<R> map(Function<T, R> mapper) {
        if (isErr()) {
            return new Result<>(null, errorKind, errorMessage);
        }
        return Result.ok(mapper.apply(value));
    }
}
