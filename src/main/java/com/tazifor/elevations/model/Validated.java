package com.tazifor.elevations.model;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.Function;

/**
 * Either a value or the {@link RequestError} that prevented computing it.
 * <p>
 * Caller errors travel as values through the resolver, the limit enforcer and
 * the engine, and are only turned into HTTP responses at the controller.
 * </p>
 */
public final class Validated<T> {

    private final T value;
    private final RequestError error;

    private Validated(T value, RequestError error) {
        this.value = value;
        this.error = error;
    }

    public static <T> Validated<T> ok(T value) {
        return new Validated<>(Objects.requireNonNull(value), null);
    }

    public static <T> Validated<T> rejected(RequestError error) {
        return new Validated<>(null, Objects.requireNonNull(error));
    }

    public static <T> Validated<T> rejected(RequestError.Kind kind, String message) {
        return rejected(RequestError.of(kind, message));
    }

    public boolean isOk() { return error == null; }

    public T value() {
        if (error != null) {
            throw new NoSuchElementException("Rejected: " + error.message());
        }
        return value;
    }

    public RequestError error() {
        if (error == null) {
            throw new NoSuchElementException("No error on an accepted value");
        }
        return error;
    }

    public <R> Validated<R> map(Function<? super T, ? extends R> fn) {
        return isOk() ? ok(fn.apply(value)) : rejected(error);
    }

    public <R> Validated<R> flatMap(Function<? super T, Validated<R>> fn) {
        return isOk() ? fn.apply(value) : rejected(error);
    }

    @Override
    public String toString() {
        return isOk() ? "Validated.ok(" + value + ")" : "Validated.rejected(" + error + ")";
    }
}
