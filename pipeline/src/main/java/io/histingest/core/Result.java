package io.histingest.core;

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of a pipeline stage: either a value or a {@link PipelineError}.
 */
public interface Result<T> {

    static <T> Result<T> ok(T value) { return new Ok<>(value); }

    static <T> Result<T> err(PipelineError error) { return new Err<>(error); }

    static <T> Result<T> err(ErrorKind kind, String code, String message) {
        return new Err<>(PipelineError.of(kind, code, message));
    }

    boolean isOk();

    /** @throws IllegalStateException when this is an error */
    T value();

    /** @throws IllegalStateException when this is a value */
    PipelineError error();

    default <U> Result<U> map(Function<? super T, ? extends U> fn) {
        if (isOk()) return ok(fn.apply(value()));
        return err(error());
    }

    record Ok<T>(T value) implements Result<T> {
        @Override public boolean isOk() { return true; }
        @Override public PipelineError error() { throw new IllegalStateException("result is ok"); }
    }

    record Err<T>(PipelineError error) implements Result<T> {
        public Err {
            Objects.requireNonNull(error, "error");
        }
        @Override public boolean isOk() { return false; }
        @Override public T value() { throw new IllegalStateException("result is an error: " + error.describe()); }
    }
}
