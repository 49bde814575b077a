package com.stock.pulse.engine.common;

import com.stock.pulse.engine.common.exception.BasePipelineException;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome envelope returned by services to the web layer.
 * Carries either data or an error message with an optional error code.
 */
@Getter
@ToString
public final class Result<T> {

    private final boolean success;
    private final T data;
    private final String error;
    private final String errorCode;
    private final Instant timestamp;

    private Result(boolean success, T data, String error, String errorCode) {
        this.success = success;
        this.data = data;
        this.error = error;
        this.errorCode = errorCode;
        this.timestamp = Instant.now();
    }

    public static <T> Result<T> ok(T data) {
        return new Result<>(true, data, null, null);
    }

    public static <T> Result<T> ok() {
        return new Result<>(true, null, null, null);
    }

    public static <T> Result<T> fail(String code, String message) {
        return new Result<>(false, null, message, code);
    }

    /**
     * Failure carrying the error code of a pipeline exception when there is one.
     */
    public static <T> Result<T> fail(Throwable t) {
        if (t == null) return new Result<>(false, null, "Unknown error", null);
        String msg = t.getMessage() == null ? t.toString() : t.getMessage();
        String code = (t instanceof BasePipelineException bpe) ? bpe.getErrorCode() : null;
        return new Result<>(false, null, msg, code);
    }

    public boolean isOk() {
        return success;
    }

    public T get() {
        return data;
    }

    public T getOrElse(T fallback) {
        return (success && data != null) ? data : fallback;
    }

    public <R> Result<R> map(Function<? super T, ? extends R> mapper) {
        Objects.requireNonNull(mapper, "mapper");
        if (!success) return Result.fail(errorCode, error);
        return Result.ok(mapper.apply(data));
    }

    public <R> Result<R> flatMap(Function<? super T, Result<R>> mapper) {
        Objects.requireNonNull(mapper, "mapper");
        if (!success) return Result.fail(errorCode, error);
        return Objects.requireNonNull(mapper.apply(data));
    }
}
