package com.valuationoracle.common.result;

import java.util.Objects;

/**
 * Discriminated outcome of a write operation.
 *
 * <p>Exactly one of {@code value} / {@code error} is meaningful: successful results carry
 * a value and a {@code null} error, failed results carry an error and a {@code null} value.
 *
 * @param <T> type of the success value
 */
public record OracleResult<T>(boolean ok, T value, OracleError error) {

    public static <T> OracleResult<T> success(T value) {
        return new OracleResult<>(true, value, null);
    }

    public static <T> OracleResult<T> failure(OracleError error) {
        return new OracleResult<>(false, null, Objects.requireNonNull(error, "error"));
    }

    /** Numeric error code, or {@code null} on success. */
    public Integer errorCode() {
        return error == null ? null : error.code();
    }
}
