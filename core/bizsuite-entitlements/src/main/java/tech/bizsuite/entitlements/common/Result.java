package tech.bizsuite.entitlements.common;

import tech.bizsuite.entitlements.common.errors.UseCaseError;

import java.util.function.Function;

/**
 * Result type for entitlement operations that can fail in a way the caller must handle.
 *
 * <p>This is a sealed interface with two variants:
 * <ul>
 *   <li>{@link Success} - contains the successful result value</li>
 *   <li>{@link Failure} - contains the error details</li>
 * </ul>
 *
 * <p>Usage:
 * <pre>{@code
 * Result<List<ResolvedPermission>> result = planResolver.resolve("starter");
 * if (result instanceof Result.Failure<List<ResolvedPermission>> f) {
 *     // f.error().code() == "PLAN_NOT_FOUND"
 * }
 * }</pre>
 */
public sealed interface Result<T> permits Result.Success, Result.Failure {

    boolean isSuccess();
    boolean isFailure();

    /**
     * Successful result containing the value.
     */
    record Success<T>(T value) implements Result<T> {
        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public boolean isFailure() {
            return false;
        }
    }

    /**
     * Failed result containing the error.
     */
    record Failure<T>(UseCaseError error) implements Result<T> {
        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public boolean isFailure() {
            return true;
        }
    }

    static <T> Result<T> success(T value) {
        return new Success<>(value);
    }

    static <T> Result<T> failure(UseCaseError error) {
        return new Failure<>(error);
    }

    /**
     * Transform the success value, leaving a failure unchanged.
     */
    @SuppressWarnings("unchecked")
    default <U> Result<U> map(Function<T, U> fn) {
        if (this instanceof Success<T> s) {
            return new Success<>(fn.apply(s.value()));
        }
        return (Result<U>) this;
    }

    /**
     * Return the success value, or throw {@link IllegalStateException} carrying the error message.
     */
    default T orElseThrow() {
        if (this instanceof Success<T> s) {
            return s.value();
        }
        UseCaseError error = ((Failure<T>) this).error();
        throw new IllegalStateException(error.code() + ": " + error.message());
    }
}
