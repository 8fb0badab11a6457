package com.syncnest.accountservice.model;

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of an orchestration call: either {@link Success} with a message and payload,
 * or {@link Failure} with a {@link FailureKind}. Expected business outcomes are values,
 * not exceptions.
 */
public sealed interface ServiceResult<T> permits ServiceResult.Success, ServiceResult.Failure {

    record Success<T>(String message, T data) implements ServiceResult<T> {
    }

    record Failure<T>(FailureKind kind, String message) implements ServiceResult<T> {
        public Failure {
            Objects.requireNonNull(kind, "kind");
            if (message == null || message.isBlank()) {
                message = kind.getDefaultMessage();
            }
        }
    }

    static <T> ServiceResult<T> success(String message, T data) {
        return new Success<>(message, data);
    }

    static <T> ServiceResult<T> failure(FailureKind kind) {
        return new Failure<>(kind, kind.getDefaultMessage());
    }

    static <T> ServiceResult<T> failure(FailureKind kind, String message) {
        return new Failure<>(kind, message);
    }

    default boolean isSuccess() {
        return this instanceof Success;
    }

    /** Chains another step on success; a failure is carried through with its kind and message. */
    default <R> ServiceResult<R> flatMap(Function<? super T, ServiceResult<R>> next) {
        if (this instanceof Success<T> s) {
            return next.apply(s.data());
        }
        Failure<T> f = (Failure<T>) this;
        return new Failure<>(f.kind(), f.message());
    }

    default <R> R fold(Function<Success<T>, R> onSuccess, Function<Failure<T>, R> onFailure) {
        if (this instanceof Success<T> s) {
            return onSuccess.apply(s);
        }
        return onFailure.apply((Failure<T>) this);
    }
}
