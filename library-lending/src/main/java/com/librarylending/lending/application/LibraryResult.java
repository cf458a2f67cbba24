package com.librarylending.lending.application;

import com.librarylending.eventsourced.aggregates.Decision;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.*;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Uniform result of every {@link LibraryService} use case: either a value plus a human readable message, or the
 * {@link FailureKind} and the reason the use case failed.<br>
 * Expected business outcomes are always returned as a {@link LibraryResult}; only infrastructure failures are thrown.
 *
 * @param <T> the type of the success value
 */
public final class LibraryResult<T> {
    public enum FailureKind {
        /**
         * The referenced book or patron stream has no events
         */
        NOT_FOUND,
        ALREADY_EXISTS,
        /**
         * A business rule rejected the requested change (wrong state, wrong actor, ineligibility)
         */
        POLICY_VIOLATION,
        /**
         * Another writer modified the stream after it was loaded. The caller should retry the use case.
         */
        CONCURRENCY_CONFLICT
    }

    private final boolean     success;
    private final T           value;
    private final String      message;
    private final FailureKind failureKind;
    private final String      error;

    private LibraryResult(boolean success, T value, String message, FailureKind failureKind, String error) {
        this.success = success;
        this.value = value;
        this.message = message;
        this.failureKind = failureKind;
        this.error = error;
    }

    public static <T> LibraryResult<T> success(T value, String message) {
        return new LibraryResult<>(true, requireNonNull(value, "No value provided"), requireNonNull(message, "No message provided"), null, null);
    }

    public static <T> LibraryResult<T> success(T value) {
        return new LibraryResult<>(true, requireNonNull(value, "No value provided"), null, null, null);
    }

    public static <T> LibraryResult<T> failure(FailureKind failureKind, String error) {
        requireNonNull(error, "No error provided");
        requireTrue(!error.isBlank(), "No error provided");
        return new LibraryResult<>(false, null, null, requireNonNull(failureKind, "No failureKind provided"), error);
    }

    /**
     * Turn a rejected {@link Decision} into a {@link FailureKind#POLICY_VIOLATION} carrying the rejection reason verbatim
     */
    public static <T> LibraryResult<T> rejected(Decision<?> decision) {
        requireTrue(decision.isRejected(), "Only a rejected decision can be turned into a failure");
        return failure(FailureKind.POLICY_VIOLATION, decision.rejectionReason().orElseThrow());
    }

    public boolean isSuccess() {
        return success;
    }

    public boolean isFailure() {
        return !success;
    }

    /**
     * @throws IllegalStateException if the result is a failure
     */
    public T value() {
        if (!success) {
            throw new IllegalStateException(msg("Result is a {} failure: {}", failureKind, error));
        }
        return value;
    }

    public Optional<String> message() {
        return Optional.ofNullable(message);
    }

    public Optional<FailureKind> failureKind() {
        return Optional.ofNullable(failureKind);
    }

    public Optional<String> error() {
        return Optional.ofNullable(error);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LibraryResult)) return false;
        var that = (LibraryResult<?>) o;
        return success == that.success && Objects.equals(value, that.value) && Objects.equals(message, that.message) &&
                failureKind == that.failureKind && Objects.equals(error, that.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(success, value, message, failureKind, error);
    }

    @Override
    public String toString() {
        return success ?
               "Success{" + "value=" + value + ", message='" + message + '\'' + '}' :
               "Failure{" + failureKind + ": " + error + '}';
    }
}
