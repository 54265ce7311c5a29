package dev.vankka.supportdesk.outcome;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The result of an engine operation: success, success with warnings about non-essential side effects, or failure.
 *
 * @param <T> the value produced on (partial) success
 */
@Getter
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class Outcome<T> {

    public enum Status {
        SUCCESS,
        PARTIAL,
        FAILURE
    }

    private final Status status;
    private final T value;
    private final Reason reason;
    private final String message;
    private final List<String> warnings;

    public static <T> Outcome<T> success(T value) {
        return new Outcome<>(Status.SUCCESS, value, null, null, Collections.emptyList());
    }

    /**
     * Success when there are no warnings, partial success otherwise.
     */
    public static <T> Outcome<T> of(T value, List<String> warnings) {
        if (warnings.isEmpty()) {
            return success(value);
        }
        return new Outcome<>(Status.PARTIAL, value, null, null, List.copyOf(warnings));
    }

    public static <T> Outcome<T> failure(Reason reason) {
        return failure(reason, reason.getDefaultMessage());
    }

    public static <T> Outcome<T> failure(Reason reason, String message) {
        Objects.requireNonNull(reason, "reason");
        return new Outcome<>(Status.FAILURE, null, reason, message, Collections.emptyList());
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public boolean isPartial() {
        return status == Status.PARTIAL;
    }

    public boolean isFailure() {
        return status == Status.FAILURE;
    }

    /**
     * {@code true} for both full and partial success.
     */
    public boolean isCompleted() {
        return status != Status.FAILURE;
    }

    public Optional<T> value() {
        return Optional.ofNullable(value);
    }

    public ErrorKind getKind() {
        return reason != null ? reason.getKind() : null;
    }

    /**
     * Re-types a failure, for passing it up through an operation producing a different value.
     */
    @SuppressWarnings("unchecked")
    public <R> Outcome<R> castFailure() {
        if (!isFailure()) {
            throw new IllegalStateException("Not a failure: " + status);
        }
        return (Outcome<R>) this;
    }

    @Override
    public String toString() {
        return isFailure()
                ? "Outcome{" + status + ", " + reason + ": " + message + "}"
                : "Outcome{" + status + ", " + value + (warnings.isEmpty() ? "" : ", warnings=" + warnings) + "}";
    }
}
