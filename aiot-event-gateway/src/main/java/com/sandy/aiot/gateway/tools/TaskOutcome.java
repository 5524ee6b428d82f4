package com.sandy.aiot.gateway.tools;

import java.util.Optional;

/**
 * Result of one task in a {@link ParallelTasks} group: a value, or the reason there is none.
 */
public final class TaskOutcome<T> {

    public enum Status { SUCCEEDED, FAILED, TIMED_OUT }

    private final String name;
    private final Status status;
    private final T value;
    private final Throwable error;
    private final long elapsedMs;

    private TaskOutcome(String name, Status status, T value, Throwable error, long elapsedMs) {
        this.name = name;
        this.status = status;
        this.value = value;
        this.error = error;
        this.elapsedMs = elapsedMs;
    }

    static <T> TaskOutcome<T> succeeded(String name, T value, long elapsedMs) {
        return new TaskOutcome<>(name, Status.SUCCEEDED, value, null, elapsedMs);
    }

    static <T> TaskOutcome<T> failed(String name, Throwable error, long elapsedMs) {
        return new TaskOutcome<>(name, Status.FAILED, null, error, elapsedMs);
    }

    static <T> TaskOutcome<T> timedOut(String name, long elapsedMs) {
        return new TaskOutcome<>(name, Status.TIMED_OUT, null, null, elapsedMs);
    }

    public String name() { return name; }

    public Status status() { return status; }

    public boolean isSuccess() { return status == Status.SUCCEEDED; }

    public Optional<T> value() { return Optional.ofNullable(value); }

    public Optional<Throwable> error() { return Optional.ofNullable(error); }

    public long elapsedMs() { return elapsedMs; }

    public String failureMessage() {
        if (status == Status.TIMED_OUT) return "timed out after " + elapsedMs + "ms";
        if (error == null) return null;
        return error.getClass().getSimpleName() + ": " + error.getMessage();
    }
}
