package com.questrail.localtranslate.error;

import java.util.Objects;
import java.util.Optional;

/**
 * TranslationError
 * -----------------------------------------------------------------------------
 * Immutable, classified description of one failed attempt.
 *
 * @param kind      classification
 * @param message   raw failure message
 * @param cause     user-facing explanation
 * @param solution  user-facing remedy
 * @param retryable whether the orchestrator may retry
 * @param exception original throwable, if any
 * @param trace     diagnostic stack trace text, if captured
 */
public record TranslationError(
        ErrorKind kind,
        String message,
        String cause,
        String solution,
        boolean retryable,
        Throwable exception,
        String trace
) {
    public TranslationError {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(cause, "cause");
        Objects.requireNonNull(solution, "solution");
    }

    /** Builds an error carrying the fixed cause/solution/retryability of {@code kind}. */
    public static TranslationError of(ErrorKind kind, String message, Throwable exception, String trace) {
        return new TranslationError(kind, message, kind.cause(), kind.solution(), kind.retryable(), exception, trace);
    }

    public Optional<Throwable> originalException() {
        return Optional.ofNullable(exception);
    }

    public Optional<String> diagnosticTrace() {
        return Optional.ofNullable(trace);
    }

    @Override
    public String toString() {
        return "TranslationError{" + kind + ", retryable=" + retryable + ", message='" + message + "'}";
    }
}
