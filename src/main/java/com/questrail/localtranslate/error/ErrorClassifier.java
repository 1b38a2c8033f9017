package com.questrail.localtranslate.error;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.TimeoutException;
import java.util.regex.Pattern;

/**
 * ErrorClassifier
 * -----------------------------------------------------------------------------
 * Pure, deterministic mapping from a raw failure to a {@link TranslationError}.
 *
 * <h2>Decision order (first match wins)</h2>
 * <ol>
 *   <li>{@link IllegalArgumentException} (incl. {@link TranslationValidationException}) → VALIDATION</li>
 *   <li>{@link OutOfMemoryError} → MEMORY</li>
 *   <li>{@link TimeoutException}, {@link SocketTimeoutException}, {@link HttpTimeoutException} → TIMEOUT</li>
 *   <li>{@link IOException} / {@link UncheckedIOException}: TIMEOUT if the message
 *       looks like a timeout, otherwise NETWORK</li>
 *   <li>message patterns, in order TIMEOUT → MEMORY → NETWORK → MODEL</li>
 *   <li>UNKNOWN</li>
 * </ol>
 */
public final class ErrorClassifier
{
    public static final String TIMEOUT_MESSAGE = "Translation timed out";

    private static final List<Pattern> TIMEOUT_PATTERNS = patterns(
            "timed? ?out",
            "timeout",
            "deadline exceeded");

    private static final List<Pattern> MEMORY_PATTERNS = patterns(
            "out of memory",
            "\\bOOM\\b",
            "MemoryError",
            "OutOfMemoryError",
            "cannot allocate",
            "allocation failed");

    private static final List<Pattern> NETWORK_PATTERNS = patterns(
            "connection",
            "network",
            "socket",
            "ConnectException",
            "UnknownHost");

    private static final List<Pattern> MODEL_PATTERNS = patterns(
            "model not loaded",
            "model.*not.*initiali[sz]ed",
            "failed to load.*model",
            "model.*failed");

    private ErrorClassifier() {}

    /**
     * Classifies a failure.
     *
     * @param exception the thrown failure, or {@code null} when only a message is known
     * @param message   failure message; when {@code null} it is derived from {@code exception}
     * @param trace     optional diagnostic trace carried through unchanged
     */
    public static TranslationError classify(Throwable exception, String message, String trace) {
        String effectiveMessage = message != null ? message : describe(exception);
        ErrorKind kind = determineKind(exception, effectiveMessage);
        return TranslationError.of(kind, effectiveMessage, exception, trace);
    }

    public static TranslationError classify(Throwable exception) {
        return classify(exception, null, null);
    }

    /** Classifies from the message alone. */
    public static TranslationError classifyMessage(String message, String trace) {
        return classify(null, message, trace);
    }

    /** The error synthesized when an attempt exceeds its deadline. */
    public static TranslationError timeoutError() {
        return TranslationError.of(ErrorKind.TIMEOUT, TIMEOUT_MESSAGE, null, null);
    }

    public static TranslationError validationError(String message) {
        return TranslationError.of(ErrorKind.VALIDATION, message, new TranslationValidationException(message), null);
    }

    static ErrorKind determineKind(Throwable exception, String message) {
        if (exception instanceof IllegalArgumentException) {
            return ErrorKind.VALIDATION;
        }
        if (exception instanceof OutOfMemoryError) {
            return ErrorKind.MEMORY;
        }
        if (exception instanceof TimeoutException
                || exception instanceof SocketTimeoutException
                || exception instanceof HttpTimeoutException) {
            return ErrorKind.TIMEOUT;
        }
        if (exception instanceof IOException || exception instanceof UncheckedIOException) {
            return matchesAny(TIMEOUT_PATTERNS, message) ? ErrorKind.TIMEOUT : ErrorKind.NETWORK;
        }

        if (matchesAny(TIMEOUT_PATTERNS, message)) {
            return ErrorKind.TIMEOUT;
        }
        if (matchesAny(MEMORY_PATTERNS, message)) {
            return ErrorKind.MEMORY;
        }
        if (matchesAny(NETWORK_PATTERNS, message)) {
            return ErrorKind.NETWORK;
        }
        if (matchesAny(MODEL_PATTERNS, message)) {
            return ErrorKind.MODEL;
        }
        return ErrorKind.UNKNOWN;
    }

    /** Message of a throwable, falling back to its simple class name. */
    public static String describe(Throwable exception) {
        if (exception == null) {
            return "";
        }
        String msg = exception.getMessage();
        return (msg == null || msg.isBlank()) ? exception.getClass().getSimpleName() : msg;
    }

    private static boolean matchesAny(List<Pattern> patterns, String message) {
        if (message == null || message.isEmpty()) {
            return false;
        }
        for (Pattern p : patterns) {
            if (p.matcher(message).find()) {
                return true;
            }
        }
        return false;
    }

    private static List<Pattern> patterns(String... regexes) {
        return Arrays.stream(regexes)
                .map(r -> Pattern.compile(r, Pattern.CASE_INSENSITIVE))
                .toList();
    }
}
