package com.questrail.localtranslate.error;

/**
 * ErrorKind
 * -----------------------------------------------------------------------------
 * Actionable failure categories. Each kind carries a fixed user-facing cause,
 * a suggested solution and whether an automatic retry makes sense.
 */
public enum ErrorKind
{
    NETWORK(
            "A network connection problem occurred.",
            "Check your internet connection and try again in a moment.",
            true),
    MEMORY(
            "The system is running out of memory.",
            "Close other applications or try a shorter text.",
            true),
    MODEL(
            "The translation model is not available.",
            "Restart the application. If the problem persists, make sure at least 10GB of storage is free.",
            false),
    TIMEOUT(
            "The translation took too long.",
            "The text may be too long. Split it into smaller parts or try again later.",
            true),
    VALIDATION(
            "There is a problem with the input text.",
            "Check the text and enter it again.",
            false),
    UNKNOWN(
            "An unexpected error occurred.",
            "Try again in a moment. If the problem persists, restart the application.",
            true);

    private final String cause;
    private final String solution;
    private final boolean retryable;

    ErrorKind(String cause, String solution, boolean retryable) {
        this.cause = cause;
        this.solution = solution;
        this.retryable = retryable;
    }

    public String cause() {
        return cause;
    }

    public String solution() {
        return solution;
    }

    public boolean retryable() {
        return retryable;
    }
}
