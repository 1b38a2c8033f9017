package com.questrail.localtranslate.api;

/**
 * Receives progress reports from inside a blocking translation call.
 */
@FunctionalInterface
public interface ProgressCallback
{
    ProgressCallback NONE = (percent, message) -> {};

    /**
     * @param percent progress in the range 0..100
     * @param message short human-readable status
     */
    void report(int percent, String message);
}
