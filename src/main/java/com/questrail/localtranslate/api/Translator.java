package com.questrail.localtranslate.api;

/**
 * Translator
 * -----------------------------------------------------------------------------
 * The single shared translation engine (typically one loaded model).
 *
 * <p>Calls are blocking and run on worker-pool threads. Implementations receive
 * text that has already been validated and a concrete (never {@code auto})
 * source language. Failures are reported by throwing; the orchestrator
 * classifies whatever is thrown.</p>
 *
 * <p>Implementations must contain no orchestration logic (no retries, no
 * timeouts).</p>
 */
@FunctionalInterface
public interface Translator
{
    String translate(String text,
                     String sourceLanguage,
                     String targetLanguage,
                     ProgressCallback progress) throws Exception;
}
