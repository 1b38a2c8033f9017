package com.questrail.localtranslate.api;

import java.util.Objects;

/**
 * Immutable translation input as submitted by the caller.
 *
 * <p>{@code sourceLanguage} may be {@link Language#AUTO_CODE} to request
 * detection. Content checks (blank text, length, unsupported languages) are
 * performed by the orchestrator before dispatch, not here.</p>
 */
public record TranslationRequest(String text, String sourceLanguage, String targetLanguage)
{
    public TranslationRequest {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(sourceLanguage, "sourceLanguage");
        Objects.requireNonNull(targetLanguage, "targetLanguage");
    }

    public boolean autoDetectSource() {
        return Language.AUTO_CODE.equalsIgnoreCase(sourceLanguage);
    }

    /** Short, log-safe preview of the text. */
    public String preview() {
        return text.length() <= 50 ? text : text.substring(0, 50) + "...";
    }
}
