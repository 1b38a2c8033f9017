package com.questrail.localtranslate.api;

import java.util.Objects;

/**
 * Payload of a successful attempt: the source language actually used
 * (detected or as requested) and the translated text.
 */
public record TranslationResult(String detectedLanguage, String text)
{
    public TranslationResult {
        Objects.requireNonNull(detectedLanguage, "detectedLanguage");
        Objects.requireNonNull(text, "text");
    }
}
