package com.questrail.localtranslate.api;

import java.util.Optional;

/**
 * Detects the language of a text. Consulted only when the request's source
 * language is {@code auto}.
 */
@FunctionalInterface
public interface LanguageDetector
{
    LanguageDetector NONE = text -> Optional.empty();

    /**
     * @return ISO 639-1 code, or empty when the text is too short or ambiguous
     */
    Optional<String> detect(String text);
}
