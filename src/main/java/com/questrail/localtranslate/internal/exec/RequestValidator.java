package com.questrail.localtranslate.internal.exec;

import com.questrail.localtranslate.api.Language;
import com.questrail.localtranslate.api.TranslationRequest;
import com.questrail.localtranslate.error.TranslationValidationException;

/**
 * Input checks performed before a request is dispatched. Failures here never
 * reach a worker and are never retried.
 */
final class RequestValidator {

    private RequestValidator() {}

    static void validate(TranslationRequest request, int maxTextLength) {
        String text = request.text().strip();
        if (text.isEmpty()) {
            throw new TranslationValidationException("Text to translate is empty");
        }
        if (text.length() > maxTextLength) {
            throw new TranslationValidationException(
                    "Text is too long: " + text.length() + " characters (maximum " + maxTextLength + ")");
        }

        Language target = Language.resolve(request.targetLanguage())
                .orElseThrow(() -> new TranslationValidationException(
                        "Unsupported target language: '" + request.targetLanguage() + "'"));
        if (target == Language.AUTO) {
            throw new TranslationValidationException("Target language cannot be auto-detected");
        }

        if (!request.autoDetectSource() && Language.resolve(request.sourceLanguage()).isEmpty()) {
            throw new TranslationValidationException(
                    "Unsupported source language: '" + request.sourceLanguage() + "'");
        }
    }
}
