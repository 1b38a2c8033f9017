package com.questrail.localtranslate.internal.exec;

import com.questrail.localtranslate.api.TranslationRequest;
import com.questrail.localtranslate.error.TranslationValidationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RequestValidatorTest {

    private static void validate(String text, String source, String target) {
        RequestValidator.validate(new TranslationRequest(text, source, target), 10);
    }

    @Test
    void acceptsSupportedPairs() {
        assertDoesNotThrow(() -> validate("Hello", "auto", "ko"));
        assertDoesNotThrow(() -> validate("Hello", "EN", "Japanese"));
    }

    @Test
    void lengthIsMeasuredAfterTrimming() {
        assertDoesNotThrow(() -> validate("   0123456789   ", "en", "ko"));

        TranslationValidationException e = assertThrows(TranslationValidationException.class,
                () -> validate("0123456789X", "en", "ko"));
        assertTrue(e.getMessage().contains("11"));
    }

    @Test
    void rejectsBlankText() {
        assertThrows(TranslationValidationException.class, () -> validate(" \n\t", "en", "ko"));
    }

    @Test
    void rejectsAutoOrUnknownTarget() {
        assertThrows(TranslationValidationException.class, () -> validate("Hello", "en", "auto"));
        assertThrows(TranslationValidationException.class, () -> validate("Hello", "en", "tlh"));
    }

    @Test
    void rejectsUnknownSource() {
        assertThrows(TranslationValidationException.class, () -> validate("Hello", "xx", "ko"));
    }
}
