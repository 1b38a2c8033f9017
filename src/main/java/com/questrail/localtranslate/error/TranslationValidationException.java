package com.questrail.localtranslate.error;

/**
 * Input rejected before dispatch (blank text, over-length text, unsupported
 * language). Always classified as {@link ErrorKind#VALIDATION}.
 */
public class TranslationValidationException extends IllegalArgumentException {

    public TranslationValidationException(String message) {
        super(message);
    }
}
