package com.questrail.localtranslate.api;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Language
 * -----------------------------------------------------------------------------
 * Registry of languages the client can translate between, keyed by ISO 639-1
 * code. {@link #AUTO} is a pseudo-language that requests source detection and
 * is never a valid translation target.
 */
public enum Language
{
    AUTO("auto", "Auto Detect", "Auto Detect"),
    KOREAN("ko", "Korean", "한국어"),
    ENGLISH("en", "English", "English"),
    JAPANESE("ja", "Japanese", "日本語"),
    CHINESE("zh", "Chinese", "中文"),
    SPANISH("es", "Spanish", "Español"),
    FRENCH("fr", "French", "Français"),
    GERMAN("de", "German", "Deutsch"),
    RUSSIAN("ru", "Russian", "Русский"),
    PORTUGUESE("pt", "Portuguese", "Português"),
    ITALIAN("it", "Italian", "Italiano");

    public static final String AUTO_CODE = "auto";

    /** Source language assumed when detection yields nothing. */
    public static final Language DETECTION_FALLBACK = ENGLISH;

    private final String code;
    private final String englishName;
    private final String displayName;

    Language(String code, String englishName, String displayName) {
        this.code = code;
        this.englishName = englishName;
        this.displayName = displayName;
    }

    public String code() {
        return code;
    }

    public String englishName() {
        return englishName;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Resolves either an ISO code ({@code "ko"}) or an English name
     * ({@code "Korean"}), case-insensitively.
     */
    public static Optional<Language> resolve(String codeOrName) {
        if (codeOrName == null || codeOrName.isBlank()) {
            return Optional.empty();
        }
        String key = codeOrName.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(l -> l.code.equals(key) || l.englishName.toLowerCase(Locale.ROOT).equals(key))
                .findFirst();
    }

    /** All languages usable as a translation target. */
    public static List<Language> targets() {
        return Arrays.stream(values())
                .filter(l -> l != AUTO)
                .collect(Collectors.toList());
    }
}
