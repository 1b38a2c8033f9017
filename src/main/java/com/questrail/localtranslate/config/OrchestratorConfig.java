package com.questrail.localtranslate.config;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * OrchestratorConfig
 * -----------------------------------------------------------------------------
 * Operational settings of the translation orchestrator.
 *
 * <ul>
 *   <li><b>debounceDelay</b>: quiet period a debounced submission waits for
 *       before it is dispatched.</li>
 *   <li><b>translationTimeout</b>: deadline of each individual attempt,
 *       measured from attempt start. Independent of retry backoff.</li>
 *   <li><b>maxTextLength</b>: longest accepted input, in characters.</li>
 *   <li><b>workerThreads</b>: worker pool capacity.</li>
 *   <li><b>retryPolicy</b>: retry budget and backoff.</li>
 * </ul>
 *
 * <p>All values can be overridden from the environment with
 * {@link #fromEnvironment(Map)}; unset or blank variables keep the default.</p>
 */
public record OrchestratorConfig(
        Duration debounceDelay,
        Duration translationTimeout,
        int maxTextLength,
        int workerThreads,
        RetryPolicy retryPolicy
) {
    public static final String ENV_DEBOUNCE_MS = "LOCALTRANSLATE_DEBOUNCE_MS";
    public static final String ENV_MAX_RETRIES = "LOCALTRANSLATE_MAX_RETRIES";
    public static final String ENV_MEMORY_ERROR_MAX_RETRIES = "LOCALTRANSLATE_MEMORY_ERROR_MAX_RETRIES";
    public static final String ENV_INITIAL_RETRY_DELAY_MS = "LOCALTRANSLATE_INITIAL_RETRY_DELAY_MS";
    public static final String ENV_MAX_RETRY_DELAY_MS = "LOCALTRANSLATE_MAX_RETRY_DELAY_MS";
    public static final String ENV_BACKOFF_MULTIPLIER = "LOCALTRANSLATE_BACKOFF_MULTIPLIER";
    public static final String ENV_TRANSLATION_TIMEOUT_MS = "LOCALTRANSLATE_TRANSLATION_TIMEOUT_MS";
    public static final String ENV_MAX_TEXT_LENGTH = "LOCALTRANSLATE_MAX_TEXT_LENGTH";
    public static final String ENV_WORKER_THREADS = "LOCALTRANSLATE_WORKER_THREADS";

    public OrchestratorConfig {
        Objects.requireNonNull(debounceDelay, "debounceDelay");
        Objects.requireNonNull(translationTimeout, "translationTimeout");
        Objects.requireNonNull(retryPolicy, "retryPolicy");

        if (debounceDelay.isNegative()) {
            throw new IllegalArgumentException("debounceDelay must be non-negative");
        }
        if (translationTimeout.isNegative() || translationTimeout.isZero()) {
            throw new IllegalArgumentException("translationTimeout must be positive");
        }
        if (maxTextLength < 1) {
            throw new IllegalArgumentException("maxTextLength must be >= 1");
        }
        if (workerThreads < 1) {
            throw new IllegalArgumentException("workerThreads must be >= 1");
        }
    }

    /**
     * Defaults: 500ms debounce, 60s per-attempt timeout, 2000 characters,
     * {@code clamp(cpus, 2, 4)} workers, {@link RetryPolicy#defaults()}.
     */
    public static OrchestratorConfig defaults() {
        return new OrchestratorConfig(
                Duration.ofMillis(500),
                Duration.ofMillis(60_000),
                2000,
                defaultWorkerThreads(Runtime.getRuntime().availableProcessors()),
                RetryPolicy.defaults());
    }

    /** One model instance is shared, so more than four workers only adds contention. */
    public static int defaultWorkerThreads(int cpuCount) {
        return Math.max(2, Math.min(4, cpuCount));
    }

    public static OrchestratorConfig fromEnv() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Applies {@code LOCALTRANSLATE_*} overrides on top of {@link #defaults()}.
     *
     * @throws IllegalArgumentException if a variable is set but malformed
     */
    public static OrchestratorConfig fromEnvironment(Map<String, String> env) {
        Objects.requireNonNull(env, "env");
        OrchestratorConfig d = defaults();
        RetryPolicy r = d.retryPolicy();

        RetryPolicy policy = new RetryPolicy(
                read(env, ENV_MAX_RETRIES, Integer::parseInt, r.maxRetries()),
                read(env, ENV_MEMORY_ERROR_MAX_RETRIES, Integer::parseInt, r.memoryErrorMaxRetries()),
                read(env, ENV_INITIAL_RETRY_DELAY_MS, OrchestratorConfig::millis, r.initialDelay()),
                read(env, ENV_MAX_RETRY_DELAY_MS, OrchestratorConfig::millis, r.maxDelay()),
                read(env, ENV_BACKOFF_MULTIPLIER, Double::parseDouble, r.multiplier()));

        return new OrchestratorConfig(
                read(env, ENV_DEBOUNCE_MS, OrchestratorConfig::millis, d.debounceDelay()),
                read(env, ENV_TRANSLATION_TIMEOUT_MS, OrchestratorConfig::millis, d.translationTimeout()),
                read(env, ENV_MAX_TEXT_LENGTH, Integer::parseInt, d.maxTextLength()),
                read(env, ENV_WORKER_THREADS, Integer::parseInt, d.workerThreads()),
                policy);
    }

    public OrchestratorConfig withDebounceDelay(Duration value) {
        return new OrchestratorConfig(value, translationTimeout, maxTextLength, workerThreads, retryPolicy);
    }

    public OrchestratorConfig withTranslationTimeout(Duration value) {
        return new OrchestratorConfig(debounceDelay, value, maxTextLength, workerThreads, retryPolicy);
    }

    public OrchestratorConfig withMaxTextLength(int value) {
        return new OrchestratorConfig(debounceDelay, translationTimeout, value, workerThreads, retryPolicy);
    }

    public OrchestratorConfig withWorkerThreads(int value) {
        return new OrchestratorConfig(debounceDelay, translationTimeout, maxTextLength, value, retryPolicy);
    }

    public OrchestratorConfig withRetryPolicy(RetryPolicy value) {
        return new OrchestratorConfig(debounceDelay, translationTimeout, maxTextLength, workerThreads, value);
    }

    private static Duration millis(String raw) {
        return Duration.ofMillis(Long.parseLong(raw));
    }

    private static <T> T read(Map<String, String> env, String name, Function<String, T> parser, T fallback) {
        String raw = env.get(name);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return parser.apply(raw.trim());
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("Invalid value for " + name + ": '" + raw + "'", e);
        }
    }
}
