package com.questrail.localtranslate.internal.exec;

import com.questrail.localtranslate.api.Language;
import com.questrail.localtranslate.api.LanguageDetector;
import com.questrail.localtranslate.api.TranslationRequest;
import com.questrail.localtranslate.api.TranslationResult;
import com.questrail.localtranslate.api.Translator;
import com.questrail.localtranslate.error.ErrorClassifier;
import com.questrail.localtranslate.internal.events.OrchestratorEvent;
import com.questrail.localtranslate.internal.events.WorkerEvent;
import com.questrail.localtranslate.internal.time.MonotonicClock;
import com.questrail.localtranslate.internal.time.WallClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * TranslationWorker
 * =============================================================================
 * Executes one attempt of a task on a worker-pool thread.
 *
 * <h2>Lifecycle</h2>
 * Posts {@link WorkerEvent}s in strict order:
 * <pre>
 *   Started → Progress* → (Succeeded | Failed) → Finished
 * </pre>
 *
 * <h2>Cooperative cancellation</h2>
 * The handle's flag is checked at two fixed points:
 * <ul>
 *   <li>before starting: a cancelled worker posts only {@code Finished};</li>
 *   <li>after the blocking call returns (or throws): the outcome is dropped and
 *       only {@code Finished} follows.</li>
 * </ul>
 * The blocking {@link Translator#translate} call itself is never interrupted.
 * Progress reports are suppressed once the flag is set.
 *
 * <h2>Failures</h2>
 * Anything the call throws, {@link Error}s included, is posted as
 * {@code Failed} so the orchestrator can classify it. An
 * {@link InterruptedException} also restores the thread's interrupt flag.
 *
 * <p>A worker runs once and is then discarded; retries get a new worker.</p>
 */
public final class TranslationWorker implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(TranslationWorker.class);

    static final String DETECTING_MESSAGE = "Detecting language...";
    static final String TRANSLATING_MESSAGE = "Translating...";

    private final WorkerHandle handle;
    private final TranslationRequest request;
    private final Translator translator;
    private final LanguageDetector detector;
    private final Consumer<OrchestratorEvent> eventSink;
    private final MonotonicClock clock;
    private final WallClock wallClock;

    public TranslationWorker(WorkerHandle handle,
                             TranslationRequest request,
                             Translator translator,
                             LanguageDetector detector,
                             Consumer<OrchestratorEvent> eventSink,
                             MonotonicClock clock,
                             WallClock wallClock)
    {
        this.handle = Objects.requireNonNull(handle, "handle");
        this.request = Objects.requireNonNull(request, "request");
        this.translator = Objects.requireNonNull(translator, "translator");
        this.detector = Objects.requireNonNull(detector, "detector");
        this.eventSink = Objects.requireNonNull(eventSink, "eventSink");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    public WorkerHandle handle() {
        return handle;
    }

    @Override
    public void run() {
        if (handle.isCancelled()) {
            log.debug("Worker {} cancelled before start", handle);
            eventSink.accept(new WorkerEvent.Finished(wallClock.now(), handle));
            return;
        }

        try {
            eventSink.accept(new WorkerEvent.Started(wallClock.now(), handle));

            TranslationResult result = translate();

            if (handle.isCancelled()) {
                log.debug("Worker {} cancelled during translation; discarding result", handle);
                return;
            }
            eventSink.accept(new WorkerEvent.Succeeded(wallClock.now(), handle, result));

        } catch (Throwable e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            if (handle.isCancelled()) {
                log.debug("Worker {} cancelled; discarding failure: {}", handle, e.toString());
                return;
            }
            eventSink.accept(new WorkerEvent.Failed(
                    wallClock.now(), handle, e, ErrorClassifier.describe(e), stackTrace(e)));

        } finally {
            eventSink.accept(new WorkerEvent.Finished(wallClock.now(), handle));
        }
    }

    private TranslationResult translate() throws Exception {
        long startNanos = clock.nowNanos();

        String source = request.sourceLanguage();
        if (request.autoDetectSource()) {
            reportProgress(10, DETECTING_MESSAGE);
            source = detector.detect(request.text()).orElse(Language.DETECTION_FALLBACK.code());
            log.info("Detected source language: {}", source);
        }

        reportProgress(20, TRANSLATING_MESSAGE);

        String translated = translator.translate(
                request.text(), source, request.targetLanguage(), this::reportProgress);
        if (translated == null) {
            throw new IllegalStateException("Translator returned no text");
        }

        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(clock.nowNanos() - startNanos);
        log.info("Translation {} completed in {}ms: {} chars -> {} chars",
                handle, elapsedMs, request.text().length(), translated.length());

        return new TranslationResult(source, translated);
    }

    private void reportProgress(int percent, String message) {
        if (handle.isCancelled()) {
            return;
        }
        int clamped = Math.max(0, Math.min(100, percent));
        eventSink.accept(new WorkerEvent.Progress(wallClock.now(), handle, clamped, message == null ? "" : message));
    }

    private static String stackTrace(Throwable t) {
        StringWriter out = new StringWriter();
        t.printStackTrace(new PrintWriter(out));
        return out.toString();
    }
}
