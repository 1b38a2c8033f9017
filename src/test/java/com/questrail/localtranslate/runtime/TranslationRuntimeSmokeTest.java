package com.questrail.localtranslate.runtime;

import com.questrail.localtranslate.api.RecordingListener;
import com.questrail.localtranslate.api.ScriptedTranslator;
import com.questrail.localtranslate.api.TaskId;
import com.questrail.localtranslate.config.OrchestratorConfig;
import com.questrail.localtranslate.config.RetryPolicy;
import com.questrail.localtranslate.error.ErrorKind;
import com.questrail.localtranslate.observability.RecordingObservabilitySink;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * TranslationRuntimeSmokeTest
 * -----------------------------------------------------------------------------
 * End-to-end runs of the production wiring: real event loop, worker threads
 * and timer thread. Timing values are shortened; waits are generous.
 */
class TranslationRuntimeSmokeTest {

    private static final long WAIT_MS = 5000;

    private final ScriptedTranslator translator = new ScriptedTranslator();
    private final RecordingListener listener = new RecordingListener();
    private final CountDownLatch release = new CountDownLatch(1);
    private TranslationRuntime runtime;

    private static OrchestratorConfig fastConfig() {
        return OrchestratorConfig.defaults()
                .withDebounceDelay(Duration.ofMillis(50))
                .withWorkerThreads(2)
                .withRetryPolicy(RetryPolicy.defaults()
                        .withDelays(Duration.ofMillis(10), Duration.ofMillis(40), 2.0));
    }

    private TranslationRuntime start(OrchestratorConfig config) {
        runtime = TranslationRuntime.builder()
                .withTranslator(translator)
                .withLanguageDetector(text -> Optional.of("en"))
                .withConfig(config)
                .withListener(listener)
                .build();
        runtime.start();
        return runtime;
    }

    private ScriptedTranslator.Step blockUntilReleased(String translation) {
        return (text, source, target, progress) -> {
            release.await(WAIT_MS, TimeUnit.MILLISECONDS);
            return translation;
        };
    }

    @AfterEach
    void tearDown() {
        release.countDown();
        if (runtime != null) {
            runtime.shutdown(WAIT_MS);
        }
    }

    @Test
    void translatesOnWorkerThread() throws InterruptedException {
        start(fastConfig());

        TaskId id = runtime.submit("Hello", "auto", "ko", false);

        assertTrue(listener.await(id, "finished", WAIT_MS));
        assertEquals(List.of("started", "progress", "progress", "complete", "finished"), listener.typesFor(id));
        assertEquals(new RecordingListener.Complete("en", "[ko] Hello"), listener.completions().get(0));
        assertTrue(runtime.shutdown(WAIT_MS));
    }

    @Test
    void debouncedBurstIsTranslatedOnce() throws InterruptedException {
        start(fastConfig().withDebounceDelay(Duration.ofMillis(200)));

        runtime.submit("H", "en", "ko", true);
        runtime.submit("He", "en", "ko", true);
        TaskId last = runtime.submit("Hello", "en", "ko", true);

        assertTrue(listener.await(last, "finished", WAIT_MS));
        assertEquals(1, translator.callCount());
        assertEquals("Hello", translator.invocations().get(0).text());
    }

    @Test
    void transientFailureIsRetried() throws InterruptedException {
        translator.thenThrow(new IOException("Connection reset by peer"));
        start(fastConfig());

        TaskId id = runtime.submit("Hello", "en", "ko", false);

        assertTrue(listener.await(id, "finished", WAIT_MS));
        assertEquals(List.of(new RecordingListener.Retry(1, 4, 10)), listener.retries());
        assertEquals(1, listener.count("complete"));
        assertEquals(0, listener.count("error"));
    }

    @Test
    void hungAttemptTimesOut() throws InterruptedException {
        translator.always(blockUntilReleased("late"));
        start(fastConfig()
                .withTranslationTimeout(Duration.ofMillis(100))
                .withRetryPolicy(RetryPolicy.none()));

        TaskId id = runtime.submit("Hello", "en", "ko", false);

        assertTrue(listener.await(id, "finished", WAIT_MS));
        assertEquals(ErrorKind.TIMEOUT, listener.errors().get(0).kind());
        assertTrue(listener.completions().isEmpty());

        release.countDown();
        assertTrue(runtime.shutdown(WAIT_MS));
        assertTrue(listener.completions().isEmpty(), "late result of a timed-out attempt is discarded");
    }

    @Test
    void cancelledTaskFinishesOnceWorkerReturns() throws InterruptedException {
        translator.always(blockUntilReleased("never delivered"));
        start(fastConfig());

        TaskId id = runtime.submit("Hello", "en", "ko", false);
        assertTrue(listener.await(id, "started", WAIT_MS));

        assertTrue(runtime.cancel(id));
        assertFalse(listener.typesFor(id).contains("finished"), "worker is still inside the blocking call");

        release.countDown();
        assertTrue(listener.await(id, "finished", WAIT_MS));
        assertTrue(listener.completions().isEmpty());
        assertTrue(listener.errors().isEmpty());
    }

    @Test
    void newerSubmissionSupersedesRunningOne() throws InterruptedException {
        translator.then(blockUntilReleased("stale"));
        start(fastConfig());

        TaskId older = runtime.submit("first", "en", "ko", false);
        assertTrue(listener.await(older, "started", WAIT_MS));
        TaskId newer = runtime.submit("second", "en", "ko", false);

        assertTrue(listener.await(newer, "finished", WAIT_MS));
        release.countDown();
        assertTrue(listener.await(older, "finished", WAIT_MS));

        assertEquals(List.of(new RecordingListener.Complete("en", "[ko] second")), listener.completions());
    }

    @Test
    void shutdownReportsWorkerStillBusy() throws InterruptedException {
        translator.always(blockUntilReleased("late"));
        start(fastConfig());

        TaskId id = runtime.submit("Hello", "en", "ko", false);
        assertTrue(listener.await(id, "started", WAIT_MS));

        assertFalse(runtime.shutdown(100));
        runtime = null;
    }

    @Test
    void transitionsReachTheConfiguredSink() throws InterruptedException {
        RecordingObservabilitySink sink = new RecordingObservabilitySink();
        runtime = TranslationRuntime.builder()
                .withTranslator(translator)
                .withConfig(fastConfig())
                .withListener(listener)
                .withObservabilitySink(sink)
                .build();
        runtime.start();

        TaskId id = runtime.submit("Hello", "en", "ko", false);

        assertTrue(listener.await(id, "finished", WAIT_MS));
        assertFalse(sink.statesOf(id).isEmpty());
    }

    @Test
    void builderRequiresTranslator() {
        assertThrows(NullPointerException.class, () -> TranslationRuntime.builder().build());
    }
}
