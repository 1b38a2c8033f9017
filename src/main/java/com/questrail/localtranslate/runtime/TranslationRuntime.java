package com.questrail.localtranslate.runtime;

import com.questrail.localtranslate.api.LanguageDetector;
import com.questrail.localtranslate.api.TaskId;
import com.questrail.localtranslate.api.TranslationClient;
import com.questrail.localtranslate.api.TranslationListener;
import com.questrail.localtranslate.api.TranslationRequest;
import com.questrail.localtranslate.api.Translator;
import com.questrail.localtranslate.config.OrchestratorConfig;
import com.questrail.localtranslate.internal.exec.TranslationOrchestrator;
import com.questrail.localtranslate.internal.exec.WorkerPool;
import com.questrail.localtranslate.internal.time.MonotonicClock;
import com.questrail.localtranslate.internal.time.MonotonicScheduler;
import com.questrail.localtranslate.internal.time.ScheduledExecutorScheduler;
import com.questrail.localtranslate.internal.time.SystemMonotonicClock;
import com.questrail.localtranslate.internal.time.SystemWallClock;
import com.questrail.localtranslate.observability.OrchestrationObservabilitySink;
import com.questrail.localtranslate.observability.Slf4jObservabilitySink;

import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * TranslationRuntime
 * =============================================================================
 * Composition root and lifecycle owner for the production orchestration stack:
 * system clocks, a timer thread, the worker pool and the orchestrator.
 *
 * <pre>
 *   TranslationRuntime runtime = TranslationRuntime.builder()
 *           .withTranslator(model::translate)
 *           .withLanguageDetector(detector)
 *           .withListener(ui)
 *           .build();
 *   runtime.start();
 *   runtime.submit(text, "auto", "ko", true);
 *   ...
 *   runtime.shutdown(5000);
 * </pre>
 */
public final class TranslationRuntime implements TranslationClient {

    private final TranslationOrchestrator orchestrator;
    private final WorkerPool pool;
    private final ScheduledExecutorService timerExecutor;

    private TranslationRuntime(TranslationOrchestrator orchestrator,
                               WorkerPool pool,
                               ScheduledExecutorService timerExecutor) {
        this.orchestrator = orchestrator;
        this.pool = pool;
        this.timerExecutor = timerExecutor;
    }

    public void start() {
        orchestrator.start();
    }

    @Override
    public TaskId submit(String text, String sourceLanguage, String targetLanguage, boolean debounce) {
        return orchestrator.submit(new TranslationRequest(text, sourceLanguage, targetLanguage), debounce);
    }

    @Override
    public boolean cancel(TaskId taskId) {
        return orchestrator.cancel(taskId);
    }

    @Override
    public void cancelAll() {
        orchestrator.cancelAll();
    }

    /**
     * Shuts down the orchestrator, then releases the pool and timer threads.
     * Workers still inside a blocking call keep running on their daemon
     * threads until that call returns.
     */
    @Override
    public boolean shutdown(long waitMs) {
        boolean idle = orchestrator.shutdown(waitMs);
        pool.shutdown();
        timerExecutor.shutdownNow();
        return idle;
    }

    public TranslationOrchestrator orchestrator() {
        return orchestrator;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Translator translator;
        private LanguageDetector languageDetector = LanguageDetector.NONE;
        private OrchestratorConfig config = OrchestratorConfig.defaults();
        private TranslationListener listener = TranslationListener.NONE;
        private OrchestrationObservabilitySink observabilitySink = new Slf4jObservabilitySink();

        public Builder withTranslator(Translator translator) {
            this.translator = translator;
            return this;
        }

        public Builder withLanguageDetector(LanguageDetector detector) {
            this.languageDetector = detector;
            return this;
        }

        public Builder withConfig(OrchestratorConfig config) {
            this.config = config;
            return this;
        }

        public Builder withListener(TranslationListener listener) {
            this.listener = listener;
            return this;
        }

        public Builder withObservabilitySink(OrchestrationObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public TranslationRuntime build() {
            Objects.requireNonNull(translator, "translator");
            Objects.requireNonNull(config, "config");

            MonotonicClock clock = SystemMonotonicClock.INSTANCE;
            ScheduledExecutorService timerExec = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "translate-timer");
                t.setDaemon(true);
                return t;
            });
            MonotonicScheduler scheduler = new ScheduledExecutorScheduler(timerExec, clock);
            WorkerPool pool = WorkerPool.create(config.workerThreads(), clock);

            TranslationOrchestrator orchestrator = new TranslationOrchestrator(
                    translator,
                    languageDetector,
                    pool,
                    clock,
                    scheduler,
                    SystemWallClock.INSTANCE,
                    config,
                    listener,
                    observabilitySink);

            return new TranslationRuntime(orchestrator, pool, timerExec);
        }
    }
}
