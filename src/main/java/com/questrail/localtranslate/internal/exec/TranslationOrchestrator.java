package com.questrail.localtranslate.internal.exec;

import com.questrail.localtranslate.api.LanguageDetector;
import com.questrail.localtranslate.api.TaskId;
import com.questrail.localtranslate.api.TranslationListener;
import com.questrail.localtranslate.api.TranslationRequest;
import com.questrail.localtranslate.api.TranslationResult;
import com.questrail.localtranslate.api.Translator;
import com.questrail.localtranslate.config.OrchestratorConfig;
import com.questrail.localtranslate.config.RetryPolicy;
import com.questrail.localtranslate.error.ErrorClassifier;
import com.questrail.localtranslate.error.TranslationError;
import com.questrail.localtranslate.error.TranslationValidationException;
import com.questrail.localtranslate.internal.events.ControlEvent;
import com.questrail.localtranslate.internal.events.OrchestratorEvent;
import com.questrail.localtranslate.internal.events.SubmissionEvent;
import com.questrail.localtranslate.internal.events.TimerEvent;
import com.questrail.localtranslate.internal.events.WorkerEvent;
import com.questrail.localtranslate.internal.time.Cancellable;
import com.questrail.localtranslate.internal.time.MonotonicClock;
import com.questrail.localtranslate.internal.time.MonotonicScheduler;
import com.questrail.localtranslate.internal.time.WallClock;
import com.questrail.localtranslate.observability.NullObservabilitySink;
import com.questrail.localtranslate.observability.OrchestrationErrorEvent;
import com.questrail.localtranslate.observability.OrchestrationObservabilitySink;
import com.questrail.localtranslate.observability.TaskState;
import com.questrail.localtranslate.observability.TaskTransitionEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * TranslationOrchestrator
 * =============================================================================
 * Owns the lifecycle of translation tasks: debouncing, dispatch to the worker
 * pool, per-attempt timeouts, retry with backoff, and delivery of events to the
 * caller's {@link TranslationListener}.
 *
 * <h2>Threading Model</h2>
 * All orchestrator state (active-task table, retry states, timers, debouncer)
 * is owned by a single coordinating thread. Public operations, worker reports
 * and timer expiries are turned into {@link OrchestratorEvent}s, queued, and
 * processed one at a time. Workers and timers never touch state directly.
 * <p>
 * The coordinating thread is either the dedicated loop started by
 * {@link #start()}, or, when the loop is not running, whichever thread calls
 * {@link #drainEvents()} (used by tests to drive the orchestrator
 * deterministically).
 *
 * <h2>Task lifecycle</h2>
 * <pre>
 *   PENDING → RUNNING(n) → SUCCEEDED
 *                        → RETRYING → RUNNING(n+1)
 *                        → FAILED
 *   PENDING | RUNNING | RETRYING → CANCELLED
 * </pre>
 * Dispatching a task cancels every other task first ("most-recent-wins").
 *
 * <h2>Stale events</h2>
 * Worker reports carry the {@link WorkerHandle} of their attempt. A report is
 * acted on only if that handle is still the task's active attempt; reports of
 * cancelled, timed-out or superseded attempts are dropped.
 *
 * <h2>Cancelled attempts</h2>
 * A cancelled attempt whose blocking call is in flight is left to run to
 * completion on its pool thread and its outcome is discarded. The task's
 * {@code onFinished} is delivered only once that worker has returned.
 */
public final class TranslationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(TranslationOrchestrator.class);

    static final String NO_OUTCOME_MESSAGE = "Worker ended without reporting a result";

    private final Translator translator;
    private final LanguageDetector detector;
    private final WorkerPool pool;
    private final MonotonicClock clock;
    private final MonotonicScheduler scheduler;
    private final WallClock wallClock;
    private final OrchestratorConfig config;
    private final TranslationListener listener;
    private final OrchestrationObservabilitySink observabilitySink;
    private final Debouncer debouncer;

    private final BlockingQueue<OrchestratorEvent> eventQueue = new LinkedBlockingQueue<>();
    private final AtomicBoolean running = new AtomicBoolean(false);

    private volatile Thread eventLoopThread;
    private volatile Thread coordinatorThread;

    // Coordinating-thread state.
    private final Map<TaskId, WorkerHandle> activeTasks = new LinkedHashMap<>();
    private final Map<TaskId, RetryState> retryStates = new HashMap<>();
    private final Map<TaskId, Cancellable> timeoutTimers = new HashMap<>();
    private final Map<TaskId, Cancellable> retryTimers = new HashMap<>();
    private final Set<WorkerHandle> cancelledInFlight = new HashSet<>();

    public TranslationOrchestrator(Translator translator,
                                   LanguageDetector detector,
                                   WorkerPool pool,
                                   MonotonicClock clock,
                                   MonotonicScheduler scheduler,
                                   WallClock wallClock,
                                   OrchestratorConfig config,
                                   TranslationListener listener,
                                   OrchestrationObservabilitySink observabilitySink)
    {
        this.translator = Objects.requireNonNull(translator, "translator");
        this.detector = Objects.requireNonNullElse(detector, LanguageDetector.NONE);
        this.pool = Objects.requireNonNull(pool, "pool");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.config = Objects.requireNonNull(config, "config");
        this.listener = Objects.requireNonNullElse(listener, TranslationListener.NONE);
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
        this.debouncer = new Debouncer(config.debounceDelay(), clock, scheduler, wallClock, this::post);
    }

    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------

    /**
     * Starts the coordinating thread.
     * Idempotent: calling start() multiple times has no effect after the first call.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            eventLoopThread = new Thread(this::runEventLoop, "translate-orchestrator");
            eventLoopThread.setDaemon(true);
            eventLoopThread.start();
            log.info("Translation orchestrator started ({}ms debounce, {} worker thread(s))",
                    config.debounceDelay().toMillis(), pool.capacity());
        }
    }

    /**
     * Stops the coordinating thread, then processes whatever is still queued
     * on the calling thread so no worker report is lost.
     */
    public void stop() {
        if (running.compareAndSet(true, false)) {
            Thread loop = eventLoopThread;
            if (loop != null && loop != Thread.currentThread()) {
                loop.interrupt();
                try {
                    loop.join(5000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
        }
        if (Thread.currentThread() != eventLoopThread) {
            drainEvents();
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    // ---------------------------------------------------------------------
    // Public operations
    // ---------------------------------------------------------------------

    /**
     * Submits a request. The id is generated on the calling thread; everything
     * else happens on the coordinating thread.
     */
    public TaskId submit(TranslationRequest request, boolean debounce) {
        Objects.requireNonNull(request, "request");
        TaskId taskId = TaskId.random();
        post(new SubmissionEvent.Submitted(wallClock.now(), taskId, request, debounce));
        return taskId;
    }

    /** Dispatches immediately, bypassing the debounce window. */
    public TaskId execute(TranslationRequest request) {
        return submit(request, false);
    }

    /**
     * Requests cooperative cancellation of a pending, running or retrying task.
     *
     * @return {@code false} if the task is not active
     */
    public boolean cancel(TaskId taskId) {
        Objects.requireNonNull(taskId, "taskId");
        return callOnCoordinator(() -> cancelTask(taskId));
    }

    /** Cancels every active task and pending submission. */
    public void cancelAll() {
        callOnCoordinator(() -> {
            cancelAllTasks();
            return null;
        });
    }

    /**
     * Cancels everything, waits up to {@code waitMs} for in-flight workers to
     * return, and stops the coordinating thread.
     *
     * @return {@code true} if every worker returned in time
     */
    public boolean shutdown(long waitMs) {
        log.info("Shutting down translation orchestrator...");
        cancelAll();

        boolean idle;
        try {
            idle = pool.awaitIdle(Duration.ofMillis(Math.max(0, waitMs)));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            idle = false;
        }
        stop();

        if (idle) {
            log.info("Translation orchestrator shutdown complete");
        } else {
            log.warn("{} worker(s) still running after {}ms; their results will be discarded",
                    pool.inFlight(), waitMs);
        }
        return idle;
    }

    public int activeTaskCount() {
        return callOnCoordinator(activeTasks::size);
    }

    public int retryStateCount() {
        return callOnCoordinator(retryStates::size);
    }

    public int timeoutTimerCount() {
        return callOnCoordinator(timeoutTimers::size);
    }

    public boolean hasPendingSubmission() {
        return callOnCoordinator(debouncer::hasPending);
    }

    public boolean isActive(TaskId taskId) {
        return callOnCoordinator(() -> activeTasks.containsKey(taskId) || retryStates.containsKey(taskId));
    }

    /**
     * Processes every queued event on the calling thread.
     * Only valid while the coordinating thread is not running.
     */
    public void drainEvents() {
        if (running.get()) {
            throw new IllegalStateException("drainEvents() requires the event loop to be stopped");
        }
        Thread previous = coordinatorThread;
        coordinatorThread = Thread.currentThread();
        try {
            OrchestratorEvent event;
            while ((event = eventQueue.poll()) != null) {
                processSafely(event);
            }
        } finally {
            coordinatorThread = previous;
        }
    }

    // ---------------------------------------------------------------------
    // Event loop
    // ---------------------------------------------------------------------

    private void post(OrchestratorEvent event) {
        eventQueue.offer(event);
    }

    private void runEventLoop() {
        coordinatorThread = Thread.currentThread();
        try {
            while (running.get()) {
                try {
                    OrchestratorEvent event = eventQueue.take();
                    processSafely(event);
                } catch (InterruptedException e) {
                    // Expected during shutdown; loop condition decides.
                }
            }
        } finally {
            coordinatorThread = null;
        }
    }

    /**
     * Runs {@code action} on the coordinating thread and returns its result.
     */
    private <T> T callOnCoordinator(Supplier<T> action) {
        if (Thread.currentThread() == coordinatorThread) {
            return action.get();
        }
        if (!running.get()) {
            synchronized (this) {
                drainEvents();
                Thread previous = coordinatorThread;
                coordinatorThread = Thread.currentThread();
                try {
                    return action.get();
                } finally {
                    coordinatorThread = previous;
                }
            }
        }

        CompletableFuture<T> reply = new CompletableFuture<>();
        post(new ControlEvent.Invoke(wallClock.now(), () -> {
            try {
                reply.complete(action.get());
            } catch (RuntimeException e) {
                reply.completeExceptionally(e);
            }
        }));

        while (true) {
            try {
                return reply.get(100, TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                if (!running.get()) {
                    // Loop stopped before reaching our command; run it here.
                    synchronized (this) {
                        drainEvents();
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while waiting for the orchestrator", e);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof RuntimeException re) {
                    throw re;
                }
                throw new IllegalStateException(cause);
            }
        }
    }

    private void processSafely(OrchestratorEvent event) {
        try {
            process(event);
        } catch (RuntimeException e) {
            log.error("Failed to process {}", event.getClass().getSimpleName(), e);
            observabilitySink.onError(new OrchestrationErrorEvent(
                    wallClock.now(), "Event processing error: " + event.getClass().getSimpleName(), e));
        }
    }

    private void process(OrchestratorEvent event) {
        // Dispatch is explicit on purpose; one handler per event type.
        if (event instanceof SubmissionEvent.Submitted e) {
            onSubmitted(e);
        } else if (event instanceof SubmissionEvent.DebounceElapsed e) {
            debouncer.takeIfCurrent(e.sequence())
                    .ifPresent(p -> dispatch(p.taskId(), p.request()));
        } else if (event instanceof WorkerEvent e) {
            onWorkerEvent(e);
        } else if (event instanceof TimerEvent.AttemptTimedOut e) {
            onAttemptTimedOut(e.handle());
        } else if (event instanceof TimerEvent.RetryDue e) {
            onRetryDue(e);
        } else if (event instanceof ControlEvent.Invoke e) {
            e.action().run();
        }
    }

    // ---------------------------------------------------------------------
    // Submission and dispatch
    // ---------------------------------------------------------------------

    private void onSubmitted(SubmissionEvent.Submitted e) {
        TaskId taskId = e.taskId();
        transition(taskId, null, TaskState.PENDING, 0, e.request().preview());

        if (e.debounce()) {
            debouncer.offer(taskId, e.request())
                    .ifPresent(replaced -> transition(replaced.taskId(), TaskState.PENDING,
                            TaskState.CANCELLED, 0, "replaced by " + taskId));
        } else {
            dispatch(taskId, e.request());
        }
    }

    private void dispatch(TaskId taskId, TranslationRequest request) {
        cancelAllTasks();

        try {
            RequestValidator.validate(request, config.maxTextLength());
        } catch (TranslationValidationException ex) {
            TranslationError error = ErrorClassifier.classify(ex);
            log.info("Task {} rejected: {}", taskId, ex.getMessage());
            transition(taskId, TaskState.PENDING, TaskState.FAILED, 0, error.kind().name());
            notifyListener("onError", l -> l.onError(taskId, error));
            notifyListener("onFinished", l -> l.onFinished(taskId));
            return;
        }

        RetryState state = new RetryState(taskId, request, config.retryPolicy().maxRetries() + 1);
        retryStates.put(taskId, state);
        startAttempt(state);
    }

    private void startAttempt(RetryState state) {
        TaskId taskId = state.taskId();
        int attempt = state.beginAttempt();
        WorkerHandle handle = new WorkerHandle(taskId, attempt);

        activeTasks.put(taskId, handle);
        TaskState previous = state.transitionTo(TaskState.RUNNING);
        transition(taskId, previous, TaskState.RUNNING, attempt, null);

        TranslationWorker worker = new TranslationWorker(
                handle, state.request(), translator, detector, this::post, clock, wallClock);

        timeoutTimers.put(taskId, scheduler.scheduleAfter(config.translationTimeout(), clock,
                () -> post(new TimerEvent.AttemptTimedOut(wallClock.now(), handle))));

        try {
            pool.submit(worker);
            log.info("Task {} attempt {}/{} submitted to worker pool", taskId, attempt, state.maxAttempts());
        } catch (RejectedExecutionException ex) {
            log.error("Worker pool rejected task {}", taskId, ex);
            handle.recordOutcome();
            activeTasks.remove(taskId);
            cancelTimer(timeoutTimers.remove(taskId));
            fail(state, ErrorClassifier.classify(ex));
        }
    }

    // ---------------------------------------------------------------------
    // Worker reports
    // ---------------------------------------------------------------------

    private void onWorkerEvent(WorkerEvent event) {
        WorkerHandle handle = event.handle();
        TaskId taskId = handle.taskId();
        boolean current = activeTasks.get(taskId) == handle;

        if (event instanceof WorkerEvent.Finished) {
            onWorkerFinished(handle, current);
            return;
        }
        if (!current || handle.isCancelled() || handle.outcomeRecorded()) {
            log.trace("Ignoring {} from stale attempt {}", event.getClass().getSimpleName(), handle);
            return;
        }

        if (event instanceof WorkerEvent.Started) {
            log.debug("Worker started: {}", handle);
            notifyListener("onStarted", l -> l.onStarted(taskId));
        } else if (event instanceof WorkerEvent.Progress p) {
            notifyListener("onProgress", l -> l.onProgress(taskId, p.percent(), p.message()));
        } else if (event instanceof WorkerEvent.Succeeded s) {
            onAttemptSucceeded(handle, s.result());
        } else if (event instanceof WorkerEvent.Failed f) {
            handle.recordOutcome();
            cancelTimer(timeoutTimers.remove(taskId));
            TranslationError error = ErrorClassifier.classify(f.exception(), f.message(), f.trace());
            log.error("Task {} attempt {} failed: {} ({})", taskId, handle.attempt(), f.message(), error.kind());
            log.debug("Traceback:\n{}", f.trace());
            onAttemptFailed(taskId, error);
        }
    }

    private void onAttemptSucceeded(WorkerHandle handle, TranslationResult result) {
        TaskId taskId = handle.taskId();
        handle.recordOutcome();
        cancelTimer(timeoutTimers.remove(taskId));

        RetryState state = retryStates.remove(taskId);
        TaskState previous = state != null ? state.transitionTo(TaskState.SUCCEEDED) : TaskState.RUNNING;
        transition(taskId, previous, TaskState.SUCCEEDED, handle.attempt(), "detected=" + result.detectedLanguage());

        notifyListener("onComplete", l -> l.onComplete(taskId, result.detectedLanguage(), result.text()));
    }

    private void onWorkerFinished(WorkerHandle handle, boolean current) {
        TaskId taskId = handle.taskId();
        if (current) {
            activeTasks.remove(taskId);
            cancelTimer(timeoutTimers.remove(taskId));
            if (!handle.outcomeRecorded()) {
                // Worker returned without reporting a result or a failure.
                handle.recordOutcome();
                log.error("Task {} attempt {} finished without an outcome", taskId, handle.attempt());
                onAttemptFailed(taskId, ErrorClassifier.classifyMessage(NO_OUTCOME_MESSAGE, null));
                return;
            }
            if (!retryStates.containsKey(taskId)) {
                log.debug("Worker finished: {}", handle);
                notifyListener("onFinished", l -> l.onFinished(taskId));
            }
        } else if (cancelledInFlight.remove(handle)) {
            log.debug("Cancelled worker finished: {}", handle);
            notifyListener("onFinished", l -> l.onFinished(taskId));
        }
    }

    // ---------------------------------------------------------------------
    // Timeout and retry
    // ---------------------------------------------------------------------

    private void onAttemptTimedOut(WorkerHandle handle) {
        TaskId taskId = handle.taskId();
        if (activeTasks.get(taskId) != handle || handle.outcomeRecorded()) {
            return;
        }
        log.warn("Task {} attempt {} exceeded {}ms; cancelling worker",
                taskId, handle.attempt(), config.translationTimeout().toMillis());

        handle.recordOutcome();
        handle.cancel();
        activeTasks.remove(taskId);
        timeoutTimers.remove(taskId);

        onAttemptFailed(taskId, ErrorClassifier.timeoutError());
    }

    /**
     * Retry decision for a failed attempt: retry with backoff while the budget
     * for the failure kind allows it, otherwise fail the task.
     */
    private void onAttemptFailed(TaskId taskId, TranslationError error) {
        RetryState state = retryStates.get(taskId);
        if (state == null) {
            return;
        }
        state.recordFailure(error);

        RetryPolicy policy = config.retryPolicy();
        int effectiveMaxRetries = policy.maxRetriesFor(error.kind());
        int attempt = state.attempt();

        if (!error.retryable() || attempt > effectiveMaxRetries) {
            fail(state, error);
            return;
        }

        int maxAttempts = effectiveMaxRetries + 1;
        long delayMs = policy.delayForAttempt(attempt).toMillis();
        state.limitAttempts(maxAttempts);

        TaskState previous = state.transitionTo(TaskState.RETRYING);
        transition(taskId, previous, TaskState.RETRYING, attempt, error.kind() + ", retry in " + delayMs + "ms");
        log.info("Retrying task {}: attempt {}/{} failed with {}, next attempt in {}ms",
                taskId, attempt, maxAttempts, error.kind(), delayMs);

        retryTimers.put(taskId, scheduler.scheduleAfter(Duration.ofMillis(delayMs), clock,
                () -> post(new TimerEvent.RetryDue(wallClock.now(), taskId, attempt))));

        notifyListener("onRetrying", l -> l.onRetrying(taskId, attempt, maxAttempts, delayMs));
    }

    private void onRetryDue(TimerEvent.RetryDue e) {
        TaskId taskId = e.taskId();
        RetryState state = retryStates.get(taskId);
        if (state == null || !retryTimers.containsKey(taskId) || state.attempt() != e.failedAttempt()) {
            return;
        }
        retryTimers.remove(taskId);
        startAttempt(state);
    }

    private void fail(RetryState state, TranslationError error) {
        TaskId taskId = state.taskId();
        retryStates.remove(taskId);

        TaskState previous = state.transitionTo(TaskState.FAILED);
        transition(taskId, previous, TaskState.FAILED, state.attempt(), error.kind().name());
        log.error("Task {} failed after {} attempt(s): {} - {}",
                taskId, state.attempt(), error.kind(), error.message());

        notifyListener("onError", l -> l.onError(taskId, error));
        if (!activeTasks.containsKey(taskId)) {
            notifyListener("onFinished", l -> l.onFinished(taskId));
        }
    }

    // ---------------------------------------------------------------------
    // Cancellation
    // ---------------------------------------------------------------------

    private boolean cancelTask(TaskId taskId) {
        if (debouncer.discard(taskId)) {
            transition(taskId, TaskState.PENDING, TaskState.CANCELLED, 0, "before dispatch");
            log.info("Pending task {} cancelled", taskId);
            return true;
        }

        WorkerHandle handle = activeTasks.remove(taskId);
        RetryState state = retryStates.remove(taskId);
        cancelTimer(timeoutTimers.remove(taskId));
        cancelTimer(retryTimers.remove(taskId));

        if (handle == null && state == null) {
            return false;
        }

        if (state != null) {
            TaskState previous = state.transitionTo(TaskState.CANCELLED);
            transition(taskId, previous, TaskState.CANCELLED, state.attempt(), null);
        }

        if (handle != null) {
            handle.cancel();
            cancelledInFlight.add(handle);
        } else {
            // Waiting for a retry or a timed-out attempt: no worker will report.
            notifyListener("onFinished", l -> l.onFinished(taskId));
        }
        log.info("Task {} cancelled", taskId);
        return true;
    }

    private void cancelAllTasks() {
        debouncer.clear().ifPresent(p ->
                transition(p.taskId(), TaskState.PENDING, TaskState.CANCELLED, 0, "superseded"));

        Set<TaskId> ids = new LinkedHashSet<>(activeTasks.keySet());
        ids.addAll(retryStates.keySet());
        if (!ids.isEmpty()) {
            log.info("Cancelling {} active task(s)", ids.size());
        }
        for (TaskId id : ids) {
            cancelTask(id);
        }
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    private static void cancelTimer(Cancellable timer) {
        if (timer != null) {
            timer.cancel();
        }
    }

    private void transition(TaskId taskId, TaskState from, TaskState to, int attempt, String detail) {
        observabilitySink.onTaskTransition(new TaskTransitionEvent(
                wallClock.now(), taskId, from, to, attempt, detail));
    }

    private void notifyListener(String callback, Consumer<TranslationListener> call) {
        try {
            call.accept(listener);
        } catch (RuntimeException e) {
            log.error("Listener {} threw", callback, e);
            observabilitySink.onError(new OrchestrationErrorEvent(
                    wallClock.now(), "Listener " + callback + " threw", e));
        }
    }
}
