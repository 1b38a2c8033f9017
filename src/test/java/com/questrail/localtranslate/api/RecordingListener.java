package com.questrail.localtranslate.api;

import com.questrail.localtranslate.error.TranslationError;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * RecordingListener
 * -----------------------------------------------------------------------------
 * Listener that records every callback for assertions. Thread-safe so it can
 * also be used with the real runtime.
 */
public final class RecordingListener implements TranslationListener {

    public record Call(String type, TaskId taskId, Object payload) {}

    public record Retry(int attempt, int maxAttempts, long delayMs) {}

    public record Progress(int percent, String message) {}

    public record Complete(String detectedLanguage, String text) {}

    private final List<Call> calls = new ArrayList<>();

    @Override
    public synchronized void onStarted(TaskId taskId) {
        append(new Call("started", taskId, null));
    }

    @Override
    public synchronized void onProgress(TaskId taskId, int percent, String message) {
        append(new Call("progress", taskId, new Progress(percent, message)));
    }

    @Override
    public synchronized void onComplete(TaskId taskId, String detectedLanguage, String translatedText) {
        append(new Call("complete", taskId, new Complete(detectedLanguage, translatedText)));
    }

    @Override
    public synchronized void onError(TaskId taskId, TranslationError error) {
        append(new Call("error", taskId, error));
    }

    @Override
    public synchronized void onRetrying(TaskId taskId, int attempt, int maxAttempts, long delayMs) {
        append(new Call("retrying", taskId, new Retry(attempt, maxAttempts, delayMs)));
    }

    @Override
    public synchronized void onFinished(TaskId taskId) {
        append(new Call("finished", taskId, null));
    }

    /**
     * Waits until a callback of {@code type} has been delivered for the task.
     *
     * @return {@code false} if the timeout elapsed first
     */
    public synchronized boolean await(TaskId taskId, String type, long timeoutMs) throws InterruptedException {
        long deadline = System.currentTimeMillis() + timeoutMs;
        while (!typesFor(taskId).contains(type)) {
            long remaining = deadline - System.currentTimeMillis();
            if (remaining <= 0) {
                return false;
            }
            wait(remaining);
        }
        return true;
    }

    public synchronized List<Call> calls() {
        return new ArrayList<>(calls);
    }

    /** Callback types delivered for one task, in order. */
    public synchronized List<String> typesFor(TaskId taskId) {
        return calls.stream()
                .filter(c -> c.taskId().equals(taskId))
                .map(Call::type)
                .collect(Collectors.toList());
    }

    public synchronized long count(String type) {
        return calls.stream().filter(c -> c.type().equals(type)).count();
    }

    public synchronized List<TranslationError> errors() {
        return payloads("error", TranslationError.class);
    }

    public synchronized List<Retry> retries() {
        return payloads("retrying", Retry.class);
    }

    public synchronized List<Progress> progress() {
        return payloads("progress", Progress.class);
    }

    public synchronized List<Complete> completions() {
        return payloads("complete", Complete.class);
    }

    private void append(Call call) {
        calls.add(call);
        notifyAll();
    }

    private <T> List<T> payloads(String type, Class<T> payloadType) {
        return calls.stream()
                .filter(c -> c.type().equals(type))
                .map(c -> payloadType.cast(c.payload()))
                .collect(Collectors.toList());
    }
}
