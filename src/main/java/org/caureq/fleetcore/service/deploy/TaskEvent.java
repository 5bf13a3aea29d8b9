package org.caureq.fleetcore.service.deploy;

/**
 * Progress notification from a running task to {@link TaskProgressRecorder}. Executors never
 * write task records themselves; they emit these.
 */
public record TaskEvent(Long taskId, Type type, String step, Integer progress, String message,
                        String configKey, Object configValue) {

    public enum Type { STARTED, STEP_STARTED, STEP_COMPLETED, PROGRESS, LOG, CONFIG, COMPLETED, FAILED, CANCELLED }

    public static TaskEvent started(Long id, int totalSteps) {
        return new TaskEvent(id, Type.STARTED, null, totalSteps, null, null, null);
    }

    public static TaskEvent stepStarted(Long id, String step) {
        return new TaskEvent(id, Type.STEP_STARTED, step, null, null, null, null);
    }

    public static TaskEvent stepCompleted(Long id, String step, int progress) {
        return new TaskEvent(id, Type.STEP_COMPLETED, step, progress, null, null, null);
    }

    public static TaskEvent progress(Long id, int progress, String message) {
        return new TaskEvent(id, Type.PROGRESS, null, progress, message, null, null);
    }

    public static TaskEvent log(Long id, String line) {
        return new TaskEvent(id, Type.LOG, null, null, line, null, null);
    }

    public static TaskEvent config(Long id, String key, Object value) {
        return new TaskEvent(id, Type.CONFIG, null, null, null, key, value);
    }

    public static TaskEvent completed(Long id) {
        return new TaskEvent(id, Type.COMPLETED, null, 100, null, null, null);
    }

    public static TaskEvent failed(Long id, String step, String error) {
        return new TaskEvent(id, Type.FAILED, step, null, error, null, null);
    }

    public static TaskEvent cancelled(Long id) {
        return new TaskEvent(id, Type.CANCELLED, null, null, null, null, null);
    }
}
