package io.cadence4j.core;

import io.cadence4j.retry.RetryOptions;

/**
 * Per-task execution options.
 *
 * <ul>
 *   <li>retry: wrap each run in the retry executor; null runs the work once</li>
 *   <li>rateLimitClass: key-class in the rate limiter registry gating each firing; null disables gating</li>
 *   <li>rateLimitKey: key within the class; null uses the task name</li>
 * </ul>
 */
public record TaskOptions(
        RetryOptions retry,
        String rateLimitClass,
        String rateLimitKey
) {

    public static TaskOptions defaults() {
        return new TaskOptions(null, null, null);
    }

    public static TaskOptions withRetry(RetryOptions retry) {
        return new TaskOptions(retry, null, null);
    }

    public TaskOptions rateLimited(String keyClass, String key) {
        return new TaskOptions(retry, keyClass, key);
    }

    public boolean isRateLimited() {
        return rateLimitClass != null && !rateLimitClass.isBlank();
    }
}
