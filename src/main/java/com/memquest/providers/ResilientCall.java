package com.memquest.providers;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class ResilientCall {

    private static final Logger log = LoggerFactory.getLogger(ResilientCall.class);

    private static final long RETRY_AFTER_CAP_MS = 30_000;
    private static final Pattern STATUS_CODE = Pattern.compile("\\b(\\d{3})\\b");
    private static final Pattern RETRY_AFTER = Pattern.compile(
            "(?i)retry[_-]after[:\\s]+([\\d.]+)");

    public static <T> T execute(String operation, Callable<T> action, RetryPolicy policy) {
        Exception last = null;

        for (int attempt = 0; attempt < policy.maxAttempts(); attempt++) {
            try {
                return action.call();
            } catch (Exception e) {
                last = e;
                if (isNonRetryable(e)) {
                    log.warn("{} failed with non-retryable error: {}", operation, e.getMessage());
                    break;
                }
                if (attempt + 1 < policy.maxAttempts()) {
                    long delay = policy.delayForAttempt(attempt);
                    long wait = isRateLimited(e)
                            ? Math.max(delay, parseRetryAfterMs(e))
                            : delay;
                    log.warn("{} attempt {} failed; retrying in {}ms", operation, attempt + 1, wait);
                    sleep(wait);
                }
            }
        }
        throw new RetriesExhaustedException(operation + ": all retries exhausted", last);
    }

    static boolean isNonRetryable(Exception e) {
        int code = extractStatusCode(e);
        return code >= 400 && code < 500 && code != 429 && code != 408;
    }

    static boolean isRateLimited(Exception e) {
        int code = extractStatusCode(e);
        if (code == 429) return true;
        String msg = e.getMessage();
        return msg != null && msg.contains("429")
                && (msg.contains("Too Many") || msg.contains("rate") || msg.contains("limit"));
    }

    static long parseRetryAfterMs(Exception e) {
        if (e.getMessage() == null) return 0;
        Matcher m = RETRY_AFTER.matcher(e.getMessage());
        if (m.find()) {
            try {
                double secs = Double.parseDouble(m.group(1));
                if (Double.isFinite(secs) && secs >= 0) {
                    return Math.min((long) (secs * 1000), RETRY_AFTER_CAP_MS);
                }
            } catch (NumberFormatException nfe) {
                log.debug("Unparseable retry-after value: {}", m.group(1));
            }
        }
        return 0;
    }

    private static int extractStatusCode(Exception e) {
        if (e.getMessage() == null) return 0;
        Matcher m = STATUS_CODE.matcher(e.getMessage());
        while (m.find()) {
            int code = Integer.parseInt(m.group(1));
            if (code >= 100 && code < 600) return code;
        }
        return 0;
    }

    private static void sleep(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new RetriesExhaustedException("Interrupted during retry", ie);
        }
    }

    public static class RetriesExhaustedException extends RuntimeException {
        public RetriesExhaustedException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
