package com.stayharvest.crawl.http;

/**
 * Raised when a provider request kept failing until the retry budget ran out, or the calling thread was
 * interrupted while waiting to retry.
 */
public class FetchExhaustedException extends RuntimeException {
    private final String label;
    private final int attempts;
    private final int lastStatus;
    private final String lastError;

    public FetchExhaustedException(String label, int attempts, int lastStatus, String lastError, Throwable cause) {
        super(label + " failed after " + attempts + " attempt(s); lastStatus=" + lastStatus + ", lastError=" + lastError, cause);
        this.label = label;
        this.attempts = attempts;
        this.lastStatus = lastStatus;
        this.lastError = lastError;
    }

    public String getLabel() {
        return label;
    }

    public int getAttempts() {
        return attempts;
    }

    public int getLastStatus() {
        return lastStatus;
    }

    public String getLastError() {
        return lastError;
    }
}
