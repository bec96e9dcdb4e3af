package com.contract.resolution.lock;

/**
 * Configuration for contract write locks.
 *
 * @param timeoutMs maximum time a writer waits for the contract lock
 * @param fair      whether waiting writers are served in arrival order
 */
public record LockConfig(long timeoutMs, boolean fair) {

    public LockConfig {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be > 0");
        }
    }

    /**
     * Default configuration: 5s timeout, fair ordering.
     */
    public static LockConfig defaults() {
        return new LockConfig(5000, true);
    }
}
