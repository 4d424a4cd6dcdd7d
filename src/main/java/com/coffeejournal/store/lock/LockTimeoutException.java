package com.coffeejournal.store.lock;

import java.nio.file.Path;
import java.time.Duration;

/**
 * The exclusive lock on a collection file could not be obtained within its bound.
 * Never retried by the store; retry policy belongs to the caller.
 */
public class LockTimeoutException extends RuntimeException {

    private final Path lockFile;
    private final Duration timeout;

    public LockTimeoutException(Path lockFile, Duration timeout) {
        super("Timed out after " + timeout.toMillis() + " ms waiting for lock " + lockFile);
        this.lockFile = lockFile;
        this.timeout = timeout;
    }

    public Path getLockFile() {
        return lockFile;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
