package com.coffeejournal.store.lock;

import lombok.extern.slf4j.Slf4j;
import org.springframework.util.DigestUtils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

import static java.nio.file.StandardOpenOption.CREATE;
import static java.nio.file.StandardOpenOption.WRITE;

/**
 * Exclusive, cross-process lock guarding one collection file.
 * <p>
 * - The lock file lives in a shared temp directory and is named after the collection file
 *   plus an MD5 of its canonical path, so tenants with equally named collections never collide.
 * - Lock files are never deleted; they are reused for the life of the process and beyond.
 * - The same lock is taken for reads and writes; there is no reader/writer split.
 * - Re-entrant for the owning thread, so a read nested in a read-modify-write cycle is safe.
 * </p>
 */
@Slf4j
public class CollectionLock {

    private static final long POLL_INTERVAL_MILLIS = 10;
    private static final String DEFAULT_LOCK_DIR_NAME = "coffeejournal_locks";

    /**
     * OS file locks are held on behalf of the whole JVM, so threads of this process
     * coordinate through one shared state per lock file before touching the OS lock.
     */
    private static final ConcurrentHashMap<Path, LockState> LOCAL_STATES = new ConcurrentHashMap<>();

    private final Path lockFile;
    private final LockState state;

    public CollectionLock(Path collectionFile, Path lockDir) {
        Path canonical = canonicalize(collectionFile);
        String hash = DigestUtils.md5DigestAsHex(canonical.toString().getBytes(StandardCharsets.UTF_8));
        this.lockFile = lockDir.toAbsolutePath().normalize()
                .resolve(collectionFile.getFileName().toString() + "_" + hash + ".lock");
        this.state = LOCAL_STATES.computeIfAbsent(lockFile, k -> new LockState());
    }

    /** @return {@code <java.io.tmpdir>/coffeejournal_locks} */
    public static Path defaultLockDir() {
        return Paths.get(System.getProperty("java.io.tmpdir"), DEFAULT_LOCK_DIR_NAME);
    }

    public Path getLockFile() {
        return lockFile;
    }

    public boolean isHeldByCurrentThread() {
        return state.mutex.isHeldByCurrentThread();
    }

    /**
     * Block until the lock is held or the timeout expires.
     * @return a handle that releases the lock when closed
     * @throws LockTimeoutException if the lock was not obtained in time
     */
    public Held acquire(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        try {
            if (!state.mutex.tryLock(timeout.toNanos(), TimeUnit.NANOSECONDS)) {
                throw new LockTimeoutException(lockFile, timeout);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockTimeoutException(lockFile, timeout);
        }
        if (state.mutex.getHoldCount() > 1) {
            return new Held();
        }
        try {
            lockFile(deadline, timeout);
        } catch (RuntimeException e) {
            state.mutex.unlock();
            throw e;
        }
        return new Held();
    }

    private void lockFile(long deadline, Duration timeout) {
        FileChannel channel = null;
        try {
            Files.createDirectories(lockFile.getParent());
            channel = FileChannel.open(lockFile, CREATE, WRITE);
            while (true) {
                FileLock fileLock = tryLock(channel);
                if (fileLock != null) {
                    state.channel = channel;
                    state.fileLock = fileLock;
                    return;
                }
                if (System.nanoTime() >= deadline) {
                    closeQuietly(channel);
                    throw new LockTimeoutException(lockFile, timeout);
                }
                Thread.sleep(POLL_INTERVAL_MILLIS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            closeQuietly(channel);
            throw new LockTimeoutException(lockFile, timeout);
        } catch (IOException e) {
            closeQuietly(channel);
            throw new UncheckedIOException("Failed to open lock file " + lockFile, e);
        }
    }

    private static FileLock tryLock(FileChannel channel) throws IOException {
        try {
            return channel.tryLock();
        } catch (OverlappingFileLockException e) {
            // Held elsewhere in this JVM through a different path spelling; treat as busy.
            return null;
        }
    }

    private void release() {
        if (state.mutex.getHoldCount() == 1) {
            try {
                if (state.fileLock != null) {
                    state.fileLock.release();
                }
            } catch (IOException e) {
                log.warn("Failed to release file lock {}: {}", lockFile, e.getMessage());
            } finally {
                closeQuietly(state.channel);
                state.fileLock = null;
                state.channel = null;
            }
        }
        state.mutex.unlock();
    }

    private void closeQuietly(FileChannel channel) {
        if (channel == null) {
            return;
        }
        try {
            channel.close();
        } catch (IOException e) {
            log.warn("Failed to close lock channel {}: {}", lockFile, e.getMessage());
        }
    }

    private static Path canonicalize(Path file) {
        Path absolute = file.toAbsolutePath().normalize();
        Path parent = absolute.getParent();
        if (parent != null && Files.isDirectory(parent)) {
            try {
                return parent.toRealPath().resolve(absolute.getFileName());
            } catch (IOException e) {
                log.debug("Could not resolve real path of {}, using normalized path", parent);
            }
        }
        return absolute;
    }

    /** Handle for one successful {@link #acquire}; closing it twice is harmless. */
    public final class Held implements AutoCloseable {
        private boolean closed;

        private Held() {
        }

        @Override
        public void close() {
            if (!closed) {
                closed = true;
                release();
            }
        }
    }

    private static final class LockState {
        private final ReentrantLock mutex = new ReentrantLock();
        /* guarded by mutex */
        private FileChannel channel;
        private FileLock fileLock;
    }
}
