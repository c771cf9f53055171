package com.campaignkeeper;

import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Serializes operations per key (normally an entity's storage path) so only one
 * runs at a time for that key, while unrelated keys proceed independently.
 * An entry exists only while some caller holds or waits for its key.
 */
public class FileLock implements AutoCloseable {

    private static final long DEFAULT_STALL_WARNING_MILLIS = 10_000L;

    private final Map<String, KeyGate> gates = new ConcurrentHashMap<>();
    private final long stallWarningMillis;
    private final AppLogger logger = AppLogger.get();

    public FileLock() {
        this(DEFAULT_STALL_WARNING_MILLIS);
    }

    public FileLock(long stallWarningMillis) {
        if (stallWarningMillis <= 0) {
            throw new IllegalArgumentException("Stall warning threshold must be positive");
        }
        this.stallWarningMillis = stallWarningMillis;
    }

    /**
     * Runs {@code operation} once no other operation holds {@code key}.
     * The operation's result is returned and its exception rethrown unchanged;
     * the key is released either way.
     */
    public <T> T withLock(String key, Callable<T> operation) throws Exception {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Lock key is required");
        }
        KeyGate gate = register(key);
        try {
            acquire(key, gate);
        } catch (InterruptedException e) {
            unregister(key);
            Thread.currentThread().interrupt();
            throw e;
        }
        try {
            return operation.call();
        } finally {
            gate.semaphore.release();
            unregister(key);
        }
    }

    /**
     * Diagnostic only: whether some caller currently holds or waits for {@code key}.
     * Never use this to decide whether to call {@link #withLock}.
     */
    public boolean isLocked(String key) {
        return key != null && gates.containsKey(key);
    }

    public int activeKeys() {
        return gates.size();
    }

    @Override
    public void close() {
        if (!gates.isEmpty()) {
            logger.warn("[FileLock] Shutting down with " + gates.size() + " key(s) still locked: " + gates.keySet());
        }
    }

    private KeyGate register(String key) {
        return gates.compute(key, (k, existing) -> {
            KeyGate gate = existing != null ? existing : new KeyGate();
            gate.participants++;
            return gate;
        });
    }

    private void unregister(String key) {
        gates.computeIfPresent(key, (k, gate) -> --gate.participants == 0 ? null : gate);
    }

    private void acquire(String key, KeyGate gate) throws InterruptedException {
        long started = System.currentTimeMillis();
        while (!gate.semaphore.tryAcquire(stallWarningMillis, TimeUnit.MILLISECONDS)) {
            long waited = System.currentTimeMillis() - started;
            logger.warn("[FileLock] Waiting " + waited + "ms for lock on " + key
                + "; the current holder has not finished");
        }
    }

    private static final class KeyGate {
        private final Semaphore semaphore = new Semaphore(1, true);
        // guarded by the map's compute on this gate's key
        private int participants;
    }
}
