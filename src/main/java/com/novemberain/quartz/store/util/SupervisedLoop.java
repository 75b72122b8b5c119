package com.novemberain.quartz.store.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;

/**
 * Background task repeating {@link #runCycle()} on its own daemon thread until
 * {@link #shutdown(long)} is called. A cycle that throws does not end the loop.
 */
public abstract class SupervisedLoop {

    private static final Logger log = LoggerFactory.getLogger(SupervisedLoop.class);

    private final String threadName;
    private final long retryIntervalMillis;
    private final Object sleepLock = new Object();
    private volatile boolean shutdown;
    private boolean wakeUpRequested;
    private ExecutorService executor;

    /**
     * @param threadName          name of the background thread
     * @param retryIntervalMillis pause after a cycle failed unexpectedly
     */
    protected SupervisedLoop(String threadName, long retryIntervalMillis) {
        this.threadName = threadName;
        this.retryIntervalMillis = retryIntervalMillis;
    }

    /**
     * Runs one cycle.
     *
     * @return millis to pause before the next cycle
     */
    protected abstract long runCycle();

    public synchronized void start(final long initialDelayMillis) {
        if (executor != null) {
            throw new IllegalStateException(threadName + " already started");
        }
        executor = Executors.newSingleThreadExecutor(new ThreadFactory() {
            @Override
            public Thread newThread(Runnable r) {
                Thread thread = new Thread(r, threadName);
                thread.setDaemon(true);
                return thread;
            }
        });
        log.info("Starting {}", threadName);
        executor.execute(() -> {
            pause(initialDelayMillis);
            loop();
        });
    }

    /**
     * Cuts the current pause short.
     */
    public void wakeUp() {
        synchronized (sleepLock) {
            wakeUpRequested = true;
            sleepLock.notifyAll();
        }
    }

    /**
     * Stops the loop and waits for the running cycle to finish.
     *
     * @param timeoutMillis maximum time to wait
     */
    public void shutdown(long timeoutMillis) {
        shutdown = true;
        wakeUp();
        ExecutorService current;
        synchronized (this) {
            current = executor;
        }
        if (current == null) {
            return;
        }
        current.shutdown();
        try {
            if (!current.awaitTermination(timeoutMillis, TimeUnit.MILLISECONDS)) {
                log.warn("{} did not stop within {} ms", threadName, timeoutMillis);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for {} to stop", threadName);
        }
    }

    public boolean isShutdown() {
        return shutdown;
    }

    public synchronized boolean isRunning() {
        return executor != null && !executor.isTerminated();
    }

    private void loop() {
        while (!shutdown) {
            long pauseMillis;
            try {
                pauseMillis = runCycle();
            } catch (RuntimeException e) {
                log.error(threadName + ": unexpected failure: " + e.getMessage(), e);
                pauseMillis = retryIntervalMillis;
            }
            if (!shutdown) {
                pause(pauseMillis);
            }
        }
        log.info("{} stopped", threadName);
    }

    private void pause(long millis) {
        synchronized (sleepLock) {
            long deadline = System.currentTimeMillis() + millis;
            long remaining = millis;
            while (!wakeUpRequested && !shutdown && remaining > 0) {
                try {
                    sleepLock.wait(remaining);
                } catch (InterruptedException e) {
                    log.info("{} interrupted, stopping", threadName);
                    shutdown = true;
                    return;
                }
                remaining = deadline - System.currentTimeMillis();
            }
            wakeUpRequested = false;
        }
    }
}
