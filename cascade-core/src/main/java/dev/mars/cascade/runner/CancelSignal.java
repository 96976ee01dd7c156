package dev.mars.cascade.runner;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Run-scoped, level-triggered cancellation flag shared by the engine and every runner.
 *
 * <p>Runners either poll {@link #isCancelled()}, block in {@link #await(Duration)}, or register
 * an {@link #onCancel(Runnable)} callback that interrupts their own blocking work (for example
 * destroying a child process). Once raised the signal never resets.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public class CancelSignal {

    private static final Logger logger = LoggerFactory.getLogger(CancelSignal.class);

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final Lock lock = new ReentrantLock();
    private final Condition cancelledCondition = lock.newCondition();
    private final List<Runnable> callbacks = new ArrayList<>();

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Raises the signal, wakes every waiter and runs the registered callbacks once.
     *
     * @return true if this call raised the signal, false if it was already raised
     */
    public boolean cancel() {
        List<Runnable> toRun;
        lock.lock();
        try {
            if (!cancelled.compareAndSet(false, true)) {
                return false;
            }
            cancelledCondition.signalAll();
            toRun = new ArrayList<>(callbacks);
            callbacks.clear();
        } finally {
            lock.unlock();
        }
        toRun.forEach(this::runCallback);
        return true;
    }

    /**
     * Handle for a callback registered with {@link #onCancel(Runnable)}. Closing it removes the
     * callback; a runner closes it once the work the callback would interrupt has finished.
     */
    public interface Registration extends AutoCloseable {

        @Override
        void close();
    }

    /**
     * Registers a callback to run on cancellation. Runs it immediately on the calling thread
     * when the signal is already raised.
     *
     * @return a handle that removes the callback again
     */
    public Registration onCancel(Runnable callback) {
        lock.lock();
        try {
            if (!cancelled.get()) {
                callbacks.add(callback);
                return () -> remove(callback);
            }
        } finally {
            lock.unlock();
        }
        runCallback(callback);
        return () -> {
        };
    }

    int getCallbackCount() {
        lock.lock();
        try {
            return callbacks.size();
        } finally {
            lock.unlock();
        }
    }

    private void remove(Runnable callback) {
        lock.lock();
        try {
            callbacks.remove(callback);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Blocks until the signal is raised or the timeout elapses.
     *
     * @return true if cancelled
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public boolean await(Duration timeout) throws InterruptedException {
        if (cancelled.get()) {
            return true;
        }
        lock.lock();
        try {
            long remainingNanos = timeout.toNanos();
            while (!cancelled.get() && remainingNanos > 0) {
                remainingNanos = cancelledCondition.awaitNanos(remainingNanos);
            }
            return cancelled.get();
        } finally {
            lock.unlock();
        }
    }

    private void runCallback(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            logger.warn("Cancel callback failed: {}", e.getMessage(), e);
        }
    }
}
