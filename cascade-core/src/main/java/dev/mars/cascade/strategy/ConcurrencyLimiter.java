package dev.mars.cascade.strategy;

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

import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Counting bound on the number of actions running at once. A permit is taken before
 * dispatch and returned when the action's runner completes.
 */
public class ConcurrencyLimiter {

    private final int limit;
    private final Semaphore permits;
    private final AtomicInteger inUse = new AtomicInteger();

    private ConcurrencyLimiter(int limit) {
        this.limit = limit;
        this.permits = limit > 0 ? new Semaphore(limit) : null;
    }

    /**
     * @param limit maximum concurrent actions; zero or negative means unbounded
     */
    public static ConcurrencyLimiter of(int limit) {
        return new ConcurrencyLimiter(Math.max(limit, 0));
    }

    public static ConcurrencyLimiter unbounded() {
        return new ConcurrencyLimiter(0);
    }

    public boolean tryAcquire() {
        if (permits != null && !permits.tryAcquire()) {
            return false;
        }
        inUse.incrementAndGet();
        return true;
    }

    public void release() {
        if (inUse.getAndUpdate(current -> current > 0 ? current - 1 : 0) == 0) {
            throw new IllegalStateException("Concurrency permit released without being acquired");
        }
        if (permits != null) {
            permits.release();
        }
    }

    public boolean isBounded() {
        return permits != null;
    }

    /**
     * The configured bound, zero when unbounded.
     */
    public int getLimit() {
        return limit;
    }

    public int getInUse() {
        return inUse.get();
    }

    @Override
    public String toString() {
        return "ConcurrencyLimiter{limit=" + (isBounded() ? limit : "unbounded") + ", inUse=" + inUse.get() + '}';
    }
}
