////////////////////////////////////////////////////////////////////////////////
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
//
// Author: Tomasz Rup
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.pikels;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.pikels.util.MdcDocumentContext;

/**
 * Thread pools shared by the language server.
 *
 * <ul>
 *   <li><b>Scheduling pool</b> runs the per-document debounce timers. The
 *       timers only hand work over to the analysis pool.</li>
 *   <li><b>Analysis pool</b> runs the uninitialized-variable analysis and
 *       publishes its results. Each run builds its own scope tables, so
 *       documents are analyzed in parallel.</li>
 * </ul>
 *
 * <p>Both pools propagate the caller's MDC context. Create one instance in
 * {@link PikeLanguageServer} and call {@link #shutdownAll()} on shutdown.</p>
 */
public class ExecutorPools {

    private static final Logger logger = LoggerFactory.getLogger(ExecutorPools.class);

    private final ScheduledExecutorService schedulingPool;

    private final ExecutorService analysisPool;

    public ExecutorPools() {
        ScheduledExecutorService rawSchedulingPool = Executors.newScheduledThreadPool(1, r -> {
            Thread t = new Thread(r, "pikels-scheduler");
            t.setDaemon(true);
            return t;
        });
        this.schedulingPool = new MdcScheduledExecutorService(rawSchedulingPool);

        int analysisThreads = Math.max(1, Math.min(4, Runtime.getRuntime().availableProcessors()));
        ExecutorService rawAnalysisPool = Executors.newFixedThreadPool(analysisThreads, r -> {
            Thread t = new Thread(r, "pikels-analysis");
            t.setDaemon(true);
            return t;
        });
        this.analysisPool = new MdcExecutorService(rawAnalysisPool);
        logger.debug("Analysis threads: {}", analysisThreads);
    }

    /** Scheduled executor for debounce timers. */
    public ScheduledExecutorService getSchedulingPool() {
        return schedulingPool;
    }

    /** Pool the analysis and diagnostic publishing run on. */
    public ExecutorService getAnalysisPool() {
        return analysisPool;
    }

    /**
     * Shut down all pools, waiting up to 5 seconds for running tasks.
     */
    public void shutdownAll() {
        logger.debug("Shutting down executor pools");
        schedulingPool.shutdownNow();
        analysisPool.shutdownNow();
        try {
            schedulingPool.awaitTermination(5, TimeUnit.SECONDS);
            analysisPool.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    // -----------------------------------------------------------------------
    // MDC-propagating executor wrappers
    // -----------------------------------------------------------------------

    private static <T> Callable<T> wrapCallable(Callable<T> task) {
        Map<String, String> ctx = MdcDocumentContext.snapshot();
        return () -> {
            Map<String, String> prev = MdcDocumentContext.snapshot();
            MdcDocumentContext.restore(ctx);
            try {
                return task.call();
            } finally {
                MdcDocumentContext.restore(prev);
            }
        };
    }

    /**
     * Wraps an {@link ExecutorService} so that every submitted task
     * inherits the caller thread's SLF4J MDC context.
     */
    private static class MdcExecutorService implements ExecutorService {
        protected final ExecutorService delegate;

        MdcExecutorService(ExecutorService delegate) {
            this.delegate = delegate;
        }

        @Override public void execute(Runnable command) {
            delegate.execute(MdcDocumentContext.wrap(command));
        }

        @Override public Future<?> submit(Runnable task) {
            return delegate.submit(MdcDocumentContext.wrap(task));
        }

        @Override public <T> Future<T> submit(Runnable task, T result) {
            return delegate.submit(MdcDocumentContext.wrap(task), result);
        }

        @Override public <T> Future<T> submit(Callable<T> task) {
            return delegate.submit(wrapCallable(task));
        }

        @Override public <T> List<Future<T>> invokeAll(Collection<? extends Callable<T>> tasks)
                throws InterruptedException {
            return delegate.invokeAll(wrapCallables(tasks));
        }

        @Override public <T> List<Future<T>> invokeAll(Collection<? extends Callable<T>> tasks,
                long timeout, TimeUnit unit) throws InterruptedException {
            return delegate.invokeAll(wrapCallables(tasks), timeout, unit);
        }

        @Override public <T> T invokeAny(Collection<? extends Callable<T>> tasks)
                throws InterruptedException, ExecutionException {
            return delegate.invokeAny(wrapCallables(tasks));
        }

        @Override public <T> T invokeAny(Collection<? extends Callable<T>> tasks,
                long timeout, TimeUnit unit) throws InterruptedException, ExecutionException, TimeoutException {
            return delegate.invokeAny(wrapCallables(tasks), timeout, unit);
        }

        @Override public void shutdown() { delegate.shutdown(); }
        @Override public List<Runnable> shutdownNow() { return delegate.shutdownNow(); }
        @Override public boolean isShutdown() { return delegate.isShutdown(); }
        @Override public boolean isTerminated() { return delegate.isTerminated(); }
        @Override public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
            return delegate.awaitTermination(timeout, unit);
        }

        private static <T> Collection<Callable<T>> wrapCallables(Collection<? extends Callable<T>> tasks) {
            List<Callable<T>> wrapped = new ArrayList<>(tasks.size());
            for (Callable<T> task : tasks) {
                wrapped.add(wrapCallable(task));
            }
            return wrapped;
        }
    }

    private static class MdcScheduledExecutorService extends MdcExecutorService
            implements ScheduledExecutorService {
        private final ScheduledExecutorService scheduledDelegate;

        MdcScheduledExecutorService(ScheduledExecutorService delegate) {
            super(delegate);
            this.scheduledDelegate = delegate;
        }

        @Override
        public ScheduledFuture<?> schedule(Runnable command, long delay, TimeUnit unit) {
            return scheduledDelegate.schedule(MdcDocumentContext.wrap(command), delay, unit);
        }

        @Override
        public <V> ScheduledFuture<V> schedule(Callable<V> callable, long delay, TimeUnit unit) {
            return scheduledDelegate.schedule(wrapCallable(callable), delay, unit);
        }

        @Override
        public ScheduledFuture<?> scheduleAtFixedRate(Runnable command, long initialDelay,
                long period, TimeUnit unit) {
            return scheduledDelegate.scheduleAtFixedRate(
                    MdcDocumentContext.wrap(command), initialDelay, period, unit);
        }

        @Override
        public ScheduledFuture<?> scheduleWithFixedDelay(Runnable command, long initialDelay,
                long delay, TimeUnit unit) {
            return scheduledDelegate.scheduleWithFixedDelay(
                    MdcDocumentContext.wrap(command), initialDelay, delay, unit);
        }
    }
}
