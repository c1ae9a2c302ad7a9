/*
 * Copyright 2021 Netflix, Inc.
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

package com.netflix.placement.master.eviction;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import javax.annotation.PreDestroy;
import javax.inject.Inject;
import javax.inject.Singleton;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.math.LongMath;
import com.netflix.placement.api.scheduler.service.EvictionRequeueDriver;
import com.netflix.placement.api.scheduler.service.PlacementReevaluationHandler;
import com.netflix.placement.api.scheduler.service.SchedulerException;
import com.netflix.placement.common.runtime.PlacementRuntime;
import com.netflix.placement.master.MetricConstants;
import com.netflix.placement.master.scheduler.SchedulerConfiguration;
import com.netflix.spectator.api.Id;
import com.netflix.spectator.api.Registry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import static com.netflix.placement.common.util.DateTimeExt.toTimeUnitString;

/**
 * Keeps at most one pending re-evaluation timer per placement. A new request replaces the pending one only if it
 * is due earlier. Due times are computed from the timer scheduler clock, so the scheduler and the due time
 * bookkeeping always agree. The re-evaluation handler is called on the scheduler thread, outside of any lock.
 */
@Singleton
public class DefaultEvictionRequeueDriver implements EvictionRequeueDriver {

    private static final Logger logger = LoggerFactory.getLogger(DefaultEvictionRequeueDriver.class);

    private static final String METRIC_REQUEUE = MetricConstants.METRIC_EVICTION + "requeue";

    /**
     * Reactor timers are driven with nanosecond delays, so longer requests are shortened to this value.
     */
    @VisibleForTesting
    static final Duration MAX_TIMER_DELAY = Duration.ofNanos(Long.MAX_VALUE);

    private final PlacementReevaluationHandler reevaluationHandler;
    private final Scheduler scheduler;
    private final boolean ownsScheduler;

    private final ConcurrentMap<String, PendingRequeue> pendingRequeues = new ConcurrentHashMap<>();
    private final Object lock = new Object();
    private volatile boolean shutdown;

    private final Registry registry;
    private final Id requeueId;

    @Inject
    public DefaultEvictionRequeueDriver(SchedulerConfiguration configuration,
                                        PlacementReevaluationHandler reevaluationHandler,
                                        PlacementRuntime runtime) {
        this(reevaluationHandler, runtime, Schedulers.newSingle(configuration.getRequeueDriverSchedulerName()), true);
    }

    @VisibleForTesting
    DefaultEvictionRequeueDriver(PlacementReevaluationHandler reevaluationHandler,
                                 PlacementRuntime runtime,
                                 Scheduler scheduler,
                                 boolean ownsScheduler) {
        this.reevaluationHandler = reevaluationHandler;
        this.scheduler = scheduler;
        this.ownsScheduler = ownsScheduler;
        this.registry = runtime.getRegistry();
        this.requeueId = registry.createId(METRIC_REQUEUE);
    }

    @PreDestroy
    public void shutdown() {
        synchronized (lock) {
            shutdown = true;
            pendingRequeues.values().forEach(PendingRequeue::dispose);
            pendingRequeues.clear();
        }
        if (ownsScheduler) {
            scheduler.dispose();
        }
    }

    @Override
    public void requeue(String placementId, Duration requestedDelay) {
        if (requestedDelay.isNegative()) {
            throw SchedulerException.invalidArgument("Negative requeue delay for placement %s: %s", placementId, requestedDelay);
        }
        Duration delay = requestedDelay.compareTo(MAX_TIMER_DELAY) > 0 ? MAX_TIMER_DELAY : requestedDelay;
        long dueTime = LongMath.saturatedAdd(scheduler.now(TimeUnit.MILLISECONDS), delay.toMillis());

        PendingRequeue next;
        synchronized (lock) {
            if (shutdown) {
                logger.warn("[{}] Requeue request ignored, as the driver is shut down", placementId);
                increment("ignored");
                return;
            }
            PendingRequeue current = pendingRequeues.get(placementId);
            if (current != null && current.getDueTime() <= dueTime) {
                logger.debug("[{}] Requeue in {} coalesced with an earlier pending one", placementId, toTimeUnitString(delay));
                increment("coalesced");
                return;
            }
            if (current != null) {
                current.dispose();
            }
            next = new PendingRequeue(dueTime);
            pendingRequeues.put(placementId, next);
        }

        logger.info("[{}] Placement re-evaluation scheduled in {}", placementId, toTimeUnitString(delay));
        increment("scheduled");
        // The timer may fire before this call returns, so the entry must already be registered.
        next.setDisposable(Mono.delay(delay, scheduler).subscribe(
                tick -> onDue(placementId, next),
                error -> onTimerError(placementId, next, error)
        ));
    }

    @Override
    public boolean cancel(String placementId) {
        PendingRequeue pending;
        synchronized (lock) {
            pending = pendingRequeues.remove(placementId);
        }
        if (pending == null) {
            return false;
        }
        pending.dispose();
        logger.info("[{}] Pending placement re-evaluation cancelled", placementId);
        increment("cancelled");
        return true;
    }

    @Override
    public Map<String, Long> getPendingRequeues() {
        Map<String, Long> result = new HashMap<>();
        pendingRequeues.forEach((placementId, pending) -> result.put(placementId, pending.getDueTime()));
        return result;
    }

    private void onDue(String placementId, PendingRequeue pending) {
        boolean removed;
        synchronized (lock) {
            removed = pendingRequeues.remove(placementId, pending);
        }
        if (!removed) {
            return;
        }

        increment("fired");
        try {
            reevaluationHandler.reevaluate(placementId);
        } catch (Exception e) {
            logger.warn("[{}] Placement re-evaluation failed", placementId, e);
            increment("failed");
        }
    }

    private void onTimerError(String placementId, PendingRequeue pending, Throwable error) {
        synchronized (lock) {
            pendingRequeues.remove(placementId, pending);
        }
        logger.warn("[{}] Placement re-evaluation timer failed", placementId, error);
        increment("failed");
    }

    private void increment(String action) {
        registry.counter(requeueId.withTag("action", action)).increment();
    }

    private static class PendingRequeue {

        private final long dueTime;
        private volatile Disposable disposable;
        private volatile boolean disposed;

        private PendingRequeue(long dueTime) {
            this.dueTime = dueTime;
        }

        private long getDueTime() {
            return dueTime;
        }

        private void setDisposable(Disposable disposable) {
            this.disposable = disposable;
            if (disposed) {
                disposable.dispose();
            }
        }

        private void dispose() {
            disposed = true;
            Disposable current = disposable;
            if (current != null) {
                current.dispose();
            }
        }
    }
}
