package com.launchbot.hft.launchpad.pipeline;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs per-mint work on a shared worker pool while keeping each mint's tasks in arrival order.
 *
 * <p>Each mint has at most one drain running at a time. When every worker is busy, work for a mint that is
 * already mid-decision is dropped with a logged skip; work for an idle mint is handed to the pool and queues
 * there within its bounded capacity.
 */
@Slf4j
public class MintLaneDispatcher {

    private final Executor workers;
    private final int workerThreads;
    private final int laneCapacity;

    private final Map<String, Deque<Runnable>> lanes = new HashMap<>();
    private final AtomicInteger busyWorkers = new AtomicInteger();

    private final Counter droppedCounter;

    public MintLaneDispatcher(Executor workers, int workerThreads, int laneCapacity, MeterRegistry meterRegistry) {
        this.workers = workers;
        this.workerThreads = workerThreads;
        this.laneCapacity = laneCapacity;
        this.droppedCounter = Counter.builder("launchbot.pipeline.dropped")
                .description("Events dropped because the worker pool or a mint lane was saturated")
                .register(meterRegistry);
        Gauge.builder("launchbot.pipeline.lanes", this, MintLaneDispatcher::activeLanes)
                .description("Mints with queued or running work")
                .register(meterRegistry);
    }

    /**
     * @return false when the task was dropped
     */
    public boolean dispatch(String mintId, Runnable task) {
        synchronized (lanes) {
            Deque<Runnable> lane = lanes.get(mintId);
            if (lane != null) {
                if (busyWorkers.get() >= workerThreads) {
                    drop(mintId, "worker pool saturated while mint is mid-decision");
                    return false;
                }
                if (lane.size() >= laneCapacity) {
                    drop(mintId, "lane full (" + laneCapacity + ")");
                    return false;
                }
                lane.addLast(task);
                return true;
            }
            lane = new ArrayDeque<>();
            lane.addLast(task);
            lanes.put(mintId, lane);
        }
        try {
            workers.execute(() -> drain(mintId));
            return true;
        } catch (RejectedExecutionException e) {
            synchronized (lanes) {
                lanes.remove(mintId);
            }
            drop(mintId, "worker queue full");
            return false;
        }
    }

    public int activeLanes() {
        synchronized (lanes) {
            return lanes.size();
        }
    }

    private void drain(String mintId) {
        busyWorkers.incrementAndGet();
        try {
            while (true) {
                Runnable next;
                synchronized (lanes) {
                    Deque<Runnable> lane = lanes.get(mintId);
                    next = lane == null ? null : lane.pollFirst();
                    if (next == null) {
                        lanes.remove(mintId);
                        return;
                    }
                }
                try {
                    next.run();
                } catch (RuntimeException e) {
                    log.error("task for mint {} failed", mintId, e);
                }
            }
        } finally {
            busyWorkers.decrementAndGet();
        }
    }

    private void drop(String mintId, String why) {
        droppedCounter.increment();
        log.warn("skipping event for mint {}: {}", mintId, why);
    }
}
