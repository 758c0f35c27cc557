package com.zzf.codesync.watch;

import com.zzf.codesync.client.CycleResult;
import com.zzf.codesync.client.CycleRunner;
import com.zzf.codesync.client.ProjectConfig;
import com.zzf.codesync.core.scan.IgnoreRules;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Per-project trigger state machine. A trigger while idle starts a cycle; triggers during a
 * cycle collapse into one pending rerun. At most one cycle per project is ever in flight.
 */
public final class ChangeWatcher {
    private static final Logger logger = LoggerFactory.getLogger(ChangeWatcher.class);

    private final ProjectConfig project;
    private final CycleRunner runner;
    private final ExecutorService worker;
    private final ScheduledExecutorService scheduler;
    private final Consumer<CycleResult> listener;

    private final Object lock = new Object();
    private WatchState state = WatchState.IDLE;
    private boolean stopped;
    private Future<?> inFlight;
    private ScheduledFuture<?> debounce;
    private ScheduledFuture<?> timer;
    private FileEventSource events;

    private volatile CycleResult lastResult;
    private final AtomicLong triggers = new AtomicLong();
    private final AtomicLong cycles = new AtomicLong();

    public ChangeWatcher(ProjectConfig project, CycleRunner runner, ExecutorService worker,
                         ScheduledExecutorService scheduler, Consumer<CycleResult> listener) {
        this.project = project;
        this.runner = runner;
        this.worker = worker;
        this.scheduler = scheduler;
        this.listener = listener;
    }

    /**
     * Arms the configured trigger sources and runs an initial cycle.
     */
    public void start() throws IOException {
        if (project.isFileEvents()) {
            events = new FileEventSource(project.getRoot(), IgnoreRules.load(project.getRoot()), this::onFileEvent);
            events.start();
        }
        synchronized (lock) {
            if (project.getIntervalMs() > 0) {
                timer = scheduler.scheduleWithFixedDelay(() -> trigger("timer"),
                        project.getIntervalMs(), project.getIntervalMs(), TimeUnit.MILLISECONDS);
            }
        }
        logger.info("watch.start projectId={} root={} fileEvents={} debounceMs={} intervalMs={}",
                project.getProjectId(), project.getRoot(), project.isFileEvents(), project.getDebounceMs(), project.getIntervalMs());
        trigger("start");
    }

    /**
     * Filesystem activity. Bursts closer together than the debounce window yield one trigger.
     */
    public void onFileEvent() {
        synchronized (lock) {
            if (stopped) {
                return;
            }
            if (debounce != null) {
                debounce.cancel(false);
            }
            if (project.getDebounceMs() <= 0) {
                debounce = null;
            } else {
                debounce = scheduler.schedule(() -> trigger("fs"), project.getDebounceMs(), TimeUnit.MILLISECONDS);
                return;
            }
        }
        trigger("fs");
    }

    public void trigger(String source) {
        synchronized (lock) {
            if (stopped) {
                return;
            }
            triggers.incrementAndGet();
            switch (state) {
                case IDLE:
                    state = WatchState.RUNNING;
                    submit(source);
                    break;
                case RUNNING:
                    state = WatchState.RUNNING_PENDING;
                    logger.debug("watch.pending projectId={} source={}", project.getProjectId(), source);
                    break;
                default:
                    break;
            }
        }
    }

    /**
     * Disarms all triggers and interrupts a running cycle, which then ends without committing.
     */
    public void stop() {
        synchronized (lock) {
            if (stopped) {
                return;
            }
            stopped = true;
            if (debounce != null) {
                debounce.cancel(false);
            }
            if (timer != null) {
                timer.cancel(false);
            }
            if (inFlight != null) {
                inFlight.cancel(true);
            }
        }
        if (events != null) {
            events.close();
        }
        logger.info("watch.stop projectId={} cycles={} triggers={}", project.getProjectId(), cycles.get(), triggers.get());
    }

    public WatchState getState() {
        synchronized (lock) {
            return state;
        }
    }

    public boolean isStopped() {
        synchronized (lock) {
            return stopped;
        }
    }

    public CycleResult getLastResult() {
        return lastResult;
    }

    public long getCycleCount() {
        return cycles.get();
    }

    public ProjectConfig getProject() {
        return project;
    }

    // caller holds lock
    private void submit(String source) {
        try {
            inFlight = worker.submit(this::runOnce);
            logger.debug("watch.cycle.submit projectId={} source={}", project.getProjectId(), source);
        } catch (RejectedExecutionException e) {
            state = WatchState.IDLE;
            logger.warn("watch.cycle.rejected projectId={} err={}", project.getProjectId(), e.toString());
        }
    }

    private void runOnce() {
        cycles.incrementAndGet();
        try {
            CycleResult result = runner.runCycle(project);
            lastResult = result;
            if (listener != null) {
                listener.accept(result);
            }
        } catch (RuntimeException e) {
            logger.error("watch.cycle.error projectId={} err={}", project.getProjectId(), e.toString(), e);
        } finally {
            synchronized (lock) {
                if (!stopped && state == WatchState.RUNNING_PENDING) {
                    state = WatchState.RUNNING;
                    submit("pending");
                } else {
                    state = WatchState.IDLE;
                    inFlight = null;
                }
            }
        }
    }
}
