package com.zzf.codesync.watch;

import com.zzf.codesync.client.CycleResult;
import com.zzf.codesync.client.CycleRunner;
import com.zzf.codesync.client.CycleStatus;
import com.zzf.codesync.client.ProjectConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ChangeWatcherTest {

    @TempDir
    Path tempDir;

    private ExecutorService worker;
    private ScheduledExecutorService scheduler;

    @BeforeEach
    void setUp() {
        worker = Executors.newFixedThreadPool(4);
        scheduler = Executors.newSingleThreadScheduledExecutor();
    }

    @AfterEach
    void tearDown() {
        worker.shutdownNow();
        scheduler.shutdownNow();
    }

    @Test
    void testTriggersDuringCycleCollapseIntoOneRerun() throws Exception {
        BlockingRunner runner = new BlockingRunner();
        ChangeWatcher watcher = new ChangeWatcher(config(false, 0, 0), runner, worker, scheduler, null);

        watcher.trigger("manual");
        assertTrue(runner.started.await(5, TimeUnit.SECONDS));
        for (int i = 0; i < 5; i++) {
            watcher.trigger("manual");
        }
        assertEquals(WatchState.RUNNING_PENDING, watcher.getState());

        runner.release.countDown();
        awaitIdle(watcher);

        assertEquals(2, runner.calls.get());
        assertEquals(1, runner.maxConcurrent.get());
        assertEquals(2, watcher.getCycleCount());
        assertEquals(CycleStatus.UP_TO_DATE, watcher.getLastResult().getStatus());
    }

    @Test
    void testFileEventBurstDebounced() throws Exception {
        BlockingRunner runner = new BlockingRunner();
        runner.release.countDown();
        ChangeWatcher watcher = new ChangeWatcher(config(false, 100, 0), runner, worker, scheduler, null);

        for (int i = 0; i < 10; i++) {
            watcher.onFileEvent();
        }
        assertTrue(runner.started.await(5, TimeUnit.SECONDS));
        awaitIdle(watcher);
        Thread.sleep(300);

        assertEquals(1, runner.calls.get());
    }

    @Test
    void testStopInterruptsRunningCycleAndDisarms() throws Exception {
        BlockingRunner runner = new BlockingRunner();
        ChangeWatcher watcher = new ChangeWatcher(config(false, 0, 0), runner, worker, scheduler, null);

        watcher.trigger("manual");
        assertTrue(runner.started.await(5, TimeUnit.SECONDS));
        watcher.stop();

        assertTrue(runner.interrupted.await(5, TimeUnit.SECONDS));
        assertTrue(watcher.isStopped());
        watcher.trigger("manual");
        watcher.onFileEvent();
        Thread.sleep(100);
        assertEquals(1, runner.calls.get());
    }

    @Test
    void testTimerTriggersPeriodically() throws Exception {
        BlockingRunner runner = new BlockingRunner();
        runner.release.countDown();
        ChangeWatcher watcher = new ChangeWatcher(config(false, 0, 50), runner, worker, scheduler, null);

        watcher.start();
        long deadline = System.currentTimeMillis() + 5000;
        while (runner.calls.get() < 3 && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }
        watcher.stop();

        assertTrue(runner.calls.get() >= 3);
    }

    @Test
    void testFileChangeStartsCycle() throws Exception {
        BlockingRunner runner = new BlockingRunner();
        runner.release.countDown();
        AtomicInteger results = new AtomicInteger();
        ChangeWatcher watcher = new ChangeWatcher(config(true, 50, 0), runner, worker, scheduler, r -> results.incrementAndGet());

        watcher.start();
        try {
            long deadline = System.currentTimeMillis() + 5000;
            while (results.get() < 1 && System.currentTimeMillis() < deadline) {
                Thread.sleep(20);
            }
            assertEquals(1, results.get());

            Files.createDirectories(tempDir.resolve("src"));
            Thread.sleep(200);
            Files.write(tempDir.resolve("src/App.java"), "class App {}".getBytes(StandardCharsets.UTF_8));

            deadline = System.currentTimeMillis() + 10_000;
            while (results.get() < 2 && System.currentTimeMillis() < deadline) {
                Thread.sleep(20);
            }
            assertTrue(results.get() >= 2);
        } finally {
            watcher.stop();
        }
    }

    private ProjectConfig config(boolean fileEvents, long debounceMs, long intervalMs) {
        return new ProjectConfig("/work/watched", tempDir, "watched", fileEvents, debounceMs, intervalMs);
    }

    private static void awaitIdle(ChangeWatcher watcher) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (watcher.getState() != WatchState.IDLE && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertEquals(WatchState.IDLE, watcher.getState());
    }

    private static final class BlockingRunner implements CycleRunner {
        private final CountDownLatch started = new CountDownLatch(1);
        private final CountDownLatch release = new CountDownLatch(1);
        private final CountDownLatch interrupted = new CountDownLatch(1);
        private final AtomicInteger calls = new AtomicInteger();
        private final AtomicInteger running = new AtomicInteger();
        private final AtomicInteger maxConcurrent = new AtomicInteger();

        @Override
        public CycleResult runCycle(ProjectConfig project) {
            calls.incrementAndGet();
            int now = running.incrementAndGet();
            maxConcurrent.accumulateAndGet(now, Math::max);
            started.countDown();
            try {
                release.await();
                return CycleResult.builder(project.getProjectId(), "t").build(CycleStatus.UP_TO_DATE, 0);
            } catch (InterruptedException e) {
                interrupted.countDown();
                Thread.currentThread().interrupt();
                return CycleResult.builder(project.getProjectId(), "t").build(CycleStatus.CANCELLED, 0);
            } finally {
                running.decrementAndGet();
            }
        }
    }
}
