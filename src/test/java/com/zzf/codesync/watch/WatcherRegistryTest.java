package com.zzf.codesync.watch;

import com.zzf.codesync.client.CycleResult;
import com.zzf.codesync.client.CycleRunner;
import com.zzf.codesync.client.CycleStatus;
import com.zzf.codesync.client.ProjectConfig;
import com.zzf.codesync.config.SyncProperties;
import com.zzf.codesync.model.SyncErrorCode;
import com.zzf.codesync.model.SyncException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class WatcherRegistryTest {

    @TempDir
    Path tempDir;

    @Test
    void testStartIsIdempotentPerProject() throws Exception {
        AtomicInteger cycles = new AtomicInteger();
        CycleRunner runner = project -> {
            cycles.incrementAndGet();
            return CycleResult.builder(project.getProjectId(), "t").build(CycleStatus.UP_TO_DATE, 0);
        };
        WatcherRegistry registry = new WatcherRegistry(new SyncProperties(), runner,
                Executors.newSingleThreadExecutor(), Executors.newSingleThreadScheduledExecutor());
        ProjectConfig config = new ProjectConfig("/work/a", tempDir, "a", false, 0, 0);

        WatchHandle first = registry.start(config);
        WatchHandle second = registry.start(config);

        assertSame(first, second);
        assertEquals(1, registry.handles().size());
        long deadline = System.currentTimeMillis() + 5000;
        while (cycles.get() < 1 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertEquals(1, cycles.get());

        registry.stop(first);
        assertFalse(first.isActive());
        assertTrue(registry.handles().isEmpty());
        registry.stopAll();
    }

    @Test
    void testUnwatchableRootFails() {
        CycleRunner runner = project -> CycleResult.builder(project.getProjectId(), "t").build(CycleStatus.UP_TO_DATE, 0);
        WatcherRegistry registry = new WatcherRegistry(new SyncProperties(), runner,
                Executors.newSingleThreadExecutor(), Executors.newSingleThreadScheduledExecutor());
        ProjectConfig config = new ProjectConfig("/work/b", tempDir.resolve("missing"), "b", true, 10, 0);

        SyncException e = assertThrows(SyncException.class, () -> registry.start(config));
        assertEquals(SyncErrorCode.ENUMERATION, e.getErrorCode());
        assertTrue(registry.handles().isEmpty());
        registry.stopAll();
    }

    @Test
    void testAutostartDisabledByDefault() {
        CycleRunner runner = project -> {
            throw new AssertionError("no cycle expected");
        };
        WatcherRegistry registry = new WatcherRegistry(new SyncProperties(), runner,
                Executors.newSingleThreadExecutor(), Executors.newSingleThreadScheduledExecutor());
        registry.afterPropertiesSet();
        assertTrue(registry.handles().isEmpty());
        registry.destroy();
    }
}
