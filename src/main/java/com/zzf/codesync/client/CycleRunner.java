package com.zzf.codesync.client;

/**
 * Runs one complete sync cycle for a project. Implementations never throw for sync failures;
 * they report them in the returned {@link CycleResult}.
 */
public interface CycleRunner {
    CycleResult runCycle(ProjectConfig project);
}
