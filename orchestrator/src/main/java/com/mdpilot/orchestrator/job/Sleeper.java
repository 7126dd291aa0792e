package com.mdpilot.orchestrator.job;

import java.time.Duration;

/** Pause between retry attempts; replaced by a no-op in tests. */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
