package com.cipilot.orchestrator.service;

import java.time.Duration;

/**
 * Blocking pause between polls. Swapped for a no-op in tests.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;
}
