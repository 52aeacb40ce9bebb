package com.ideia.contentgen.util;

/**
 * Blocking pause used for backoff and pacing. Tests substitute a recording implementation.
 */
@FunctionalInterface
public interface Sleeper {
    Sleeper SYSTEM = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
