package com.hedgebot.engine.execution;

/**
 * Blocking wait used by the verification loops. Interruption aborts the wait.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(long millis) throws InterruptedException;

    static Sleeper system() {
        return Thread::sleep;
    }
}
