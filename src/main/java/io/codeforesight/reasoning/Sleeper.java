package io.codeforesight.reasoning;

/**
 * Waits between retry attempts. Tests substitute a recording no-op.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
