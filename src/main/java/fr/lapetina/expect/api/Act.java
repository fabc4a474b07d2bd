package fr.lapetina.expect.api;

/**
 * Code under test which is expected to throw, or not to throw.
 */
@FunctionalInterface
public interface Act {

    void run() throws Throwable;
}
