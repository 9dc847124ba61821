package com.quantops.examples.simulated;

/**
 * Sleep used to make simulated work observable.
 */
final class Pause {

    private Pause() {
    }

    static void sleep(long millis) {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
