package com.sandkev.ledgersync.fetch;

@FunctionalInterface
public interface Sleeper {

    void sleep(long millis);

    Sleeper THREAD = ms -> {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    };

    Sleeper NONE = ms -> {};
}
