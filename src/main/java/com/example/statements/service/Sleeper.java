package com.example.statements.service;

import java.time.Duration;

/**
 * Blocking pause used by the dispatch worker between polls, retries and items.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = duration -> {
        if (!duration.isNegative() && !duration.isZero()) {
            Thread.sleep(duration.toMillis());
        }
    };

    void sleep(Duration duration) throws InterruptedException;
}
