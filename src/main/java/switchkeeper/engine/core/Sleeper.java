package switchkeeper.engine.core;

import java.time.Duration;

/**
 * Blocking wait used at every suspension point (hold, poll, delay, stagger).
 * Only the calling thread is suspended.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> {
        if (!duration.isNegative() && !duration.isZero()) {
            Thread.sleep(duration.toMillis());
        }
    };

    void sleep(Duration duration) throws InterruptedException;
}
