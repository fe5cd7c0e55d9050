package switchkeeper.engine.core;

import java.time.Duration;
import java.util.function.BooleanSupplier;

/**
 * Polls a condition at a fixed interval until it holds or the budget runs out.
 * Elapsed time is counted in slept intervals, so a fake {@link Sleeper} gives
 * deterministic results.
 */
public final class Poller {

    private final Sleeper sleeper;

    public Poller(Sleeper sleeper) {
        this.sleeper = sleeper;
    }

    /**
     * @return true if the condition held before {@code timeout} elapsed
     */
    public boolean await(BooleanSupplier condition, Duration interval, Duration timeout) throws InterruptedException {
        Duration waited = Duration.ZERO;
        while (waited.compareTo(timeout) < 0) {
            if (condition.getAsBoolean()) {
                return true;
            }
            sleeper.sleep(interval);
            waited = waited.plus(interval);
        }
        return false;
    }

    public Sleeper sleeper() {
        return sleeper;
    }
}
