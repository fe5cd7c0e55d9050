package switchkeeper.engine.support;

import switchkeeper.engine.core.Sleeper;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Virtual-time sleeper: returns at once and remembers every requested duration.
 */
public class RecordingSleeper implements Sleeper {

    private final List<Duration> sleeps = new ArrayList<>();

    @Override
    public synchronized void sleep(Duration duration) {
        sleeps.add(duration);
    }

    public synchronized List<Duration> sleeps() {
        return List.copyOf(sleeps);
    }

    public synchronized Duration total() {
        return sleeps.stream().reduce(Duration.ZERO, Duration::plus);
    }
}
