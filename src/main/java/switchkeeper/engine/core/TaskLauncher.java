package switchkeeper.engine.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Launches background work that nobody awaits (trigger fires, staggered bulk
 * cycles, online watchers). Every failure is logged here because no caller
 * will ever look at it.
 */
public final class TaskLauncher implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TaskLauncher.class);

    private final ExecutorService executor;
    private final AtomicInteger threadCounter = new AtomicInteger();

    public TaskLauncher(String threadPrefix) {
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, threadPrefix + "-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Run {@code task} on a pool thread. The returned future completes normally
     * even when the task fails; the failure is logged.
     */
    public CompletableFuture<Void> launch(String name, Runnable task) {
        return CompletableFuture.runAsync(wrapRunnable(name, task), executor);
    }

    private Runnable wrapRunnable(String name, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("{} failed", name, e);
            }
        };
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Task launcher forcefully stopped");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
