package switchkeeper.engine.support;

import switchkeeper.engine.config.EngineConfig;
import switchkeeper.engine.store.Database;

import java.util.function.BooleanSupplier;

/**
 * Shared test plumbing: fresh in-memory databases and bounded waits for background work.
 */
public final class TestDatabases {

    private TestDatabases() {
    }

    public static String memoryUrl(String name) {
        return "jdbc:h2:mem:" + name + "-" + System.nanoTime()
                + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    }

    public static EngineConfig config(String name) {
        return EngineConfig.defaults().withDatabaseUrl(memoryUrl(name));
    }

    public static Database database(String name) {
        return new Database(memoryUrl(name), 4);
    }

    /** Real-time wait for work running on launcher threads */
    public static boolean eventually(BooleanSupplier condition, long timeoutMs) throws InterruptedException {
        long deadline = System.currentTimeMillis() + timeoutMs;
        while (System.currentTimeMillis() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            Thread.sleep(20);
        }
        return condition.getAsBoolean();
    }
}
