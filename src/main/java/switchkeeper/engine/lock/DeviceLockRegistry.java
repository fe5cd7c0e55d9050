package switchkeeper.engine.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One mutual-exclusion lock per physical device.
 * <p>
 * Entries are created on first reference and never removed, so the map grows with the
 * number of distinct devices ever touched (hundreds to thousands).
 * <p>
 * A holder keeps its lock for the whole port cycle, which spans minutes; two cycles on
 * the same switch must not interleave their read-modify-write of the override list.
 */
public final class DeviceLockRegistry {

    private static final Logger log = LoggerFactory.getLogger(DeviceLockRegistry.class);

    private final ConcurrentMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    /**
     * Blocks until the device's lock is held by the calling thread.
     *
     * @return guard releasing the lock on close
     */
    public DeviceLock acquire(String deviceId) throws InterruptedException {
        ReentrantLock lock = locks.computeIfAbsent(deviceId, k -> new ReentrantLock());
        if (lock.isLocked() && !lock.isHeldByCurrentThread()) {
            log.info("Waiting for device lock {} (held by another operation)", deviceId);
        }
        lock.lockInterruptibly();
        return new DeviceLock(deviceId, lock);
    }

    /** Number of devices ever locked */
    public int size() {
        return locks.size();
    }

    /**
     * Held lock for one device. Closing releases it.
     */
    public static final class DeviceLock implements AutoCloseable {
        private final String deviceId;
        private final ReentrantLock lock;

        private DeviceLock(String deviceId, ReentrantLock lock) {
            this.deviceId = deviceId;
            this.lock = lock;
        }

        public String deviceId() {
            return deviceId;
        }

        @Override
        public void close() {
            lock.unlock();
        }
    }
}
