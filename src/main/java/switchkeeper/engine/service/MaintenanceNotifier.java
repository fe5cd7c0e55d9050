package switchkeeper.engine.service;

import switchkeeper.engine.model.RunRecord;

import java.time.Duration;
import java.util.List;

/**
 * Receives operator-facing events. Implementations decide formatting and transport;
 * they must not throw back into the orchestration.
 */
public interface MaintenanceNotifier {

    /**
     * A rebooted device was seen online again.
     */
    void deviceBackOnline(String deviceName, Duration downtime);

    /**
     * A rebooted device did not come back within {@code waited}.
     */
    void deviceRebootTimeout(String deviceName, Duration waited);

    /**
     * Grouped summary after a scheduled reboot batch, one record per device.
     */
    void scheduleCompleted(String scheduleName, String siteDisplayName, List<RunRecord> results);
}
