package switchkeeper.engine.service;

import switchkeeper.engine.core.MaintenanceException;

import java.time.Duration;

/**
 * A disabled port never reported link down. The saved override has already been
 * written back when this is thrown.
 */
public class PortTransitionTimeoutException extends MaintenanceException {

    private final String deviceId;
    private final int portIdx;

    public PortTransitionTimeoutException(String deviceId, int portIdx, Duration waited) {
        super("Port " + portIdx + " on device " + deviceId
                + " did not transition to down state after disable command (waited " + waited.toSeconds() + "s)");
        this.deviceId = deviceId;
        this.portIdx = portIdx;
    }

    public String deviceId() {
        return deviceId;
    }

    public int portIdx() {
        return portIdx;
    }
}
