package switchkeeper.engine.gateway;

import switchkeeper.engine.core.MaintenanceException;

/**
 * Target device is absent from the resolved site's device list. Not retryable.
 */
public class DeviceNotFoundException extends MaintenanceException {

    private final String deviceId;

    public DeviceNotFoundException(String deviceId) {
        super("Device " + deviceId + " not found");
        this.deviceId = deviceId;
    }

    public String deviceId() {
        return deviceId;
    }
}
