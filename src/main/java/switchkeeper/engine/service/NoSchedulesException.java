package switchkeeper.engine.service;

import switchkeeper.engine.core.MaintenanceException;

/**
 * A site has no enabled port schedules to run.
 */
public class NoSchedulesException extends MaintenanceException {

    private final String siteName;

    public NoSchedulesException(String siteName) {
        super("No enabled port schedules found for site '" + siteName + "'");
        this.siteName = siteName;
    }

    public String siteName() {
        return siteName;
    }
}
