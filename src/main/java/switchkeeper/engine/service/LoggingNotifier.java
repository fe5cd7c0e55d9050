package switchkeeper.engine.service;

import switchkeeper.engine.model.RunRecord;
import switchkeeper.engine.model.RunStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;

/**
 * Default notifier: writes every event to the log.
 */
public class LoggingNotifier implements MaintenanceNotifier {

    private static final Logger log = LoggerFactory.getLogger(LoggingNotifier.class);

    @Override
    public void deviceBackOnline(String deviceName, Duration downtime) {
        log.info("{} is back online after {}", deviceName, formatDuration(downtime.toSeconds()));
    }

    @Override
    public void deviceRebootTimeout(String deviceName, Duration waited) {
        log.warn("{} did not come back online (no response after {})", deviceName,
                formatDuration(waited.toSeconds()));
    }

    @Override
    public void scheduleCompleted(String scheduleName, String siteDisplayName, List<RunRecord> results) {
        if (results.isEmpty()) {
            return;
        }
        long succeeded = results.stream().filter(r -> r.status() == RunStatus.COMPLETED).count();
        String label = succeeded == results.size() ? "Maintenance complete" : "Maintenance partial";
        String site = siteDisplayName != null && !siteDisplayName.isBlank() ? " - " + siteDisplayName : "";

        StringBuilder sb = new StringBuilder();
        sb.append(label).append(site).append(": ").append(scheduleName)
                .append(" (").append(succeeded).append('/').append(results.size()).append(" rebooted)");
        for (RunRecord r : results) {
            sb.append("\n  ").append(r.deviceName());
            if (r.status() == RunStatus.COMPLETED) {
                sb.append(" ok");
                if (r.durationSeconds() != null && r.durationSeconds() > 0) {
                    sb.append(' ').append(formatDuration(r.durationSeconds()));
                }
            } else {
                String error = r.errorMessage() != null ? r.errorMessage() : "error";
                sb.append(" failed: ").append(error.length() > 60 ? error.substring(0, 60) : error);
            }
        }

        if (succeeded == results.size()) {
            log.info(sb.toString());
        } else {
            log.warn(sb.toString());
        }
    }

    static String formatDuration(long seconds) {
        if (seconds < 60) {
            return seconds + "s";
        }
        long m = seconds / 60;
        long s = seconds % 60;
        return s == 0 ? m + "m" : m + "m " + s + "s";
    }
}
