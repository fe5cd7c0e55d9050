package switchkeeper.engine.service;

import switchkeeper.engine.model.TriggerSource;

/**
 * Who asked for a tracked run and how to label it in the ledger.
 *
 * @param scheduleId        owning schedule, null for ad-hoc runs
 * @param deviceDisplayName display name stored on the record
 * @param siteDisplayName   stored in metadata as {@code siteName}, may be null
 */
public record RunContext(String scheduleId, TriggerSource source, String deviceDisplayName, String siteDisplayName) {

    public static RunContext manual(String deviceDisplayName, String siteDisplayName) {
        return new RunContext(null, TriggerSource.MANUAL, deviceDisplayName, siteDisplayName);
    }
}
