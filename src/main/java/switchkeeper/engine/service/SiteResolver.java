package switchkeeper.engine.service;

import switchkeeper.engine.gateway.DeviceGateway;
import switchkeeper.engine.gateway.GatewayException;
import switchkeeper.engine.model.PortSchedule;
import switchkeeper.engine.model.Schedule;
import switchkeeper.engine.model.Site;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Works out which controller site a schedule targets. Older records carry no site,
 * so the device is looked for on every visible site. Nothing is cached.
 */
public class SiteResolver {

    private static final Logger log = LoggerFactory.getLogger(SiteResolver.class);

    private final DeviceGateway gateway;

    public SiteResolver(DeviceGateway gateway) {
        this.gateway = gateway;
    }

    public String resolve(Schedule schedule) {
        String probe = schedule.deviceIds().isEmpty() ? null : schedule.deviceIds().get(0);
        return resolve(schedule.siteName(), probe, schedule.id());
    }

    public String resolve(PortSchedule schedule) {
        return resolve(schedule.siteName(), schedule.deviceId(), schedule.id());
    }

    /**
     * @return the stored site, else the first site holding {@code probeDeviceId}, else null
     *         (the gateway then uses its default site)
     */
    public String resolve(String storedSite, String probeDeviceId, String scheduleId) {
        if (storedSite != null && !storedSite.isBlank()) {
            return storedSite;
        }
        if (probeDeviceId == null) {
            return null;
        }

        List<Site> sites;
        try {
            sites = gateway.listSites();
        } catch (GatewayException e) {
            log.warn("Could not list sites to locate {}: {}", probeDeviceId, e.getMessage());
            return null;
        }

        for (Site site : sites) {
            if (site.name() == null) {
                continue;
            }
            try {
                if (gateway.getDevice(probeDeviceId, site.name()).isPresent()) {
                    log.info("Detected site for schedule {}: {}", scheduleId, site.name());
                    return site.name();
                }
            } catch (GatewayException e) {
                log.debug("Site probe {} failed for {}: {}", site.name(), probeDeviceId, e.getMessage());
            }
        }
        return null;
    }

    /**
     * Display name of a site, falling back to the key when the controller cannot tell.
     */
    public String displayName(String siteKey) {
        if (siteKey == null || siteKey.isBlank()) {
            return "";
        }
        try {
            return gateway.listSites().stream()
                    .filter(s -> siteKey.equals(s.name()))
                    .map(Site::displayName)
                    .findFirst()
                    .orElse(siteKey);
        } catch (GatewayException e) {
            log.warn("Could not resolve display name for site {}: {}", siteKey, e.getMessage());
            return siteKey;
        }
    }
}
