package switchkeeper.engine.gateway;

import switchkeeper.engine.model.DeviceHandle;
import switchkeeper.engine.model.PoeMode;
import switchkeeper.engine.model.PortOverride;
import switchkeeper.engine.model.Site;

import java.util.List;
import java.util.Optional;

/**
 * Orchestration-facing view of the network controller.
 * <p>
 * Every call may fail with {@link GatewayException}. A {@code null} site means the
 * configured default site. Implementations re-establish an expired session on their
 * own; callers never see the re-authentication.
 */
public interface DeviceGateway {

    /**
     * All sites visible to the session.
     */
    List<Site> listSites();

    /**
     * All devices of a site with their port table and override list.
     */
    List<DeviceHandle> listDevices(String site);

    /**
     * Find a device by controller id or MAC.
     */
    default Optional<DeviceHandle> getDevice(String idOrMac, String site) {
        return listDevices(site).stream().filter(d -> d.matches(idOrMac)).findFirst();
    }

    /**
     * Send the restart command.
     *
     * @param macOrId device MAC (preferred) or id
     */
    void reboot(String macOrId, String site);

    /**
     * Change the PoE mode of one port. Touches only that port's {@code poe_mode}.
     */
    void setPoeMode(String deviceId, int portIdx, PoeMode mode, String site);

    /**
     * Replace the override for {@code override.portIdx()} with the given object, sent
     * in full, leaving every other port's override unchanged.
     */
    void setPortOverride(String deviceId, PortOverride override, String site);

    /**
     * Link state of one port, empty if the device or port is unknown.
     */
    default Optional<Boolean> portLinkUp(String deviceId, int portIdx, String site) {
        return getDevice(deviceId, site)
                .flatMap(d -> d.port(portIdx))
                .map(p -> p.up());
    }

    /**
     * Whether the device currently reports itself connected.
     */
    default boolean deviceOnline(String idOrMac, String site) {
        return getDevice(idOrMac, site).map(DeviceHandle::online).orElse(false);
    }
}
