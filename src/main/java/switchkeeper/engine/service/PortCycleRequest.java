package switchkeeper.engine.service;

import switchkeeper.engine.model.PortSchedule;

/**
 * What to cycle: one port on one device.
 *
 * @param offDuration seconds the port stays off
 * @param site        controller site key, null for the default site
 */
public record PortCycleRequest(String deviceId, int portIdx, boolean poeOnly, int offDuration, String site) {

    public static PortCycleRequest of(PortSchedule schedule, String site) {
        return new PortCycleRequest(schedule.deviceId(), schedule.portIdx(), schedule.poeOnly(),
                schedule.offDuration(), site);
    }
}
