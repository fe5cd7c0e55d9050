package switchkeeper.engine.service;

import switchkeeper.engine.config.EngineConfig;
import switchkeeper.engine.core.MaintenanceException;
import switchkeeper.engine.core.Poller;
import switchkeeper.engine.gateway.DeviceGateway;
import switchkeeper.engine.gateway.DeviceNotFoundException;
import switchkeeper.engine.gateway.GatewayException;
import switchkeeper.engine.lock.DeviceLockRegistry;
import switchkeeper.engine.lock.DeviceLockRegistry.DeviceLock;
import switchkeeper.engine.model.Confirmation;
import switchkeeper.engine.model.DeviceHandle;
import switchkeeper.engine.model.JobKind;
import switchkeeper.engine.model.PoeMode;
import switchkeeper.engine.model.PortCycleOutcome;
import switchkeeper.engine.model.PortOverride;
import switchkeeper.engine.model.PortState;
import switchkeeper.engine.model.RunRecord;
import switchkeeper.engine.model.RunStatus;
import switchkeeper.engine.repository.RunLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Cycles a single switch port, either by PoE power (off, hold, auto) or by a full
 * disable/enable of the port through its override.
 * <p>
 * The full cycle captures the port's override before touching it and writes that exact
 * copy back afterwards. The whole read-modify-write sequence runs under the device lock.
 */
public class PortCycleService {

    private static final Logger log = LoggerFactory.getLogger(PortCycleService.class);

    static final String EXTRA_LINK_CONFIRMATION = "linkConfirmation";
    static final String EXTRA_WARNING = "warning";

    private final DeviceGateway gateway;
    private final DeviceLockRegistry locks;
    private final RunLedger ledger;
    private final Poller poller;
    private final Duration pollInterval;
    private final Duration transitionTimeout;

    public PortCycleService(DeviceGateway gateway, DeviceLockRegistry locks, RunLedger ledger, Poller poller,
            EngineConfig config) {
        this.gateway = gateway;
        this.locks = locks;
        this.ledger = ledger;
        this.poller = poller;
        this.pollInterval = config.portPollInterval();
        this.transitionTimeout = config.portTransitionTimeout();
    }

    /**
     * Cycle one port.
     *
     * @param offDuration how long the port stays off
     * @param site        controller site key, null for the default site
     * @return outcome once the command sequence succeeded
     * @throws DeviceNotFoundException         device absent from the site
     * @throws PortTransitionTimeoutException  port never went down; its override was restored
     * @throws MaintenanceException            gateway failure or interruption
     */
    public PortCycleOutcome cyclePort(String deviceId, int portIdx, Duration offDuration, String site,
            boolean poeOnly) {
        log.info("Starting port cycle for device {} port {} (poeOnly={})", deviceId, portIdx, poeOnly);
        try {
            PortCycleOutcome outcome = poeOnly
                    ? cyclePoe(deviceId, portIdx, offDuration, site)
                    : cycleFullPort(deviceId, portIdx, offDuration, site);
            log.info("Port cycle completed for device {} port {}", deviceId, portIdx);
            return outcome;
        } catch (InterruptedException e) {
            throw MaintenanceException.interrupted("cycling port " + portIdx + " on " + deviceId, e);
        }
    }

    // PoE changes touch only poe_mode, so they need neither the lock nor a saved override.
    private PortCycleOutcome cyclePoe(String deviceId, int portIdx, Duration offDuration, String site)
            throws InterruptedException {
        gateway.setPoeMode(deviceId, portIdx, PoeMode.OFF, site);
        log.info("Waiting {}s with PoE off on {} port {}", offDuration.toSeconds(), deviceId, portIdx);
        poller.sleeper().sleep(offDuration);
        gateway.setPoeMode(deviceId, portIdx, PoeMode.AUTO, site);
        return new PortCycleOutcome(deviceId, portIdx, true, Confirmation.NOT_CHECKED, null);
    }

    private PortCycleOutcome cycleFullPort(String deviceId, int portIdx, Duration offDuration, String site)
            throws InterruptedException {
        // callers may address the switch by id or MAC; the lock is keyed by the controller id
        String canonicalId = gateway.getDevice(deviceId, site)
                .orElseThrow(() -> new DeviceNotFoundException(deviceId))
                .id();

        try (DeviceLock ignored = locks.acquire(canonicalId)) {
            DeviceHandle device = gateway.getDevice(canonicalId, site)
                    .orElseThrow(() -> new DeviceNotFoundException(deviceId));

            PortOverride saved = captureOverride(device, portIdx);
            log.info("Saved override for port {}: forward={}, native_networkconf_id={}",
                    portIdx, saved.forward(), saved.nativeNetworkId());

            // --- DISABLE ---
            gateway.setPortOverride(canonicalId, PortOverride.disabledVariant(saved), site);
            log.info("Disable sent. Waiting up to {}s for port {} to go down", transitionTimeout.toSeconds(), portIdx);

            boolean wentDown = poller.await(() -> linkIs(canonicalId, portIdx, site, false), pollInterval,
                    transitionTimeout);
            if (!wentDown) {
                log.error("Port {} on {} did not go down after {}s. Restoring original config.",
                        portIdx, deviceId, transitionTimeout.toSeconds());
                gateway.setPortOverride(canonicalId, saved, site);
                throw new PortTransitionTimeoutException(canonicalId, portIdx, transitionTimeout);
            }
            log.info("Port {} confirmed DOWN", portIdx);

            // --- HOLD ---
            log.info("Holding port {} disabled for {}s", portIdx, offDuration.toSeconds());
            poller.sleeper().sleep(offDuration);

            // --- RE-ENABLE with the exact saved override ---
            gateway.setPortOverride(canonicalId, saved, site);
            log.info("Re-enable sent. Waiting up to {}s for port {} to come back up", transitionTimeout.toSeconds(),
                    portIdx);

            boolean backUp = poller.await(() -> linkIs(canonicalId, portIdx, site, true), pollInterval,
                    transitionTimeout);
            if (!backUp) {
                String warning = "Port " + portIdx + " not up after " + transitionTimeout.toSeconds()
                        + "s; re-enable was sent, link may still be negotiating";
                log.warn(warning);
                return new PortCycleOutcome(deviceId, portIdx, false, Confirmation.UNCONFIRMED, warning);
            }

            log.info("Port {} confirmed UP", portIdx);
            return new PortCycleOutcome(deviceId, portIdx, false, Confirmation.CONFIRMED, null);
        }
    }

    /**
     * Deep copy of the port's override, or one synthesized from the port table. An empty
     * native network is filled from the live port table when it has one.
     */
    static PortOverride captureOverride(DeviceHandle device, int portIdx) {
        Optional<PortState> port = device.port(portIdx);
        PortOverride saved = device.override(portIdx)
                .map(PortOverride::deepCopy)
                .orElseGet(() -> PortOverride.synthesize(port.orElse(null), portIdx));

        String liveNetwork = port.map(PortState::nativeNetworkId).orElse(null);
        if (isBlank(saved.nativeNetworkId()) && !isBlank(liveNetwork)) {
            log.info("Port {}: override had empty native_networkconf_id, using port table value {}",
                    portIdx, liveNetwork);
            saved = saved.withText(PortOverride.NATIVE_NETWORK, liveNetwork);
        }
        return saved;
    }

    private boolean linkIs(String deviceId, int portIdx, String site, boolean expectedUp) {
        Optional<Boolean> up = gateway.portLinkUp(deviceId, portIdx, site);
        up.ifPresent(u -> log.debug("Port {} on {} link up={} (want {})", portIdx, deviceId, u, expectedUp));
        return up.isPresent() && up.get() == expectedUp;
    }

    /**
     * "{device name} Port {n}" for run records, or the device id when the controller cannot tell.
     */
    public String portDisplayName(String deviceId, int portIdx, String site) {
        try {
            return gateway.getDevice(deviceId, site)
                    .map(d -> portLabel(d.name(), portIdx))
                    .orElse(portLabel(deviceId, portIdx));
        } catch (GatewayException e) {
            log.warn("Could not resolve name of device {}: {}", deviceId, e.getMessage());
            return portLabel(deviceId, portIdx);
        }
    }

    /**
     * Device names of a site from a single listing, keyed by id and by lower-case MAC.
     * Empty when the controller cannot be read.
     */
    public Map<String, String> deviceNames(String site) {
        Map<String, String> names = new HashMap<>();
        try {
            for (DeviceHandle device : gateway.listDevices(site)) {
                names.put(device.id(), device.name());
                if (!device.mac().isEmpty()) {
                    names.put(device.mac().toLowerCase(Locale.ROOT), device.name());
                }
            }
        } catch (GatewayException e) {
            log.warn("Could not list devices of site {}: {}", site, e.getMessage());
        }
        return names;
    }

    /**
     * Label for a port given a {@link #deviceNames} lookup.
     */
    public static String portDisplayName(Map<String, String> deviceNames, String deviceId, int portIdx) {
        String name = deviceNames.get(deviceId);
        if (name == null) {
            name = deviceNames.getOrDefault(deviceId.toLowerCase(Locale.ROOT), deviceId);
        }
        return portLabel(name, portIdx);
    }

    private static String portLabel(String deviceName, int portIdx) {
        return deviceName + " Port " + portIdx;
    }

    // ---- TRACKED RUNS ----

    /**
     * Create the RUNNING record for a cycle without executing it.
     */
    public RunRecord startRun(PortCycleRequest request, RunContext context) {
        RunRecord run = RunRecord.builder()
                .id(ledger.generateId())
                .scheduleId(context.scheduleId())
                .kind(JobKind.forPortCycle(request.poeOnly()))
                .deviceId(request.deviceId())
                .deviceName(context.deviceDisplayName() != null
                        ? context.deviceDisplayName()
                        : portLabel(request.deviceId(), request.portIdx()))
                .portIdx(request.portIdx())
                .startedAt(Instant.now())
                .source(context.source())
                .metadata("siteName", context.siteDisplayName())
                .metadata("portIdx", request.portIdx())
                .metadata("poeOnly", request.poeOnly())
                .metadata("offDuration", request.offDuration())
                .build();
        ledger.create(run);
        return run;
    }

    /**
     * Execute the cycle for a record created by {@link #startRun} and finish that record.
     * Operation failures end up in the record, never in an exception.
     */
    public RunRecord execute(RunRecord run, PortCycleRequest request) {
        try {
            PortCycleOutcome outcome = cyclePort(request.deviceId(), request.portIdx(),
                    Duration.ofSeconds(request.offDuration()), request.site(), request.poeOnly());

            Map<String, Object> extra = new LinkedHashMap<>();
            extra.put(EXTRA_LINK_CONFIRMATION, outcome.linkConfirmation().name());
            if (outcome.hasWarning()) {
                extra.put(EXTRA_WARNING, outcome.warning());
            }
            return finish(run, RunStatus.COMPLETED, null, extra);
        } catch (MaintenanceException e) {
            log.error("Port cycle {} failed for device {} port {}: {}", run.id(), request.deviceId(),
                    request.portIdx(), e.getMessage());
            return finish(run, RunStatus.FAILED, e.getMessage(), null);
        } catch (RuntimeException e) {
            log.error("Port cycle {} failed for device {} port {}", run.id(), request.deviceId(),
                    request.portIdx(), e);
            return finish(run, RunStatus.FAILED, e.getMessage(), null);
        }
    }

    /**
     * Cycle a port with a ledger record around it.
     *
     * @return the terminal record
     */
    public RunRecord runTracked(PortCycleRequest request, RunContext context) {
        return execute(startRun(request, context), request);
    }

    /**
     * Finish a record whose cycle will never run.
     */
    public RunRecord abandon(RunRecord run, String reason) {
        log.warn("Port cycle {} abandoned: {}", run.id(), reason);
        return finish(run, RunStatus.FAILED, reason, null);
    }

    // a refused finish means the record is already terminal; report what the ledger holds
    private RunRecord finish(RunRecord run, RunStatus status, String error, Map<String, Object> extra) {
        if (!ledger.finish(run.id(), status, error, extra)) {
            log.warn("Run {} was already finished; {} not recorded", run.id(), status);
            return ledger.findById(run.id()).orElse(run);
        }
        return run.finished(status, Instant.now(), error, extra);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
