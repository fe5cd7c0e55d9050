package switchkeeper.engine.service;

import switchkeeper.engine.config.EngineConfig;
import switchkeeper.engine.core.MaintenanceException;
import switchkeeper.engine.core.Poller;
import switchkeeper.engine.core.TaskLauncher;
import switchkeeper.engine.gateway.DeviceGateway;
import switchkeeper.engine.gateway.DeviceNotFoundException;
import switchkeeper.engine.gateway.GatewayException;
import switchkeeper.engine.model.BulkRebootResult;
import switchkeeper.engine.model.Confirmation;
import switchkeeper.engine.model.DeviceHandle;
import switchkeeper.engine.model.JobKind;
import switchkeeper.engine.model.RebootOutcome;
import switchkeeper.engine.model.RunRecord;
import switchkeeper.engine.model.RunStatus;
import switchkeeper.engine.model.Schedule;
import switchkeeper.engine.model.TriggerSource;
import switchkeeper.engine.repository.RunLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Device reboots: single manual reboots, rolling and parallel schedule batches, and
 * bulk operator requests.
 * <p>
 * A reboot run is COMPLETED as soon as the controller accepts the restart command.
 * Whether the device came back is tracked separately and never changes the record.
 */
public class RebootService {

    private static final Logger log = LoggerFactory.getLogger(RebootService.class);

    private final DeviceGateway gateway;
    private final RunLedger ledger;
    private final SiteResolver siteResolver;
    private final TaskLauncher launcher;
    private final MaintenanceNotifier notifier;
    private final Poller poller;
    private final Duration gracePeriod;
    private final Duration onlinePollInterval;
    private final Duration manualOnlineTimeout;

    public RebootService(DeviceGateway gateway, RunLedger ledger, SiteResolver siteResolver, TaskLauncher launcher,
            MaintenanceNotifier notifier, Poller poller, EngineConfig config) {
        this.gateway = gateway;
        this.ledger = ledger;
        this.siteResolver = siteResolver;
        this.launcher = launcher;
        this.notifier = notifier;
        this.poller = poller;
        this.gracePeriod = config.rebootGracePeriod();
        this.onlinePollInterval = config.onlinePollInterval();
        this.manualOnlineTimeout = config.manualOnlineTimeout();
    }

    // ==================== MANUAL ====================

    /**
     * Reboot one device on operator request and watch for it in the background.
     *
     * @throws DeviceNotFoundException if the device is not on the site
     */
    public RebootOutcome rebootOne(String deviceId, String site) {
        DeviceHandle device = gateway.getDevice(deviceId, site)
                .orElseThrow(() -> new DeviceNotFoundException(deviceId));

        RebootOutcome outcome = rebootResolved(null, deviceId, device, site, TriggerSource.MANUAL, Map.of());
        if (outcome.commandAccepted()) {
            watchOnline(device, site, outcome.run().startedAt());
        }
        return outcome;
    }

    /**
     * Reboot several devices one after another without waiting between them. Each
     * accepted device gets its own background online watch.
     */
    public BulkRebootResult rebootBulk(List<String> deviceIds, String site) {
        List<RebootOutcome> rebooted = new ArrayList<>();
        List<RebootOutcome> failed = new ArrayList<>();
        Instant bulkStartedAt = Instant.now();
        Map<String, Object> extra = Map.of("bulk", true, "total", deviceIds.size());

        for (String deviceId : deviceIds) {
            Optional<DeviceHandle> device = lookup(deviceId, site);
            RebootOutcome outcome = device.isPresent()
                    ? rebootResolved(null, deviceId, device.get(), site, TriggerSource.BULK, extra)
                    : recordUnresolved(null, deviceId, TriggerSource.BULK, extra);

            if (outcome.commandAccepted()) {
                rebooted.add(outcome);
                watchOnline(device.get(), site, bulkStartedAt);
            } else {
                log.error("Bulk reboot failed for device {}: {}", deviceId, outcome.run().errorMessage());
                failed.add(outcome);
            }
        }

        log.info("Bulk reboot: {} rebooted, {} failed of {}", rebooted.size(), failed.size(), deviceIds.size());
        return new BulkRebootResult(List.copyOf(rebooted), List.copyOf(failed), deviceIds.size());
    }

    // ==================== SCHEDULED ====================

    /**
     * Reboot the schedule's devices strictly in list order, waiting for each to come
     * back (when {@code maxWaitTime > 0}) and pausing between devices. A failed device
     * stops the batch unless the schedule continues on failure.
     */
    public List<RebootOutcome> rebootRolling(Schedule schedule) {
        log.info("Executing rolling reboots for schedule: {}", schedule.name());
        String site = siteResolver.resolve(schedule);
        List<String> deviceIds = schedule.deviceIds();
        List<RebootOutcome> outcomes = new ArrayList<>();

        try {
            for (int i = 0; i < deviceIds.size(); i++) {
                String deviceId = deviceIds.get(i);
                RebootOutcome outcome = rebootStep(schedule.id(), deviceId, site, TriggerSource.SCHEDULED);

                if (!outcome.commandAccepted()) {
                    outcomes.add(outcome);
                    if (!schedule.continueOnFailure()) {
                        log.error("Stopping rolling reboot of '{}' after failure on {}", schedule.name(), deviceId);
                        break;
                    }
                    continue;
                }

                Confirmation confirmation = Confirmation.NOT_CHECKED;
                if (schedule.maxWaitTime() > 0) {
                    String name = outcome.run().deviceName();
                    log.info("Waiting for {} to come back online (max {}s)", name, schedule.maxWaitTime());
                    poller.sleeper().sleep(gracePeriod);

                    Duration budget = Duration.ofSeconds(schedule.maxWaitTime()).minus(gracePeriod);
                    boolean online = awaitOnline(deviceId, site, budget);
                    confirmation = online ? Confirmation.CONFIRMED : Confirmation.UNCONFIRMED;
                    if (!online) {
                        log.warn("Device {} did not come back online within {}s", name, schedule.maxWaitTime());
                    }
                }
                outcomes.add(new RebootOutcome(outcome.run(), confirmation));

                boolean last = i == deviceIds.size() - 1;
                if (!last && schedule.delayBetweenDevices() > 0) {
                    log.info("Waiting {}s before next device", schedule.delayBetweenDevices());
                    poller.sleeper().sleep(Duration.ofSeconds(schedule.delayBetweenDevices()));
                }
            }
        } catch (InterruptedException e) {
            throw MaintenanceException.interrupted("rolling reboot of " + schedule.name(), e);
        }

        summarize(schedule, site, outcomes);
        return outcomes;
    }

    /**
     * Reboot every device of the schedule concurrently and wait for all commands.
     * One device failing never affects the others.
     */
    public List<RebootOutcome> rebootParallel(Schedule schedule) {
        log.info("Executing parallel reboots for schedule: {}", schedule.name());
        String site = siteResolver.resolve(schedule);
        List<String> deviceIds = schedule.deviceIds();

        Map<Integer, RebootOutcome> results = new ConcurrentHashMap<>();
        List<CompletableFuture<Void>> tasks = new ArrayList<>();
        for (int i = 0; i < deviceIds.size(); i++) {
            int index = i;
            String deviceId = deviceIds.get(i);
            tasks.add(launcher.launch("reboot " + deviceId,
                    () -> results.put(index, rebootStep(schedule.id(), deviceId, site, TriggerSource.SCHEDULED))));
        }
        CompletableFuture.allOf(tasks.toArray(new CompletableFuture[0])).join();

        List<RebootOutcome> outcomes = new ArrayList<>();
        for (int i = 0; i < deviceIds.size(); i++) {
            RebootOutcome outcome = results.get(i);
            if (outcome != null) {
                outcomes.add(outcome);
            }
        }

        summarize(schedule, site, outcomes);
        return outcomes;
    }

    // ==================== STEPS ====================

    /**
     * Resolve, record and reboot one device. Never throws for device or gateway
     * failures; they end up in a FAILED record.
     */
    RebootOutcome rebootStep(String scheduleId, String deviceId, String site, TriggerSource source) {
        Optional<DeviceHandle> device = lookup(deviceId, site);
        if (device.isEmpty()) {
            return recordUnresolved(scheduleId, deviceId, source, Map.of());
        }
        return rebootResolved(scheduleId, deviceId, device.get(), site, source, Map.of());
    }

    private Optional<DeviceHandle> lookup(String deviceId, String site) {
        try {
            return gateway.getDevice(deviceId, site);
        } catch (GatewayException e) {
            log.error("Failed to get device info for {}: {}", deviceId, e.getMessage());
            return Optional.empty();
        }
    }

    private RebootOutcome rebootResolved(String scheduleId, String deviceId, DeviceHandle device, String site,
            TriggerSource source, Map<String, Object> extra) {
        RunRecord run = startRun(scheduleId, deviceId, device.name(), source, extra);
        try {
            log.info("Rebooting device: {} ({})", device.name(), device.commandAddress());
            gateway.reboot(device.commandAddress(), site);
        } catch (RuntimeException e) {
            log.error("Failed to reboot device {}: {}", deviceId, e.getMessage());
            return new RebootOutcome(finish(run, RunStatus.FAILED, e.getMessage()), Confirmation.NOT_CHECKED);
        }
        return new RebootOutcome(finish(run, RunStatus.COMPLETED, null), Confirmation.NOT_CHECKED);
    }

    private RebootOutcome recordUnresolved(String scheduleId, String deviceId, TriggerSource source,
            Map<String, Object> extra) {
        RunRecord run = startRun(scheduleId, deviceId, deviceId, source, extra);
        String error = new DeviceNotFoundException(deviceId).getMessage();
        return new RebootOutcome(finish(run, RunStatus.FAILED, error), Confirmation.NOT_CHECKED);
    }

    private RunRecord startRun(String scheduleId, String deviceId, String deviceName, TriggerSource source,
            Map<String, Object> extra) {
        RunRecord.Builder builder = RunRecord.builder()
                .id(ledger.generateId())
                .scheduleId(scheduleId)
                .kind(JobKind.REBOOT)
                .deviceId(deviceId)
                .deviceName(deviceName)
                .startedAt(Instant.now())
                .source(source);
        extra.forEach(builder::metadata);
        RunRecord run = builder.build();
        ledger.create(run);
        return run;
    }

    private RunRecord finish(RunRecord run, RunStatus status, String error) {
        if (!ledger.finish(run.id(), status, error, null)) {
            log.warn("Run {} was already finished; {} not recorded", run.id(), status);
            return ledger.findById(run.id()).orElse(run);
        }
        return run.finished(status, Instant.now(), error, null);
    }

    // ==================== ONLINE WATCH ====================

    private boolean awaitOnline(String address, String site, Duration timeout) throws InterruptedException {
        return poller.await(() -> isOnline(address, site), onlinePollInterval, timeout);
    }

    // A reboot makes the controller flaky for a while; treat errors as "not yet".
    private boolean isOnline(String address, String site) {
        try {
            return gateway.deviceOnline(address, site);
        } catch (GatewayException e) {
            log.debug("Online check for {} failed: {}", address, e.getMessage());
            return false;
        }
    }

    private void watchOnline(DeviceHandle device, String site, Instant startedAt) {
        launcher.launch("watch-online " + device.name(), () -> {
            try {
                boolean online = awaitOnline(device.commandAddress(), site, manualOnlineTimeout);
                if (online) {
                    notifier.deviceBackOnline(device.name(), Duration.between(startedAt, Instant.now()));
                } else {
                    notifier.deviceRebootTimeout(device.name(), manualOnlineTimeout);
                }
            } catch (InterruptedException e) {
                throw MaintenanceException.interrupted("watching " + device.name() + " come online", e);
            }
        });
    }

    private void summarize(Schedule schedule, String site, List<RebootOutcome> outcomes) {
        List<RunRecord> runs = outcomes.stream().map(RebootOutcome::run).toList();
        try {
            notifier.scheduleCompleted(schedule.name(), siteResolver.displayName(site), runs);
        } catch (RuntimeException e) {
            log.warn("Schedule summary for {} could not be delivered: {}", schedule.name(), e.getMessage());
        }
    }
}
