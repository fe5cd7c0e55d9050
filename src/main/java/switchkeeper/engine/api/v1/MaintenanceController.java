package switchkeeper.engine.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import switchkeeper.engine.api.Controller;
import switchkeeper.engine.api.v1.dto.BulkRebootRequest;
import switchkeeper.engine.api.v1.dto.BulkRebootResponse;
import switchkeeper.engine.api.v1.dto.CyclePortRequest;
import switchkeeper.engine.api.v1.dto.RebootRequest;
import switchkeeper.engine.api.v1.dto.RunResponse;
import switchkeeper.engine.api.v1.dto.TriggerResponse;
import switchkeeper.engine.gateway.DeviceNotFoundException;
import switchkeeper.engine.gateway.GatewayException;
import switchkeeper.engine.model.RebootOutcome;
import switchkeeper.engine.model.RunRecord;
import switchkeeper.engine.model.RunStatus;
import switchkeeper.engine.scheduler.ReloadReport;
import switchkeeper.engine.scheduler.TriggerScheduler;
import switchkeeper.engine.server.RouterHandler;
import switchkeeper.engine.service.PortCycleRequest;
import switchkeeper.engine.service.PortCycleService;
import switchkeeper.engine.service.RebootService;
import switchkeeper.engine.service.RunContext;
import switchkeeper.engine.service.SiteResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Operator actions on devices and on the scheduler.
 *
 * POST /api/v1/devices/reboot - Reboot one device, watch it come back in the background
 * POST /api/v1/devices/bulk-reboot - Reboot several devices one after another
 * POST /api/v1/ports/cycle - Cycle one port and wait for the result
 * POST /api/v1/scheduler/reload - Rebuild triggers from the database
 * GET /api/v1/scheduler/triggers - Registered triggers by next fire time
 */
public class MaintenanceController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(MaintenanceController.class);

    private static final String REBOOT_PATH = "/api/v1/devices/reboot";
    private static final String BULK_REBOOT_PATH = "/api/v1/devices/bulk-reboot";
    private static final String CYCLE_PORT_PATH = "/api/v1/ports/cycle";
    private static final String RELOAD_PATH = "/api/v1/scheduler/reload";
    private static final String TRIGGERS_PATH = "/api/v1/scheduler/triggers";

    private final RebootService rebootService;
    private final PortCycleService portCycleService;
    private final SiteResolver siteResolver;
    private final TriggerScheduler scheduler;

    public MaintenanceController(RebootService rebootService, PortCycleService portCycleService,
            SiteResolver siteResolver, TriggerScheduler scheduler) {
        this.rebootService = rebootService;
        this.portCycleService = portCycleService;
        this.siteResolver = siteResolver;
        this.scheduler = scheduler;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.POST)) {
            return REBOOT_PATH.equals(path) || BULK_REBOOT_PATH.equals(path) || CYCLE_PORT_PATH.equals(path)
                    || RELOAD_PATH.equals(path);
        }
        return method.equals(HttpMethod.GET) && TRIGGERS_PATH.equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            switch (path) {
                case REBOOT_PATH:
                    return handleReboot(req);
                case BULK_REBOOT_PATH:
                    return handleBulkReboot(req);
                case CYCLE_PORT_PATH:
                    return handleCyclePort(req);
                case RELOAD_PATH:
                    return handleReload();
                case TRIGGERS_PATH:
                    return handleTriggers();
                default:
                    return ControllerResponse.notFound("unknown maintenance endpoint");
            }
        } catch (DeviceNotFoundException e) {
            return ControllerResponse.notFound(e.getMessage());
        } catch (GatewayException e) {
            log.error("Controller call failed: {}", e.getMessage());
            return ControllerResponse.badGateway(e.getMessage());
        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Maintenance controller error", e);
            return ControllerResponse.error("internal error");
        }
    }

    /**
     * POST /api/v1/devices/reboot
     */
    private ControllerResponse handleReboot(FullHttpRequest req) throws Exception {
        RebootRequest request = RouterHandler.readJson(req, RebootRequest.class);
        request.validate();

        RebootOutcome outcome = rebootService.rebootOne(request.deviceId(), request.siteName());
        RunRecord run = outcome.run();

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("success", outcome.commandAccepted());
        response.put("deviceId", request.deviceId());
        response.put("deviceName", run.deviceName());
        response.put("runId", run.id());
        if (!outcome.commandAccepted()) {
            response.put("error", run.errorMessage());
        }
        HttpResponseStatus status = outcome.commandAccepted() ? HttpResponseStatus.OK : HttpResponseStatus.BAD_GATEWAY;
        return ControllerResponse.json(status, RouterHandler.mapper().writeValueAsString(response));
    }

    /**
     * POST /api/v1/devices/bulk-reboot
     */
    private ControllerResponse handleBulkReboot(FullHttpRequest req) throws Exception {
        BulkRebootRequest request = RouterHandler.readJson(req, BulkRebootRequest.class);
        request.validate();

        BulkRebootResponse response = BulkRebootResponse.from(
                rebootService.rebootBulk(request.deviceIds(), request.siteName()));
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
    }

    /**
     * POST /api/v1/ports/cycle - blocks for the whole cycle; failures are reported in the run
     */
    private ControllerResponse handleCyclePort(FullHttpRequest req) throws Exception {
        CyclePortRequest request = RouterHandler.readJson(req, CyclePortRequest.class);
        request.validate();

        PortCycleRequest cycle = request.toCycleRequest();
        RunContext context = RunContext.manual(
                portCycleService.portDisplayName(cycle.deviceId(), cycle.portIdx(), cycle.site()),
                siteResolver.displayName(cycle.site()));

        RunRecord run = portCycleService.runTracked(cycle, context);
        HttpResponseStatus status = run.status() == RunStatus.COMPLETED
                ? HttpResponseStatus.OK
                : HttpResponseStatus.BAD_GATEWAY;
        return ControllerResponse.json(status, RouterHandler.mapper().writeValueAsString(RunResponse.from(run)));
    }

    /**
     * POST /api/v1/scheduler/reload
     */
    private ControllerResponse handleReload() throws Exception {
        ReloadReport report = scheduler.reload();

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("success", true);
        response.put("running", scheduler.isRunning());
        response.put("registered", report.registered());
        response.put("failures", report.failures());
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
    }

    /**
     * GET /api/v1/scheduler/triggers
     */
    private ControllerResponse handleTriggers() throws Exception {
        List<TriggerResponse> triggers = scheduler.triggers().stream()
                .map(TriggerResponse::from)
                .toList();
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(triggers));
    }
}
