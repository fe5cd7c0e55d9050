package switchkeeper.engine.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.QueryStringDecoder;
import switchkeeper.engine.api.Controller;
import switchkeeper.engine.api.v1.dto.PortScheduleRequest;
import switchkeeper.engine.api.v1.dto.PortScheduleResponse;
import switchkeeper.engine.model.BulkDispatch;
import switchkeeper.engine.model.PortSchedule;
import switchkeeper.engine.scheduler.TriggerKind;
import switchkeeper.engine.scheduler.TriggerScheduler;
import switchkeeper.engine.server.RouterHandler;
import switchkeeper.engine.service.NoSchedulesException;
import switchkeeper.engine.service.PortScheduleService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for port cycle schedules.
 *
 * GET /api/v1/port-schedules - List port schedules
 * POST /api/v1/port-schedules - Create a port schedule
 * GET|PUT|DELETE /api/v1/port-schedules/{id}
 * POST /api/v1/port-schedules/{id}/toggle - Enable or disable
 * POST /api/v1/port-schedules/{id}/run - Fire the schedule's trigger now
 * POST /api/v1/port-schedules/run-site/{site} - Cycle every enabled schedule of a site
 */
public class PortScheduleController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(PortScheduleController.class);

    private static final Pattern SCHEDULES_PATTERN = Pattern.compile("^/api/v1/port-schedules$");
    private static final Pattern RUN_SITE_PATTERN = Pattern.compile("^/api/v1/port-schedules/run-site/([^/]+)$");
    private static final Pattern SCHEDULE_BY_ID_PATTERN = Pattern.compile("^/api/v1/port-schedules/([^/]+)$");
    private static final Pattern TOGGLE_PATTERN = Pattern.compile("^/api/v1/port-schedules/([^/]+)/toggle$");
    private static final Pattern RUN_PATTERN = Pattern.compile("^/api/v1/port-schedules/([^/]+)/run$");

    private final PortScheduleService portScheduleService;
    private final TriggerScheduler scheduler;

    public PortScheduleController(PortScheduleService portScheduleService, TriggerScheduler scheduler) {
        this.portScheduleService = portScheduleService;
        this.scheduler = scheduler;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (SCHEDULES_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.GET) || method.equals(HttpMethod.POST);
        }
        if (method.equals(HttpMethod.POST) && (RUN_SITE_PATTERN.matcher(path).matches()
                || TOGGLE_PATTERN.matcher(path).matches() || RUN_PATTERN.matcher(path).matches())) {
            return true;
        }
        return SCHEDULE_BY_ID_PATTERN.matcher(path).matches()
                && (method.equals(HttpMethod.GET) || method.equals(HttpMethod.PUT)
                        || method.equals(HttpMethod.DELETE));
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            HttpMethod method = req.method();

            if (SCHEDULES_PATTERN.matcher(path).matches()) {
                return method.equals(HttpMethod.GET) ? handleList() : handleCreate(req);
            }

            Matcher runSite = RUN_SITE_PATTERN.matcher(path);
            if (method.equals(HttpMethod.POST) && runSite.matches()) {
                return handleRunSite(QueryStringDecoder.decodeComponent(runSite.group(1)));
            }

            Matcher toggle = TOGGLE_PATTERN.matcher(path);
            if (toggle.matches()) {
                return handleToggle(toggle.group(1));
            }

            Matcher run = RUN_PATTERN.matcher(path);
            if (run.matches()) {
                return handleRunNow(run.group(1));
            }

            Matcher byId = SCHEDULE_BY_ID_PATTERN.matcher(path);
            if (byId.matches()) {
                String id = byId.group(1);
                if (method.equals(HttpMethod.GET)) {
                    return handleGet(id);
                }
                if (method.equals(HttpMethod.PUT)) {
                    return handleUpdate(id, req);
                }
                return handleDelete(id);
            }

            return ControllerResponse.notFound("unknown port schedule endpoint");

        } catch (NoSchedulesException e) {
            return ControllerResponse.notFound(e.getMessage());
        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Port schedule controller error", e);
            return ControllerResponse.error("internal error");
        }
    }

    private ControllerResponse handleList() throws Exception {
        List<PortScheduleResponse> schedules = portScheduleService.findAll().stream()
                .map(PortScheduleResponse::from)
                .toList();
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(schedules));
    }

    private ControllerResponse handleCreate(FullHttpRequest req) throws Exception {
        PortScheduleRequest request = RouterHandler.readJson(req, PortScheduleRequest.class);
        request.validate();

        PortSchedule schedule = portScheduleService.create(request.toBuilder());
        return ControllerResponse.json(HttpResponseStatus.CREATED,
                RouterHandler.mapper().writeValueAsString(PortScheduleResponse.from(schedule)));
    }

    private ControllerResponse handleGet(String id) throws Exception {
        Optional<PortSchedule> schedule = portScheduleService.findById(id);
        if (schedule.isEmpty()) {
            return ControllerResponse.notFound("port schedule not found");
        }
        return ControllerResponse.json(
                RouterHandler.mapper().writeValueAsString(PortScheduleResponse.from(schedule.get())));
    }

    private ControllerResponse handleUpdate(String id, FullHttpRequest req) throws Exception {
        PortScheduleRequest request = RouterHandler.readJson(req, PortScheduleRequest.class);
        request.validate();

        Optional<PortSchedule> updated = portScheduleService.update(id, request.toBuilder());
        if (updated.isEmpty()) {
            return ControllerResponse.notFound("port schedule not found");
        }
        return ControllerResponse.json(
                RouterHandler.mapper().writeValueAsString(PortScheduleResponse.from(updated.get())));
    }

    private ControllerResponse handleDelete(String id) throws Exception {
        if (!portScheduleService.delete(id)) {
            return ControllerResponse.notFound("port schedule not found");
        }
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(
                Map.of("success", true, "message", "Port schedule deleted")));
    }

    private ControllerResponse handleToggle(String id) throws Exception {
        Optional<PortSchedule> toggled = portScheduleService.toggle(id);
        if (toggled.isEmpty()) {
            return ControllerResponse.notFound("port schedule not found");
        }
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(
                Map.of("success", true, "enabled", toggled.get().enabled())));
    }

    private ControllerResponse handleRunNow(String id) throws Exception {
        if (portScheduleService.findById(id).isEmpty()) {
            return ControllerResponse.notFound("port schedule not found");
        }
        if (!scheduler.triggerNow(TriggerKind.PORT_SCHEDULE.keyFor(id))) {
            return ControllerResponse.conflict("port schedule has no active trigger");
        }
        return ControllerResponse.json(HttpResponseStatus.ACCEPTED, RouterHandler.mapper().writeValueAsString(
                Map.of("success", true, "scheduleId", id)));
    }

    private ControllerResponse handleRunSite(String siteName) throws Exception {
        BulkDispatch dispatch = portScheduleService.runSiteNow(siteName);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("success", true);
        response.put("message", "Started " + dispatch.count() + " port cycles for site '"
                + dispatch.siteDisplayName() + "'");
        response.put("count", dispatch.count());
        response.put("runIds", dispatch.runIds());
        return ControllerResponse.json(HttpResponseStatus.ACCEPTED,
                RouterHandler.mapper().writeValueAsString(response));
    }
}
