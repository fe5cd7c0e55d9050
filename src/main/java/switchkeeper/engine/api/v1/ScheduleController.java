package switchkeeper.engine.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import switchkeeper.engine.api.Controller;
import switchkeeper.engine.api.v1.dto.ScheduleRequest;
import switchkeeper.engine.api.v1.dto.ScheduleResponse;
import switchkeeper.engine.model.Schedule;
import switchkeeper.engine.scheduler.TriggerKind;
import switchkeeper.engine.scheduler.TriggerScheduler;
import switchkeeper.engine.server.RouterHandler;
import switchkeeper.engine.service.ScheduleService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for device reboot schedules.
 *
 * GET /api/v1/schedules - List schedules
 * POST /api/v1/schedules - Create a schedule
 * GET /api/v1/schedules/{id} - Get a schedule
 * PUT /api/v1/schedules/{id} - Replace a schedule
 * DELETE /api/v1/schedules/{id} - Delete a schedule
 * POST /api/v1/schedules/{id}/toggle - Enable or disable
 * POST /api/v1/schedules/{id}/run - Fire the schedule's trigger now
 */
public class ScheduleController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(ScheduleController.class);

    private static final Pattern SCHEDULES_PATTERN = Pattern.compile("^/api/v1/schedules$");
    private static final Pattern SCHEDULE_BY_ID_PATTERN = Pattern.compile("^/api/v1/schedules/([^/]+)$");
    private static final Pattern TOGGLE_PATTERN = Pattern.compile("^/api/v1/schedules/([^/]+)/toggle$");
    private static final Pattern RUN_PATTERN = Pattern.compile("^/api/v1/schedules/([^/]+)/run$");

    private final ScheduleService scheduleService;
    private final TriggerScheduler scheduler;

    public ScheduleController(ScheduleService scheduleService, TriggerScheduler scheduler) {
        this.scheduleService = scheduleService;
        this.scheduler = scheduler;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (SCHEDULES_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.GET) || method.equals(HttpMethod.POST);
        }
        if (SCHEDULE_BY_ID_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.GET) || method.equals(HttpMethod.PUT)
                    || method.equals(HttpMethod.DELETE);
        }
        return method.equals(HttpMethod.POST)
                && (TOGGLE_PATTERN.matcher(path).matches() || RUN_PATTERN.matcher(path).matches());
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            HttpMethod method = req.method();

            if (SCHEDULES_PATTERN.matcher(path).matches()) {
                return method.equals(HttpMethod.GET) ? handleList() : handleCreate(req);
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

            return ControllerResponse.notFound("unknown schedule endpoint");

        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Schedule controller error", e);
            return ControllerResponse.error("internal error");
        }
    }

    private ControllerResponse handleList() throws Exception {
        List<ScheduleResponse> schedules = scheduleService.findAll().stream()
                .map(ScheduleResponse::from)
                .toList();
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(schedules));
    }

    private ControllerResponse handleCreate(FullHttpRequest req) throws Exception {
        ScheduleRequest request = RouterHandler.readJson(req, ScheduleRequest.class);
        request.validate();

        Schedule schedule = scheduleService.create(request.toBuilder());
        return ControllerResponse.json(HttpResponseStatus.CREATED,
                RouterHandler.mapper().writeValueAsString(ScheduleResponse.from(schedule)));
    }

    private ControllerResponse handleGet(String id) throws Exception {
        Optional<Schedule> schedule = scheduleService.findById(id);
        if (schedule.isEmpty()) {
            return ControllerResponse.notFound("schedule not found");
        }
        return ControllerResponse.json(
                RouterHandler.mapper().writeValueAsString(ScheduleResponse.from(schedule.get())));
    }

    private ControllerResponse handleUpdate(String id, FullHttpRequest req) throws Exception {
        ScheduleRequest request = RouterHandler.readJson(req, ScheduleRequest.class);
        request.validate();

        Optional<Schedule> updated = scheduleService.update(id, request.toBuilder());
        if (updated.isEmpty()) {
            return ControllerResponse.notFound("schedule not found");
        }
        return ControllerResponse.json(
                RouterHandler.mapper().writeValueAsString(ScheduleResponse.from(updated.get())));
    }

    private ControllerResponse handleDelete(String id) throws Exception {
        if (!scheduleService.delete(id)) {
            return ControllerResponse.notFound("schedule not found");
        }
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(
                Map.of("success", true, "message", "Schedule deleted")));
    }

    private ControllerResponse handleToggle(String id) throws Exception {
        Optional<Schedule> toggled = scheduleService.toggle(id);
        if (toggled.isEmpty()) {
            return ControllerResponse.notFound("schedule not found");
        }
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(
                Map.of("success", true, "enabled", toggled.get().enabled())));
    }

    private ControllerResponse handleRunNow(String id) throws Exception {
        if (scheduleService.findById(id).isEmpty()) {
            return ControllerResponse.notFound("schedule not found");
        }
        if (!scheduler.triggerNow(TriggerKind.REBOOT_SCHEDULE.keyFor(id))) {
            return ControllerResponse.conflict("schedule has no active trigger");
        }
        return ControllerResponse.json(HttpResponseStatus.ACCEPTED, RouterHandler.mapper().writeValueAsString(
                Map.of("success", true, "scheduleId", id)));
    }
}
