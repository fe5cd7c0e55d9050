package switchkeeper.engine.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.QueryStringDecoder;
import switchkeeper.engine.api.Controller;
import switchkeeper.engine.api.v1.dto.RunResponse;
import switchkeeper.engine.model.RunRecord;
import switchkeeper.engine.model.RunStatus;
import switchkeeper.engine.repository.RunLedger;
import switchkeeper.engine.server.RouterHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Read access to the run ledger.
 *
 * GET /api/v1/runs?limit=&scheduleId=&status= - Most recent runs first
 * GET /api/v1/runs/{runId} - One run
 */
public class RunController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(RunController.class);

    private static final Pattern RUNS_PATTERN = Pattern.compile("^/api/v1/runs$");
    private static final Pattern RUN_BY_ID_PATTERN = Pattern.compile("^/api/v1/runs/([^/]+)$");

    private static final int DEFAULT_LIMIT = 100;
    private static final int MAX_LIMIT = 1000;

    private final RunLedger ledger;

    public RunController(RunLedger ledger) {
        this.ledger = ledger;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET)
                && (RUNS_PATTERN.matcher(path).matches() || RUN_BY_ID_PATTERN.matcher(path).matches());
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (RUNS_PATTERN.matcher(path).matches()) {
                return handleList(new QueryStringDecoder(req.uri()).parameters());
            }

            Matcher byId = RUN_BY_ID_PATTERN.matcher(path);
            if (byId.matches()) {
                return handleGet(byId.group(1));
            }

            return ControllerResponse.notFound("unknown run endpoint");

        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Run controller error", e);
            return ControllerResponse.error("internal error");
        }
    }

    private ControllerResponse handleList(Map<String, List<String>> params) throws Exception {
        int limit = parseLimit(first(params, "limit"));
        String scheduleId = first(params, "scheduleId");
        String status = first(params, "status");

        List<RunRecord> runs;
        if (status != null) {
            runs = ledger.findByStatus(parseStatus(status)).stream().limit(limit).toList();
        } else if (scheduleId != null) {
            runs = ledger.findBySchedule(scheduleId, limit);
        } else {
            runs = ledger.findRecent(limit);
        }

        List<RunResponse> response = runs.stream().map(RunResponse::from).toList();
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
    }

    private ControllerResponse handleGet(String runId) throws Exception {
        Optional<RunRecord> run = ledger.findById(runId);
        if (run.isEmpty()) {
            return ControllerResponse.notFound("run not found");
        }
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(RunResponse.from(run.get())));
    }

    private static String first(Map<String, List<String>> params, String name) {
        List<String> values = params.get(name);
        if (values == null || values.isEmpty() || values.get(0).isBlank()) {
            return null;
        }
        return values.get(0);
    }

    private static int parseLimit(String raw) {
        if (raw == null) {
            return DEFAULT_LIMIT;
        }
        int limit;
        try {
            limit = Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("limit must be a number, got '" + raw + "'");
        }
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT);
        }
        return limit;
    }

    private static RunStatus parseStatus(String raw) {
        try {
            return RunStatus.valueOf(raw.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown status '" + raw + "'");
        }
    }
}
