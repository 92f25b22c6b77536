package marouter.placement.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.QueryStringDecoder;
import marouter.placement.api.Controller;
import marouter.placement.api.v1.dto.DecisionResponse;
import marouter.placement.api.v1.dto.PlacementRequestBody;
import marouter.placement.engine.InvalidRequestException;
import marouter.placement.model.Decision;
import marouter.placement.server.RouterHandler;
import marouter.placement.service.PlacementService;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for recorded placements.
 *
 * POST /api/v1/placement/requests - Evaluate and record a placement
 * GET /api/v1/placement/requests - Recent decisions (?limit=N, default 50)
 * GET /api/v1/placement/requests/{requestId} - One recorded decision
 */
public class PlacementController implements Controller {

    private static final Pattern REQUESTS_PATTERN = Pattern.compile("^/api/v1/placement/requests$");
    private static final Pattern REQUEST_BY_ID_PATTERN = Pattern.compile("^/api/v1/placement/requests/([^/]+)$");
    private static final int DEFAULT_LIMIT = 50;
    private static final int MAX_LIMIT = 500;

    private final PlacementService placementService;

    public PlacementController(PlacementService placementService) {
        this.placementService = placementService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (REQUESTS_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.POST) || method.equals(HttpMethod.GET);
        }
        return method.equals(HttpMethod.GET) && REQUEST_BY_ID_PATTERN.matcher(path).matches();
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception {
        if (req.method().equals(HttpMethod.POST)) {
            return handleCreate(req);
        }

        Matcher byId = REQUEST_BY_ID_PATTERN.matcher(path);
        if (byId.matches()) {
            return handleGet(byId.group(1));
        }
        return handleList(req);
    }

    /**
     * POST /api/v1/placement/requests
     */
    private ControllerResponse handleCreate(FullHttpRequest req) throws Exception {
        String body = req.content().toString(StandardCharsets.UTF_8);
        PlacementRequestBody request = RouterHandler.mapper().readValue(body, PlacementRequestBody.class);
        if (request == null) {
            throw new InvalidRequestException("request body is required");
        }

        Decision decision = placementService.place(request.toResourceRequest());

        return ControllerResponse.json(
                HttpResponseStatus.CREATED,
                RouterHandler.mapper().writeValueAsString(DecisionResponse.from(decision)));
    }

    /**
     * GET /api/v1/placement/requests/{requestId}
     */
    private ControllerResponse handleGet(String requestId) throws Exception {
        Optional<Decision> decision = placementService.findDecision(requestId);
        if (decision.isEmpty()) {
            return ControllerResponse.notFound("placement request not found");
        }
        return ControllerResponse.json(
                RouterHandler.mapper().writeValueAsString(DecisionResponse.from(decision.get())));
    }

    /**
     * GET /api/v1/placement/requests
     */
    private ControllerResponse handleList(FullHttpRequest req) throws Exception {
        int limit = parseLimit(new QueryStringDecoder(req.uri()).parameters().get("limit"));

        List<DecisionResponse> decisions = placementService.listRecent(limit).stream()
                .map(DecisionResponse::from)
                .toList();

        Map<String, Object> response = Map.of(
                "count", decisions.size(),
                "decisions", decisions);
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
    }

    private static int parseLimit(List<String> values) {
        if (values == null || values.isEmpty()) {
            return DEFAULT_LIMIT;
        }
        try {
            int limit = Integer.parseInt(values.get(0));
            if (limit <= 0) {
                throw new IllegalArgumentException("limit must be positive");
            }
            return Math.min(limit, MAX_LIMIT);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("limit must be an integer");
        }
    }
}
