package marouter.placement.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import marouter.placement.api.Controller;
import marouter.placement.api.v1.dto.DecisionResponse;
import marouter.placement.api.v1.dto.PlacementRequestBody;
import marouter.placement.engine.InvalidRequestException;
import marouter.placement.model.Decision;
import marouter.placement.server.RouterHandler;
import marouter.placement.service.QuoteService;

import java.nio.charset.StandardCharsets;

/**
 * Public stateless quote endpoint.
 * POST /api/v1/public/placement/quote
 *
 * API key checking happens in RouterHandler for every /api/v1/public/ path.
 */
public class QuoteController implements Controller {

    static final String PATH = "/api/v1/public/placement/quote";

    private final QuoteService quoteService;

    public QuoteController(QuoteService quoteService) {
        this.quoteService = quoteService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.POST) && PATH.equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception {
        String body = req.content().toString(StandardCharsets.UTF_8);
        PlacementRequestBody request = RouterHandler.mapper().readValue(body, PlacementRequestBody.class);
        if (request == null) {
            throw new InvalidRequestException("request body is required");
        }

        Decision decision = quoteService.quote(request.toResourceRequest());

        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(DecisionResponse.from(decision)));
    }
}
