package marouter.placement.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.*;
import marouter.placement.api.Controller;
import marouter.placement.api.Controller.ControllerResponse;
import marouter.placement.config.PlacementConfig;
import marouter.placement.engine.SnapshotUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static io.netty.handler.codec.http.HttpHeaderNames.CONTENT_TYPE;
import static io.netty.handler.codec.http.HttpResponseStatus.*;
import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;

/**
 * Central router that dispatches HTTP requests to registered controllers.
 *
 * Error mapping:
 * - IllegalArgumentException (including InvalidRequestException) and
 * malformed JSON: 400
 * - SnapshotUnavailableException: 503
 * - anything else: 500 with the cause chain
 *
 * Paths under /api/v1/public/ require the X-API-Key header when an API key
 * is configured.
 *
 * This handler is @Sharable because it has no per-channel state.
 */
@Sharable
public class RouterHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private static final Logger log = LoggerFactory.getLogger(RouterHandler.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .findAndRegisterModules();

    static final String API_KEY_HEADER = "X-API-Key";
    private static final String PUBLIC_PREFIX = "/api/v1/public/";

    private final List<Controller> controllers = new ArrayList<>();
    private final PlacementConfig config;

    public RouterHandler(PlacementConfig config) {
        this.config = config;
    }

    /**
     * Register a controller to handle requests.
     * Controllers are checked in order of registration.
     */
    public RouterHandler registerController(Controller controller) {
        controllers.add(controller);
        log.debug("Registered controller: {}", controller.getClass().getSimpleName());
        return this;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest req) {
        write(ctx, route(ctx, req));
    }

    ControllerResponse route(ChannelHandlerContext ctx, FullHttpRequest req) {
        String uri = req.uri();
        HttpMethod method = req.method();

        // Extract path without query string
        String path = uri.contains("?") ? uri.substring(0, uri.indexOf("?")) : uri;

        try {
            if (!checkApiKey(req, path)) {
                log.warn("API key check failed for {} {}", method, path);
                return ControllerResponse.forbidden("forbidden");
            }

            for (Controller controller : controllers) {
                if (controller.matches(method, path)) {
                    return controller.handle(ctx, req, path);
                }
            }

            log.debug("No handler for: {} {}", method, path);
            return ControllerResponse.notFound("not found");

        } catch (JsonProcessingException e) {
            log.warn("Malformed JSON for {} {}: {}", method, path, e.getOriginalMessage());
            return ControllerResponse.badRequest("malformed JSON: " + e.getOriginalMessage());
        } catch (IllegalArgumentException e) {
            log.warn("Validation error: {}", e.getMessage());
            return ControllerResponse.badRequest(e.getMessage());
        } catch (SnapshotUnavailableException e) {
            log.error("Node directory unavailable for {} {}", method, path, e);
            return ControllerResponse.unavailable(e.getMessage());
        } catch (Exception e) {
            String requestBody = req.content().toString(StandardCharsets.UTF_8);
            log.error("Handler error: {} {} - Body: [{}]", method, path, requestBody, e);

            StringBuilder errorChain = new StringBuilder(e.toString());
            Throwable cause = e.getCause();
            while (cause != null) {
                errorChain.append(" <- ").append(cause);
                cause = cause.getCause();
            }
            return ControllerResponse.error(errorChain.toString());
        }
    }

    private boolean checkApiKey(FullHttpRequest req, String path) {
        if (!config.hasApiKey() || !path.startsWith(PUBLIC_PREFIX)) {
            return true;
        }
        return config.apiKey().equals(req.headers().get(API_KEY_HEADER));
    }

    private void write(ChannelHandlerContext ctx, ControllerResponse response) {
        try {
            String body = response.body() != null ? response.body() : "";
            byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
            FullHttpResponse httpResponse = new DefaultFullHttpResponse(HTTP_1_1, response.status(),
                    Unpooled.wrappedBuffer(bytes));
            httpResponse.headers().set(CONTENT_TYPE, response.contentType() + "; charset=utf-8");
            httpResponse.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, bytes.length);
            ctx.writeAndFlush(httpResponse);
        } catch (RuntimeException e) {
            log.error("Failed to write response: {}", e.getMessage(), e);
            ctx.close();
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("Unhandled exception in channel: {}", cause.getMessage(), cause);
        try {
            write(ctx, ControllerResponse.error(INTERNAL_SERVER_ERROR, "channel error: " + cause.getMessage()));
        } finally {
            ctx.close();
        }
    }

    /**
     * Get the shared ObjectMapper for JSON serialization.
     */
    public static ObjectMapper mapper() {
        return MAPPER;
    }
}
