package marouter.placement.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import marouter.placement.api.Controller;
import marouter.placement.api.v1.dto.HealthResponse;
import marouter.placement.repository.DecisionStore;
import marouter.placement.server.RouterHandler;
import marouter.placement.store.Database;
import marouter.placement.store.JdbcNodeDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.time.Duration;

/**
 * Health check controller.
 * GET /api/v1/health
 */
public class HealthController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);
    private static final String VERSION = "1.0.0";

    private final Database database;
    private final JdbcNodeDirectory nodeDirectory;
    private final DecisionStore decisionStore;
    private final String scoringPolicy;

    public HealthController(Database database, JdbcNodeDirectory nodeDirectory, DecisionStore decisionStore,
            String scoringPolicy) {
        this.database = database;
        this.nodeDirectory = nodeDirectory;
        this.decisionStore = decisionStore;
        this.scoringPolicy = scoringPolicy;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/health".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception {
        if (!database.isHealthy()) {
            return ControllerResponse.json(HttpResponseStatus.SERVICE_UNAVAILABLE,
                    RouterHandler.mapper().writeValueAsString(HealthResponse.unhealthy("connection failed")));
        }

        try {
            HealthResponse response = HealthResponse.healthy(
                    formatUptime(), VERSION, scoringPolicy, nodeDirectory.count(), decisionStore.count());
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
        } catch (RuntimeException e) {
            log.error("Health check failed", e);
            return ControllerResponse.json(HttpResponseStatus.SERVICE_UNAVAILABLE,
                    RouterHandler.mapper().writeValueAsString(HealthResponse.unhealthy(e.getMessage())));
        }
    }

    private String formatUptime() {
        long uptimeMs = ManagementFactory.getRuntimeMXBean().getUptime();
        Duration duration = Duration.ofMillis(uptimeMs);
        long hours = duration.toHours();
        long minutes = duration.toMinutesPart();
        return hours + "h " + minutes + "m";
    }
}
