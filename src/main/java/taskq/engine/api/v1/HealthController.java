package taskq.engine.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import taskq.engine.api.Controller;
import taskq.engine.api.v1.dto.HealthResponse;
import taskq.engine.server.RouterHandler;
import taskq.engine.service.TaskEngine;
import taskq.engine.store.Database;

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
    private final TaskEngine engine;

    public HealthController(Database database, TaskEngine engine) {
        this.database = database;
        this.engine = engine;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/health".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (!database.isHealthy()) {
                return unavailable("connection failed");
            }

            var stats = engine.getStats();
            HealthResponse response = HealthResponse.healthy(
                    formatUptime(), VERSION, stats.running(), stats.queueSize(), stats.processingSize());

            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));

        } catch (Exception e) {
            log.error("Health check failed", e);
            try {
                return unavailable(e.getMessage());
            } catch (Exception ex) {
                return ControllerResponse.error("health check failed");
            }
        }
    }

    private static ControllerResponse unavailable(String reason) throws Exception {
        return ControllerResponse.json(HttpResponseStatus.SERVICE_UNAVAILABLE,
                RouterHandler.mapper().writeValueAsString(HealthResponse.unhealthy(reason)));
    }

    private String formatUptime() {
        long uptimeMs = ManagementFactory.getRuntimeMXBean().getUptime();
        Duration duration = Duration.ofMillis(uptimeMs);
        long hours = duration.toHours();
        long minutes = duration.toMinutesPart();
        return hours + "h " + minutes + "m";
    }
}
