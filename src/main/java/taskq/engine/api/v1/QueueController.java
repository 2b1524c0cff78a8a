package taskq.engine.api.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import taskq.engine.api.Controller;
import taskq.engine.api.v1.dto.QueueInfoResponse;
import taskq.engine.server.RouterHandler;
import taskq.engine.service.TaskEngine;

/**
 * GET /api/v1/queue
 */
public class QueueController implements Controller {

    private final TaskEngine engine;

    public QueueController(TaskEngine engine) {
        this.engine = engine;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/queue".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        QueueInfoResponse response = QueueInfoResponse.from(engine.getQueueInfo());
        try {
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
        } catch (JsonProcessingException e) {
            return ControllerResponse.error("failed to serialize queue info");
        }
    }
}
