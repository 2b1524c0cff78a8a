package taskq.engine.api.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import taskq.engine.api.Controller;
import taskq.engine.api.v1.dto.TaskStatusResponse;
import taskq.engine.codec.MalformedTaskRecordException;
import taskq.engine.model.Task;
import taskq.engine.server.RouterHandler;
import taskq.engine.service.TaskEngine;

import java.util.Optional;

/**
 * Task status lookup.
 * GET /api/v1/tasks/{id}
 */
public class TaskController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(TaskController.class);
    private static final String PREFIX = "/api/v1/tasks/";

    private final TaskEngine engine;

    public TaskController(TaskEngine engine) {
        this.engine = engine;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && path.startsWith(PREFIX) && path.length() > PREFIX.length();
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        String taskId = path.substring(PREFIX.length());
        if (taskId.contains("/")) {
            return ControllerResponse.notFound("not found");
        }

        Optional<Task> task;
        try {
            task = engine.getTaskStatus(taskId);
        } catch (MalformedTaskRecordException e) {
            log.error("Task {} has a malformed record", taskId, e);
            return ControllerResponse.error(e.getMessage());
        }

        if (task.isEmpty()) {
            return ControllerResponse.notFound("task not found: " + taskId);
        }

        try {
            return ControllerResponse.json(
                    RouterHandler.mapper().writeValueAsString(TaskStatusResponse.from(task.get())));
        } catch (JsonProcessingException e) {
            return ControllerResponse.error("failed to serialize task " + taskId);
        }
    }
}
