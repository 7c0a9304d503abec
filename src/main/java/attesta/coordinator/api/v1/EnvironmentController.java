package attesta.coordinator.api.v1;

import attesta.coordinator.api.Controller;
import attesta.coordinator.api.v1.dto.EnvironmentResponse;
import attesta.coordinator.server.RouterHandler;
import attesta.coordinator.service.EnvironmentCatalog;
import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Environment catalog.
 * GET /api/v1/environments
 */
public class EnvironmentController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentController.class);

    private final EnvironmentCatalog catalog;

    public EnvironmentController(EnvironmentCatalog catalog) {
        this.catalog = catalog;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/environments".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            return ControllerResponse.json(
                    RouterHandler.mapper().writeValueAsString(EnvironmentResponse.of(catalog.all())));
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize environment catalog", e);
            return ControllerResponse.error("internal error");
        }
    }
}
