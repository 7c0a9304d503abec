package attesta.coordinator.api.v1;

import attesta.coordinator.api.Controller;
import attesta.coordinator.api.v1.dto.GroupResponse;
import attesta.coordinator.api.v1.dto.StartGroupRequest;
import attesta.coordinator.model.AggregateResult;
import attesta.coordinator.server.RouterHandler;
import attesta.coordinator.service.Orchestrator;
import attesta.coordinator.service.ResultAggregator;
import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for job groups (public API).
 *
 * POST /api/v1/groups - Start a group and poll it in the background
 * GET /api/v1/groups/{groupId} - Group snapshot
 * POST /api/v1/groups/{groupId}/cancel - Cancel open jobs
 * GET /api/v1/groups/{groupId}/aggregate - Aggregate a terminal group
 */
public class GroupController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(GroupController.class);

    private static final Pattern GROUPS_PATTERN = Pattern.compile("^/api/v1/groups$");
    private static final Pattern GROUP_BY_ID_PATTERN = Pattern.compile("^/api/v1/groups/([^/]+)$");
    private static final Pattern GROUP_CANCEL_PATTERN = Pattern.compile("^/api/v1/groups/([^/]+)/cancel$");
    private static final Pattern GROUP_AGGREGATE_PATTERN = Pattern.compile("^/api/v1/groups/([^/]+)/aggregate$");

    private final Orchestrator orchestrator;
    private final ResultAggregator aggregator;

    public GroupController(Orchestrator orchestrator, ResultAggregator aggregator) {
        this.orchestrator = orchestrator;
        this.aggregator = aggregator;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.POST)) {
            return GROUPS_PATTERN.matcher(path).matches() || GROUP_CANCEL_PATTERN.matcher(path).matches();
        }
        if (method.equals(HttpMethod.GET)) {
            return GROUP_BY_ID_PATTERN.matcher(path).matches() || GROUP_AGGREGATE_PATTERN.matcher(path).matches();
        }
        return false;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (req.method().equals(HttpMethod.POST) && GROUPS_PATTERN.matcher(path).matches()) {
                return handleStart(req);
            }

            Matcher cancelMatcher = GROUP_CANCEL_PATTERN.matcher(path);
            if (req.method().equals(HttpMethod.POST) && cancelMatcher.matches()) {
                return handleCancel(cancelMatcher.group(1));
            }

            Matcher aggregateMatcher = GROUP_AGGREGATE_PATTERN.matcher(path);
            if (req.method().equals(HttpMethod.GET) && aggregateMatcher.matches()) {
                return handleAggregate(aggregateMatcher.group(1));
            }

            Matcher groupMatcher = GROUP_BY_ID_PATTERN.matcher(path);
            if (req.method().equals(HttpMethod.GET) && groupMatcher.matches()) {
                return handleGet(groupMatcher.group(1));
            }

            return ControllerResponse.notFound("unknown group endpoint");

        } catch (JsonProcessingException e) {
            return ControllerResponse.badRequest("malformed request body: " + e.getOriginalMessage());
        } catch (RuntimeException e) {
            ControllerResponse mapped = ControllerResponse.forException(e);
            if (mapped != null) {
                log.debug("Group request {} {} rejected: {}", req.method(), path, e.getMessage());
                return mapped;
            }
            log.error("Group controller error", e);
            return ControllerResponse.error("internal error");
        }
    }

    /**
     * POST /api/v1/groups
     */
    private ControllerResponse handleStart(FullHttpRequest req) throws JsonProcessingException {
        String body = req.content().toString(StandardCharsets.UTF_8);
        StartGroupRequest request = RouterHandler.mapper().readValue(body, StartGroupRequest.class);
        request.validate();

        String groupId = orchestrator.startGroup(
                request.datasetReference(),
                request.algorithmReference(),
                request.computeConfig(),
                request.environment(),
                request.partitionConfig());
        orchestrator.pollGroupAsync(groupId);

        GroupResponse response = GroupResponse.from(orchestrator.groupSnapshot(groupId));
        return ControllerResponse.json(
                HttpResponseStatus.CREATED,
                RouterHandler.mapper().writeValueAsString(response));
    }

    /**
     * GET /api/v1/groups/{groupId}
     */
    private ControllerResponse handleGet(String groupId) throws JsonProcessingException {
        GroupResponse response = GroupResponse.from(orchestrator.groupSnapshot(groupId));
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
    }

    /**
     * POST /api/v1/groups/{groupId}/cancel
     */
    private ControllerResponse handleCancel(String groupId) throws JsonProcessingException {
        int cancelled = orchestrator.cancelGroup(groupId);
        Map<String, Object> response = Map.of(
                "groupId", groupId,
                "cancelledJobs", cancelled);
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
    }

    /**
     * GET /api/v1/groups/{groupId}/aggregate
     */
    private ControllerResponse handleAggregate(String groupId) throws JsonProcessingException {
        AggregateResult result = aggregator.aggregate(groupId);
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(result));
    }
}
