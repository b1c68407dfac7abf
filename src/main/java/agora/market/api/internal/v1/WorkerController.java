package agora.market.api.internal.v1;

import agora.market.api.Controller;
import agora.market.api.internal.v1.dto.OperationResponse;
import agora.market.api.internal.v1.dto.RegisterWorkerRequest;
import agora.market.api.internal.v1.dto.StatusUpdateRequest;
import agora.market.api.internal.v1.dto.WorkerResponse;
import agora.market.exception.MarketException;
import agora.market.gateway.ReputationGateway;
import agora.market.model.WorkerRecord;
import agora.market.server.RouterHandler;
import agora.market.service.CapabilityIndex;
import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for worker registration and status (internal API).
 * POST /internal/v1/workers - Register or refresh a worker
 * DELETE /internal/v1/workers/{id} - Unregister a worker
 * POST /internal/v1/workers/{id}/status - Change worker status
 */
public class WorkerController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(WorkerController.class);

    private static final Pattern WORKERS_PATTERN = Pattern.compile("^/internal/v1/workers$");
    private static final Pattern WORKER_BY_ID_PATTERN = Pattern.compile("^/internal/v1/workers/([^/]+)$");
    private static final Pattern WORKER_STATUS_PATTERN = Pattern.compile("^/internal/v1/workers/([^/]+)/status$");

    private final CapabilityIndex index;
    private final ReputationGateway reputation;

    public WorkerController(CapabilityIndex index, ReputationGateway reputation) {
        this.index = index;
        this.reputation = reputation;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.POST)) {
            return WORKERS_PATTERN.matcher(path).matches() || WORKER_STATUS_PATTERN.matcher(path).matches();
        }
        if (method.equals(HttpMethod.DELETE)) {
            return WORKER_BY_ID_PATTERN.matcher(path).matches();
        }
        return false;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (req.method().equals(HttpMethod.POST) && WORKERS_PATTERN.matcher(path).matches()) {
                return handleRegister(req);
            }

            Matcher statusMatcher = WORKER_STATUS_PATTERN.matcher(path);
            if (req.method().equals(HttpMethod.POST) && statusMatcher.matches()) {
                return handleStatus(statusMatcher.group(1), req);
            }

            Matcher idMatcher = WORKER_BY_ID_PATTERN.matcher(path);
            if (req.method().equals(HttpMethod.DELETE) && idMatcher.matches()) {
                return handleUnregister(idMatcher.group(1));
            }

            return ControllerResponse.notFound("unknown worker endpoint");

        } catch (MarketException e) {
            return ControllerResponse.failure(e);
        } catch (IllegalArgumentException | JsonProcessingException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Worker controller error", e);
            return ControllerResponse.error("internal error");
        }
    }

    /**
     * POST /internal/v1/workers - Register a worker.
     * Reputation is taken from the reputation service, not from the request.
     */
    private ControllerResponse handleRegister(FullHttpRequest req) throws Exception {
        String body = req.content().toString(StandardCharsets.UTF_8);
        RegisterWorkerRequest request = RouterHandler.mapper().readValue(body, RegisterWorkerRequest.class);
        request.validate();

        double score = reputation.getScore(request.workerId());
        WorkerRecord registered = index.register(request.toRecord(score));

        return ControllerResponse.json(
                HttpResponseStatus.CREATED,
                RouterHandler.mapper().writeValueAsString(WorkerResponse.from(registered)));
    }

    /**
     * POST /internal/v1/workers/{id}/status
     */
    private ControllerResponse handleStatus(String workerId, FullHttpRequest req) throws Exception {
        String body = req.content().toString(StandardCharsets.UTF_8);
        StatusUpdateRequest request = RouterHandler.mapper().readValue(body, StatusUpdateRequest.class);
        request.validate();

        WorkerRecord updated = index.updateStatus(workerId, request.parsedStatus());
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(WorkerResponse.from(updated)));
    }

    /**
     * DELETE /internal/v1/workers/{id}
     */
    private ControllerResponse handleUnregister(String workerId) throws Exception {
        if (!index.unregister(workerId)) {
            return ControllerResponse.json(HttpResponseStatus.NOT_FOUND,
                    RouterHandler.mapper().writeValueAsString(OperationResponse.workerNotFound()));
        }
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(OperationResponse.success()));
    }
}
