package agora.market.api.v1;

import agora.market.api.Controller;
import agora.market.api.v1.dto.DiscoverRequest;
import agora.market.api.v1.dto.DiscoveryResponse;
import agora.market.exception.MarketException;
import agora.market.model.DiscoveryResult;
import agora.market.server.RouterHandler;
import agora.market.service.CapabilityIndex;
import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * POST /api/v1/discover - Ranked capability search
 */
public class DiscoveryController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(DiscoveryController.class);

    private final CapabilityIndex index;

    public DiscoveryController(CapabilityIndex index) {
        this.index = index;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.POST) && "/api/v1/discover".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            String body = req.content().toString(StandardCharsets.UTF_8);
            DiscoverRequest request = RouterHandler.mapper().readValue(body, DiscoverRequest.class);
            request.validate();

            List<DiscoveryResult> results = index.query(request.toQuery());
            return ControllerResponse.json(
                    RouterHandler.mapper().writeValueAsString(DiscoveryResponse.from(results)));

        } catch (MarketException e) {
            return ControllerResponse.failure(e);
        } catch (IllegalArgumentException | JsonProcessingException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Discovery controller error", e);
            return ControllerResponse.error("internal error");
        }
    }
}
