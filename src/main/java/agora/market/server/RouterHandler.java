package agora.market.server;

import agora.market.api.Controller;
import agora.market.api.Controller.ControllerResponse;
import agora.market.config.MarketConfig;
import agora.market.exception.MarketException;
import agora.market.util.Json;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.*;
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
 * Only handles versioned API endpoints:
 * - /api/v1/* (public API)
 * - /internal/v1/* (worker agent API)
 *
 * All other endpoints return 404.
 *
 * This handler is @Sharable because it has no per-channel state.
 */
@Sharable
public class RouterHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private static final Logger log = LoggerFactory.getLogger(RouterHandler.class);

    public static final String AGENT_KEY_HEADER = "X-Agora-Key";

    private final List<Controller> controllers = new ArrayList<>();
    private final MarketConfig config;

    public RouterHandler(MarketConfig config) {
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
        String uri = req.uri();
        HttpMethod method = req.method();

        // Extract path without query string
        String path = uri.contains("?") ? uri.substring(0, uri.indexOf("?")) : uri;

        try {
            if (!checkAuth(req, path)) {
                log.warn("Auth failed for {} {}", method, path);
                writeSafe(ctx, FORBIDDEN, "application/json", "{\"error\":\"forbidden\"}");
                return;
            }

            for (Controller controller : controllers) {
                if (controller.matches(method, path)) {
                    ControllerResponse response = controller.handle(ctx, req, path);
                    writeSafe(ctx, response.status(), response.contentType(), response.body());
                    return;
                }
            }

            log.debug("No handler for: {} {}", method, path);
            writeSafe(ctx, NOT_FOUND, "application/json", "{\"error\":\"not found\"}");

        } catch (MarketException e) {
            log.warn("{} {} rejected ({}): {}", method, path, e.kind(), e.getMessage());
            ControllerResponse response = ControllerResponse.failure(e);
            writeSafe(ctx, response.status(), response.contentType(), response.body());
        } catch (IllegalArgumentException e) {
            log.warn("Validation error: {}", e.getMessage());
            writeSafe(ctx, BAD_REQUEST, "application/json",
                    "{\"error\":\"" + escapeJson(e.getMessage()) + "\"}");
        } catch (Exception e) {
            log.error("Handler error: {} {}", method, path, e);
            writeSafe(ctx, INTERNAL_SERVER_ERROR, "application/json",
                    "{\"error\":\"" + escapeJson(e.toString()) + "\"}");
        }
    }

    /**
     * Check if request requires and passes auth.
     */
    private boolean checkAuth(FullHttpRequest req, String path) {
        if (!config.hasAgentKey()) {
            return true; // No auth configured
        }

        // Only internal endpoints require auth
        if (!path.startsWith("/internal/")) {
            return true;
        }

        String providedKey = req.headers().get(AGENT_KEY_HEADER);
        return config.agentKey().equals(providedKey);
    }

    /**
     * Safe write that catches any exceptions during response writing.
     */
    private void writeSafe(ChannelHandlerContext ctx, HttpResponseStatus status, String contentType, String body) {
        try {
            if (body == null) {
                body = "";
            }
            byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
            FullHttpResponse response = new DefaultFullHttpResponse(HTTP_1_1, status, Unpooled.wrappedBuffer(bytes));
            response.headers().set(CONTENT_TYPE, contentType + "; charset=utf-8");
            response.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, bytes.length);
            ctx.writeAndFlush(response);
        } catch (Exception e) {
            log.error("Failed to write response: {}", e.getMessage(), e);
            ctx.close();
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("Unhandled exception in channel: {}", cause.getMessage(), cause);
        try {
            writeSafe(ctx, INTERNAL_SERVER_ERROR, "application/json",
                    "{\"error\":\"channel error: " + escapeJson(cause.getMessage()) + "\"}");
        } finally {
            ctx.close();
        }
    }

    private static String escapeJson(String s) {
        if (s == null)
            return "";
        return s.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n").replace("\r", "\\r");
    }

    /**
     * Get the shared ObjectMapper for JSON serialization.
     */
    public static ObjectMapper mapper() {
        return Json.mapper();
    }
}
