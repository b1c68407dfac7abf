package agora.market.api;

import agora.market.exception.MarketException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;

/**
 * Base interface for HTTP controllers.
 * Controllers handle specific URL patterns and HTTP methods.
 */
public interface Controller {

    /**
     * Check if this controller can handle the given request.
     *
     * @param method HTTP method
     * @param path   Request path (without query string)
     * @return true if this controller handles this request
     */
    boolean matches(HttpMethod method, String path);

    /**
     * Handle the request.
     *
     * @param ctx  Netty channel context
     * @param req  Full HTTP request
     * @param path Request path (without query string)
     * @return Response to send back
     */
    ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path);

    /**
     * Response from a controller.
     */
    record ControllerResponse(
            HttpResponseStatus status,
            String contentType,
            String body) {

        public static ControllerResponse json(String body) {
            return new ControllerResponse(HttpResponseStatus.OK, "application/json", body);
        }

        public static ControllerResponse json(HttpResponseStatus status, String body) {
            return new ControllerResponse(status, "application/json", body);
        }

        public static ControllerResponse text(String body) {
            return new ControllerResponse(HttpResponseStatus.OK, "text/plain", body);
        }

        public static ControllerResponse notFound(String message) {
            return errorJson(HttpResponseStatus.NOT_FOUND, message);
        }

        public static ControllerResponse badRequest(String message) {
            return errorJson(HttpResponseStatus.BAD_REQUEST, message);
        }

        public static ControllerResponse error(String message) {
            return errorJson(HttpResponseStatus.INTERNAL_SERVER_ERROR, message);
        }

        public static ControllerResponse conflict(String message) {
            return errorJson(HttpResponseStatus.CONFLICT, message);
        }

        /**
         * Map a typed marketplace failure to its HTTP status.
         */
        public static ControllerResponse failure(MarketException e) {
            return errorJson(statusFor(e), e.getMessage());
        }

        public static HttpResponseStatus statusFor(MarketException e) {
            return switch (e.kind()) {
                case VALIDATION -> HttpResponseStatus.BAD_REQUEST;
                case NOT_FOUND -> HttpResponseStatus.NOT_FOUND;
                case BUSINESS_RULE -> HttpResponseStatus.CONFLICT;
                case COLLABORATOR -> HttpResponseStatus.BAD_GATEWAY;
                case STORAGE -> HttpResponseStatus.SERVICE_UNAVAILABLE;
                case INVARIANT -> HttpResponseStatus.INTERNAL_SERVER_ERROR;
            };
        }

        private static ControllerResponse errorJson(HttpResponseStatus status, String message) {
            return new ControllerResponse(status, "application/json",
                    "{\"error\":\"" + escapeJson(message) + "\"}");
        }

        private static String escapeJson(String s) {
            if (s == null)
                return "";
            return s.replace("\\", "\\\\").replace("\"", "\\\"");
        }
    }
}
