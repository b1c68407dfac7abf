package agora.market.api.v1;

import agora.market.api.Controller;
import agora.market.metrics.MarketMetrics;
import agora.market.metrics.PrometheusFormatter;
import agora.market.service.CapabilityIndex;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;

/**
 * GET /api/v1/metrics - Prometheus text exposition
 */
public class MetricsController implements Controller {

    private final MarketMetrics metrics;
    private final CapabilityIndex index;

    public MetricsController(MarketMetrics metrics, CapabilityIndex index) {
        this.metrics = metrics;
        this.index = index;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/metrics".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        return ControllerResponse.text(PrometheusFormatter.format(metrics, index.countByStatus()));
    }
}
