package agora.market.api.v1;

import agora.market.api.Controller;
import agora.market.api.v1.dto.HealthResponse;
import agora.market.model.LedgerAudit;
import agora.market.model.WorkerStatus;
import agora.market.server.RouterHandler;
import agora.market.service.AuctionCoordinator;
import agora.market.service.CapabilityIndex;
import agora.market.service.EscrowLedger;
import agora.market.store.Database;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health check controller.
 * GET /api/v1/health
 */
public class HealthController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);
    private static final String VERSION = "1.0.0";

    private final Database database;
    private final CapabilityIndex index;
    private final AuctionCoordinator auctions;
    private final EscrowLedger ledger;

    public HealthController(Database database, CapabilityIndex index, AuctionCoordinator auctions,
            EscrowLedger ledger) {
        this.database = database;
        this.index = index;
        this.auctions = auctions;
        this.ledger = ledger;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/health".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (!database.isHealthy()) {
                HealthResponse response = HealthResponse.unhealthy("connection failed");
                return ControllerResponse.json(
                        HttpResponseStatus.SERVICE_UNAVAILABLE,
                        RouterHandler.mapper().writeValueAsString(response));
            }

            Map<String, Long> workers = new LinkedHashMap<>();
            for (Map.Entry<WorkerStatus, Long> e : index.countByStatus().entrySet()) {
                workers.put(e.getKey().name().toLowerCase(), e.getValue());
            }
            LedgerAudit audit = ledger.verifyLedger();

            HealthResponse response = HealthResponse.healthy(
                    formatUptime(), VERSION, workers, auctions.openAuctions().size(), audit.balanced());

            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));

        } catch (Exception e) {
            log.error("Health check failed", e);
            try {
                HealthResponse response = HealthResponse.unhealthy(e.getMessage());
                return ControllerResponse.json(
                        HttpResponseStatus.SERVICE_UNAVAILABLE,
                        RouterHandler.mapper().writeValueAsString(response));
            } catch (Exception ex) {
                return ControllerResponse.error("health check failed");
            }
        }
    }

    private String formatUptime() {
        long uptimeMs = ManagementFactory.getRuntimeMXBean().getUptime();
        Duration duration = Duration.ofMillis(uptimeMs);
        long hours = duration.toHours();
        long minutes = duration.toMinutesPart();
        return hours + "h " + minutes + "m";
    }
}
