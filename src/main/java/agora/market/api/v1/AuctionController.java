package agora.market.api.v1;

import agora.market.api.Controller;
import agora.market.api.v1.dto.AuctionResponse;
import agora.market.api.v1.dto.BidResponse;
import agora.market.api.v1.dto.CreateAuctionRequest;
import agora.market.api.v1.dto.SubmitBidRequest;
import agora.market.exception.MarketException;
import agora.market.model.Bid;
import agora.market.model.TaskAuction;
import agora.market.server.RouterHandler;
import agora.market.service.AuctionCoordinator;
import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for task auctions (public API).
 *
 * POST /api/v1/auctions - Open an auction
 * GET /api/v1/auctions - List open auctions
 * GET /api/v1/auctions/stats - Aggregate statistics
 * GET /api/v1/auctions/{id} - Auction status with bids
 * POST /api/v1/auctions/{id}/bids - Submit a bid
 * POST /api/v1/auctions/{id}/close - Close and pick the winner
 * POST /api/v1/auctions/{id}/cancel - Cancel an open auction
 */
public class AuctionController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(AuctionController.class);

    private static final Pattern AUCTIONS_PATTERN = Pattern.compile("^/api/v1/auctions$");
    private static final Pattern STATS_PATTERN = Pattern.compile("^/api/v1/auctions/stats$");
    private static final Pattern AUCTION_BY_ID_PATTERN = Pattern.compile("^/api/v1/auctions/([^/]+)$");
    private static final Pattern AUCTION_ACTION_PATTERN = Pattern
            .compile("^/api/v1/auctions/([^/]+)/(bids|close|cancel)$");

    private final AuctionCoordinator auctions;

    public AuctionController(AuctionCoordinator auctions) {
        this.auctions = auctions;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.POST)) {
            return AUCTIONS_PATTERN.matcher(path).matches() || AUCTION_ACTION_PATTERN.matcher(path).matches();
        }
        if (method.equals(HttpMethod.GET)) {
            return AUCTIONS_PATTERN.matcher(path).matches() || AUCTION_BY_ID_PATTERN.matcher(path).matches();
        }
        return false;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            boolean post = req.method().equals(HttpMethod.POST);

            if (AUCTIONS_PATTERN.matcher(path).matches()) {
                return post ? handleCreate(req) : handleListOpen();
            }

            if (!post && STATS_PATTERN.matcher(path).matches()) {
                return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(auctions.stats()));
            }

            Matcher actionMatcher = AUCTION_ACTION_PATTERN.matcher(path);
            if (post && actionMatcher.matches()) {
                String auctionId = actionMatcher.group(1);
                return switch (actionMatcher.group(2)) {
                    case "bids" -> handleBid(auctionId, req);
                    case "close" -> auctionJson(auctions.closeAuction(auctionId));
                    default -> auctionJson(auctions.cancelAuction(auctionId));
                };
            }

            Matcher idMatcher = AUCTION_BY_ID_PATTERN.matcher(path);
            if (!post && idMatcher.matches()) {
                return auctionJson(auctions.getAuction(idMatcher.group(1)));
            }

            return ControllerResponse.notFound("unknown auction endpoint");

        } catch (MarketException e) {
            return ControllerResponse.failure(e);
        } catch (IllegalArgumentException | JsonProcessingException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Auction controller error", e);
            return ControllerResponse.error("internal error");
        }
    }

    /**
     * POST /api/v1/auctions
     */
    private ControllerResponse handleCreate(FullHttpRequest req) throws Exception {
        String body = req.content().toString(StandardCharsets.UTF_8);
        CreateAuctionRequest request = RouterHandler.mapper().readValue(body, CreateAuctionRequest.class);
        request.validate();

        TaskAuction auction = auctions.createAuction(request.toSpec(), request.candidateIds());

        return ControllerResponse.json(
                HttpResponseStatus.CREATED,
                RouterHandler.mapper().writeValueAsString(AuctionResponse.from(auction)));
    }

    /**
     * POST /api/v1/auctions/{id}/bids
     */
    private ControllerResponse handleBid(String auctionId, FullHttpRequest req) throws Exception {
        String body = req.content().toString(StandardCharsets.UTF_8);
        SubmitBidRequest request = RouterHandler.mapper().readValue(body, SubmitBidRequest.class);
        request.validate();

        Bid bid = auctions.submitBid(auctionId, request.toBidRequest());

        return ControllerResponse.json(
                HttpResponseStatus.CREATED,
                RouterHandler.mapper().writeValueAsString(BidResponse.from(bid)));
    }

    /**
     * GET /api/v1/auctions
     */
    private ControllerResponse handleListOpen() throws Exception {
        List<AuctionResponse> open = auctions.openAuctions().stream()
                .map(AuctionResponse::from)
                .toList();

        Map<String, Object> response = Map.of(
                "count", open.size(),
                "auctions", open);
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
    }

    private ControllerResponse auctionJson(TaskAuction auction) throws Exception {
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(AuctionResponse.from(auction)));
    }
}
