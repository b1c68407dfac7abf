package agora.market.api.v1;

import agora.market.api.Controller;
import agora.market.api.v1.dto.AccountResponse;
import agora.market.api.v1.dto.AmountRequest;
import agora.market.api.v1.dto.ChannelResponse;
import agora.market.exception.MarketException;
import agora.market.model.Account;
import agora.market.model.ChannelTransaction;
import agora.market.server.RouterHandler;
import agora.market.service.EscrowLedger;
import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for accounts and payment channels (public API).
 *
 * POST /api/v1/accounts/{owner}/deposit
 * POST /api/v1/accounts/{owner}/withdraw
 * GET /api/v1/accounts/{owner}
 * GET /api/v1/accounts/{owner}/transactions
 * GET /api/v1/channels/{id}
 * GET /api/v1/ledger/audit
 */
public class LedgerController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(LedgerController.class);

    private static final Pattern ACCOUNT_PATTERN = Pattern.compile("^/api/v1/accounts/([^/]+)$");
    private static final Pattern ACCOUNT_MOVE_PATTERN = Pattern.compile("^/api/v1/accounts/([^/]+)/(deposit|withdraw)$");
    private static final Pattern ACCOUNT_HISTORY_PATTERN = Pattern.compile("^/api/v1/accounts/([^/]+)/transactions$");
    private static final Pattern CHANNEL_PATTERN = Pattern.compile("^/api/v1/channels/([^/]+)$");
    private static final String AUDIT_PATH = "/api/v1/ledger/audit";

    private final EscrowLedger ledger;

    public LedgerController(EscrowLedger ledger) {
        this.ledger = ledger;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.POST)) {
            return ACCOUNT_MOVE_PATTERN.matcher(path).matches();
        }
        if (method.equals(HttpMethod.GET)) {
            return ACCOUNT_PATTERN.matcher(path).matches()
                    || ACCOUNT_HISTORY_PATTERN.matcher(path).matches()
                    || CHANNEL_PATTERN.matcher(path).matches()
                    || AUDIT_PATH.equals(path);
        }
        return false;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            Matcher moveMatcher = ACCOUNT_MOVE_PATTERN.matcher(path);
            if (req.method().equals(HttpMethod.POST) && moveMatcher.matches()) {
                return handleMove(moveMatcher.group(1), moveMatcher.group(2), req);
            }

            Matcher accountMatcher = ACCOUNT_PATTERN.matcher(path);
            if (accountMatcher.matches()) {
                String ownerId = accountMatcher.group(1);
                Account account = ledger.findAccount(ownerId)
                        .orElseGet(() -> Account.open(ownerId, Instant.now()));
                return ControllerResponse.json(
                        RouterHandler.mapper().writeValueAsString(AccountResponse.from(account)));
            }

            Matcher historyMatcher = ACCOUNT_HISTORY_PATTERN.matcher(path);
            if (historyMatcher.matches()) {
                List<ChannelTransaction> history = ledger.transactionHistory(historyMatcher.group(1));
                Map<String, Object> response = Map.of(
                        "ownerId", historyMatcher.group(1),
                        "count", history.size(),
                        "transactions", history);
                return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
            }

            Matcher channelMatcher = CHANNEL_PATTERN.matcher(path);
            if (channelMatcher.matches()) {
                return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(
                        ChannelResponse.from(ledger.getChannel(channelMatcher.group(1)))));
            }

            if (AUDIT_PATH.equals(path)) {
                return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(ledger.verifyLedger()));
            }

            return ControllerResponse.notFound("unknown ledger endpoint");

        } catch (MarketException e) {
            return ControllerResponse.failure(e);
        } catch (IllegalArgumentException | JsonProcessingException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Ledger controller error", e);
            return ControllerResponse.error("internal error");
        }
    }

    /**
     * POST /api/v1/accounts/{owner}/deposit|withdraw
     */
    private ControllerResponse handleMove(String ownerId, String action, FullHttpRequest req) throws Exception {
        String body = req.content().toString(StandardCharsets.UTF_8);
        AmountRequest request = RouterHandler.mapper().readValue(body, AmountRequest.class);
        request.validate();

        Account account = "deposit".equals(action)
                ? ledger.deposit(ownerId, request.amount())
                : ledger.withdraw(ownerId, request.amount());

        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(AccountResponse.from(account)));
    }
}
