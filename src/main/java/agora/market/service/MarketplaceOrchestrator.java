package agora.market.service;

import agora.market.config.MarketConfig;
import agora.market.exception.AuctionClosedException;
import agora.market.exception.AuctionExpiredException;
import agora.market.exception.InsufficientBiddersException;
import agora.market.exception.InsufficientFundsException;
import agora.market.exception.InvalidAuctionSpecException;
import agora.market.exception.NoEligibleWorkersException;
import agora.market.exception.WorkerNotFoundException;
import agora.market.gateway.ExecutionGateway;
import agora.market.metrics.MarketMetrics;
import agora.market.model.AllocationResult;
import agora.market.model.AuctionSpec;
import agora.market.model.Bid;
import agora.market.model.ChannelState;
import agora.market.model.DiscoveryResult;
import agora.market.model.EscrowOutcome;
import agora.market.model.ExecutionResult;
import agora.market.model.Money;
import agora.market.model.NotAllocatedReason;
import agora.market.model.PaymentChannel;
import agora.market.model.SettlementOutcome;
import agora.market.model.TaskAuction;
import agora.market.model.TaskSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * End-to-end allocation of a task:
 * discover -> auction -> open channel -> lock escrow -> execute -> settle -> close channel.
 *
 * Every call ends in exactly one of SETTLED, REFUNDED or NOT_ALLOCATED. The ledger is
 * touched only after an auction has been awarded and the requester can pay.
 */
public class MarketplaceOrchestrator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MarketplaceOrchestrator.class);

    /** Extra time granted to the auction wait beyond the bidding window */
    private static final Duration AUCTION_WAIT_SLACK = Duration.ofSeconds(1);

    private final CapabilityIndex index;
    private final AuctionCoordinator auctions;
    private final EscrowLedger ledger;
    private final SettlementCoordinator settlement;
    private final ExecutionGateway execution;
    private final MarketConfig config;
    private final MarketMetrics metrics;
    private final ExecutorService executionExecutor;

    public MarketplaceOrchestrator(CapabilityIndex index, AuctionCoordinator auctions, EscrowLedger ledger,
            SettlementCoordinator settlement, ExecutionGateway execution, MarketConfig config,
            MarketMetrics metrics) {
        this.index = index;
        this.auctions = auctions;
        this.ledger = ledger;
        this.settlement = settlement;
        this.execution = execution;
        this.config = config;
        this.metrics = metrics;
        this.executionExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "agora-execution");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Allocate a task to the best worker and settle payment for it.
     *
     * @throws InvalidAuctionSpecException or InvalidQueryException for malformed task specs
     */
    public AllocationResult allocateAndSettle(TaskSpec task) {
        validate(task);
        log.info("Allocating task {} for {}", task.taskId(), task.requesterId());

        // 1. Discover
        List<String> candidates;
        try {
            candidates = discoverCandidates(task);
        } catch (NoEligibleWorkersException e) {
            return notAllocated(task, null, NotAllocatedReason.NO_ELIGIBLE_WORKERS, e.getMessage());
        }

        // 2. Auction
        AuctionSpec auctionSpec = task.toAuctionSpec();
        TaskAuction auction = auctions.createAuction(auctionSpec, candidates);
        Duration window = auctionSpec.duration() != null ? auctionSpec.duration() : config.auctionDuration();
        auction = auctions.awaitOutcome(auction.id(), window.plus(AUCTION_WAIT_SLACK));

        Bid winner;
        try {
            winner = auctions.requireWinner(auction);
        } catch (InsufficientBiddersException e) {
            return notAllocated(task, auction.id(), NotAllocatedReason.INSUFFICIENT_BIDDERS, e.getMessage());
        } catch (AuctionExpiredException e) {
            return notAllocated(task, auction.id(), NotAllocatedReason.AUCTION_EXPIRED, e.getMessage());
        } catch (AuctionClosedException e) {
            return notAllocated(task, auction.id(), NotAllocatedReason.AUCTION_CANCELED, e.getMessage());
        }
        BigDecimal price = auction.finalPrice();

        // 3. Fund the channel and lock escrow
        if (ledger.getBalance(task.requesterId()).compareTo(price) < 0) {
            return notAllocated(task, auction.id(), NotAllocatedReason.INSUFFICIENT_FUNDS,
                    "requester balance " + ledger.getBalance(task.requesterId()).toPlainString()
                            + " below price " + price.toPlainString());
        }
        PaymentChannel channel;
        try {
            channel = ledger.openChannel(task.requesterId(), winner.workerId(), price, auction.id());
        } catch (InsufficientFundsException e) {
            return notAllocated(task, auction.id(), NotAllocatedReason.INSUFFICIENT_FUNDS, e.getMessage());
        }
        try {
            ledger.lockEscrow(channel.id(), task.taskId(), price);
        } catch (RuntimeException e) {
            log.error("Escrow lock for task {} on channel {} failed", task.taskId(), channel.id(), e);
            closeQuietly(channel.id());
            return notAllocated(task, auction.id(), NotAllocatedReason.LEDGER_FAILURE, e.getMessage());
        }
        acquireLoad(winner.workerId());

        // 4. Execute
        ExecutionResult result = execute(task, winner.workerId());

        // 5. Settle
        SettlementOutcome outcome;
        try {
            outcome = settlement.settle(channel.id(), task.taskId(), winner.workerId(), result,
                    winner.estimatedTime(), task.timeout());
        } catch (RuntimeException e) {
            log.error("Settlement of task {} on channel {} failed, refunding", task.taskId(), channel.id(), e);
            refundQuietly(channel.id(), task.taskId());
            closeQuietly(channel.id());
            releaseLoad(winner.workerId());
            metrics.allocationRefunded();
            return AllocationResult.refunded(task.taskId(), auction.id(), winner.workerId(), price, channel.id(),
                    "settlement failed: " + e.getMessage(), 0.0);
        }
        closeQuietly(channel.id());

        if (outcome.paid()) {
            metrics.allocationSettled();
            log.info("Task {} settled: {} paid {} (reputation {})", task.taskId(), winner.workerId(),
                    price.toPlainString(), String.format("%+.2f", outcome.reputationDelta()));
            return AllocationResult.settled(task.taskId(), auction.id(), winner.workerId(), price, channel.id(),
                    outcome.reputationDelta());
        }

        metrics.allocationRefunded();
        log.warn("Task {} refunded: {} failed ({})", task.taskId(), winner.workerId(), result.error());
        return AllocationResult.refunded(task.taskId(), auction.id(), winner.workerId(), price, channel.id(),
                result.error(), outcome.reputationDelta());
    }

    private List<String> discoverCandidates(TaskSpec task) {
        int limit = Math.max(config.maxBids(), config.minBidders());
        List<DiscoveryResult> found = index.query(task.toDiscoveryQuery(limit));
        if (found.size() < config.minBidders()) {
            throw new NoEligibleWorkersException("found " + found.size() + " eligible workers, need "
                    + config.minBidders());
        }
        return found.stream().map(r -> r.worker().id()).toList();
    }

    /**
     * Run the task on the winner, bounded by the task timeout. Exceptions and timeouts become
     * failed results.
     */
    private ExecutionResult execute(TaskSpec task, String workerId) {
        long started = System.nanoTime();
        Future<ExecutionResult> pending = executionExecutor.submit(() -> execution.execute(task, workerId));
        try {
            ExecutionResult result = pending.get(task.timeout().toMillis(), TimeUnit.MILLISECONDS);
            if (result == null) {
                return ExecutionResult.failure(elapsedSince(started), "execution returned no result");
            }
            return result;
        } catch (TimeoutException e) {
            pending.cancel(true);
            log.warn("Task {} on {} timed out after {}ms", task.taskId(), workerId, task.timeout().toMillis());
            return ExecutionResult.failure(elapsedSince(started), "execution timed out");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Task {} on {} failed: {}", task.taskId(), workerId, cause.toString());
            return ExecutionResult.failure(elapsedSince(started), "execution error: " + cause.getMessage());
        } catch (InterruptedException e) {
            pending.cancel(true);
            Thread.currentThread().interrupt();
            return ExecutionResult.failure(elapsedSince(started), "interrupted");
        }
    }

    private void acquireLoad(String workerId) {
        try {
            index.updateLoad(workerId, 1);
        } catch (WorkerNotFoundException e) {
            log.debug("Worker {} left after winning", workerId);
        }
    }

    /**
     * Close an allocation channel without failing the allocation. A channel left OPEN here is
     * closed later by the escrow reaper.
     */
    private void closeQuietly(String channelId) {
        try {
            ledger.closeChannel(channelId);
        } catch (RuntimeException e) {
            log.error("Failed to close channel {}, leaving it to the reaper", channelId, e);
        }
    }

    private void refundQuietly(String channelId, String taskId) {
        try {
            if (ledger.getChannel(channelId).state() == ChannelState.ESCROWED) {
                ledger.releaseEscrow(channelId, taskId, EscrowOutcome.FAILURE);
            }
        } catch (RuntimeException e) {
            log.error("Refund of task {} on channel {} failed, leaving it to the reaper", taskId, channelId, e);
        }
    }

    private void releaseLoad(String workerId) {
        try {
            index.updateLoad(workerId, -1);
        } catch (WorkerNotFoundException e) {
            log.debug("Worker {} left before load release", workerId);
        }
    }

    private AllocationResult notAllocated(TaskSpec task, String auctionId, NotAllocatedReason reason,
            String detail) {
        metrics.allocationNotAllocated();
        log.warn("Task {} not allocated: {} ({})", task.taskId(), reason, detail);
        return AllocationResult.notAllocated(task.taskId(), auctionId, reason, detail);
    }

    private static void validate(TaskSpec task) {
        if (task.taskId() == null || task.taskId().isBlank()) {
            throw new InvalidAuctionSpecException("taskId is required");
        }
        if (task.requesterId() == null || task.requesterId().isBlank()) {
            throw new InvalidAuctionSpecException("requesterId is required");
        }
        if (!Money.isPositive(task.maxPrice())) {
            throw new InvalidAuctionSpecException("maxPrice must be positive");
        }
        if (task.timeout().isNegative() || task.timeout().isZero()) {
            throw new InvalidAuctionSpecException("timeout must be positive");
        }
    }

    private static Duration elapsedSince(long startedNanos) {
        return Duration.ofNanos(System.nanoTime() - startedNanos);
    }

    @Override
    public void close() {
        executionExecutor.shutdownNow();
    }
}
