package agora.market.service;

import agora.market.config.MarketConfig;
import agora.market.exception.AuctionClosedException;
import agora.market.exception.AuctionExpiredException;
import agora.market.exception.AuctionNotFoundException;
import agora.market.exception.InsufficientBiddersException;
import agora.market.exception.InvalidAuctionSpecException;
import agora.market.exception.InvalidBidException;
import agora.market.gateway.TransportGateway;
import agora.market.metrics.MarketMetrics;
import agora.market.model.AuctionInvite;
import agora.market.model.AuctionKind;
import agora.market.model.AuctionSpec;
import agora.market.model.AuctionStats;
import agora.market.model.AuctionStatus;
import agora.market.model.Bid;
import agora.market.model.BidRequest;
import agora.market.model.Money;
import agora.market.model.TaskAuction;
import agora.market.repository.AuctionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs sealed-bid auctions, one per task.
 *
 * Every auction has its own lock; bids on different auctions never contend.
 * State changes are written through to the repository before the in-memory
 * snapshot is swapped. Invitations are delivered outside of any lock.
 */
public class AuctionCoordinator {

    private static final Logger log = LoggerFactory.getLogger(AuctionCoordinator.class);

    static final double WEIGHT_PRICE = 0.40;
    static final double WEIGHT_REPUTATION = 0.30;
    static final double WEIGHT_QUALITY = 0.20;
    static final double WEIGHT_SPEED = 0.10;

    private final AuctionRepository repository;
    private final TransportGateway transport;
    private final MarketConfig config;
    private final MarketMetrics metrics;

    private final Map<String, AuctionSlot> auctions = new ConcurrentHashMap<>();
    private final Map<String, String> auctionsByTask = new ConcurrentHashMap<>();

    public AuctionCoordinator(AuctionRepository repository, TransportGateway transport,
            MarketConfig config, MarketMetrics metrics) {
        this.repository = repository;
        this.transport = transport;
        this.config = config;
        this.metrics = metrics;
    }

    /**
     * Open an auction and invite the candidate workers.
     *
     * @throws InvalidAuctionSpecException if the parameters are inconsistent
     */
    public TaskAuction createAuction(AuctionSpec spec, List<String> candidateWorkerIds) {
        validate(spec);

        Duration duration = spec.duration() != null ? spec.duration() : config.auctionDuration();
        AuctionKind kind = spec.kind() != null ? spec.kind() : config.defaultAuctionKind();
        Instant now = Instant.now();

        TaskAuction auction = TaskAuction.builder()
                .id("auc-" + UUID.randomUUID())
                .taskId(spec.taskId())
                .requesterId(spec.requesterId())
                .kind(kind)
                .status(AuctionStatus.OPEN)
                .reservePrice(spec.reservePrice())
                .maxPrice(spec.maxPrice())
                .minReputation(spec.minReputation())
                .capabilities(spec.capabilities())
                .taskTimeoutMs(spec.taskTimeout() == null ? 0L : spec.taskTimeout().toMillis())
                .createdAt(now)
                .expiresAt(now.plus(duration))
                .build();

        repository.save(auction);
        auctions.put(auction.id(), new AuctionSlot(auction));
        auctionsByTask.put(auction.taskId(), auction.id());
        metrics.auctionCreated();

        log.info("Auction {} opened for task {} ({}, maxPrice={}, duration={}ms, {} candidates)",
                auction.id(), auction.taskId(), kind, auction.maxPrice().toPlainString(),
                duration.toMillis(), candidateWorkerIds.size());

        try {
            transport.broadcast(List.copyOf(candidateWorkerIds), AuctionInvite.of(auction));
        } catch (Exception e) {
            log.warn("Failed to deliver invitations for auction {}: {}", auction.id(), e.getMessage());
        }
        return auction;
    }

    /**
     * Validate, score and record a bid. Reaching the bid limit closes the auction.
     */
    public Bid submitBid(String auctionId, BidRequest request) {
        if (request == null || request.workerId() == null || request.workerId().isBlank()) {
            throw rejected(auctionId, "workerId is required");
        }

        AuctionSlot slot = requireOpenSlot(auctionId);
        slot.lock.lock();
        try {
            TaskAuction auction = slot.auction;
            if (!auction.isOpen()) {
                throw new AuctionClosedException("Auction " + auctionId + " is " + auction.status());
            }

            Instant now = Instant.now();
            if (auction.isExpiredAt(now)) {
                finalizeExpired(slot, now);
                throw new AuctionExpiredException("Auction " + auctionId + " expired at " + auction.expiresAt());
            }

            BigDecimal price = request.price() == null ? null : Money.normalize(request.price());
            if (!Money.isPositive(price)) {
                throw rejected(auctionId, "bid price must be positive");
            }
            if (price.compareTo(auction.maxPrice()) > 0) {
                throw rejected(auctionId, "bid price " + price.toPlainString() + " exceeds max price "
                        + auction.maxPrice().toPlainString());
            }
            if (auction.reservePrice().signum() > 0 && price.compareTo(auction.reservePrice()) < 0) {
                throw rejected(auctionId, "bid price " + price.toPlainString() + " below reserve price "
                        + auction.reservePrice().toPlainString());
            }
            if (auction.minReputation() > 0 && request.reputation() < auction.minReputation()) {
                throw rejected(auctionId, "reputation " + request.reputation() + " below minimum "
                        + auction.minReputation());
            }
            if (auction.hasBidFrom(request.workerId())) {
                throw rejected(auctionId, "worker " + request.workerId() + " already bid");
            }
            long estimatedMs = request.estimatedTime() == null ? 0L : request.estimatedTime().toMillis();
            if (estimatedMs < 0) {
                throw rejected(auctionId, "estimated time must not be negative");
            }

            Bid bid = new Bid(
                    "bid-" + UUID.randomUUID(),
                    auctionId,
                    request.workerId(),
                    price,
                    estimatedMs,
                    request.reputation(),
                    request.quality(),
                    now,
                    auction.bids().size() + 1,
                    compositeScore(price, auction.maxPrice(), request.reputation(), request.quality(),
                            estimatedMs, auction.taskTimeoutMs()));

            TaskAuction updated = auction.withBid(bid);
            if (updated.bids().size() >= config.maxBids()) {
                log.info("Auction {} reached {} bids, closing", auctionId, updated.bids().size());
                updated = decide(updated, now);
            }
            store(slot, updated);
            metrics.bidReceived();

            log.debug("Bid {} on auction {} from {} at {} (score {})", bid.id(), auctionId,
                    bid.workerId(), price.toPlainString(), String.format("%.4f", bid.score()));
            return bid;
        } finally {
            slot.lock.unlock();
        }
    }

    /**
     * Close an open auction and pick the winner. Already decided auctions are returned as is.
     */
    public TaskAuction closeAuction(String auctionId) {
        AuctionSlot slot = auctions.get(auctionId);
        if (slot == null) {
            return repository.findById(auctionId)
                    .orElseThrow(() -> new AuctionNotFoundException("Auction not found: " + auctionId));
        }
        slot.lock.lock();
        try {
            if (slot.auction.isOpen()) {
                store(slot, decide(slot.auction, Instant.now()));
            }
            return slot.auction;
        } finally {
            slot.lock.unlock();
        }
    }

    public TaskAuction cancelAuction(String auctionId) {
        AuctionSlot slot = requireOpenSlot(auctionId);
        slot.lock.lock();
        try {
            TaskAuction auction = slot.auction;
            if (!auction.isOpen()) {
                throw new AuctionClosedException("Auction " + auctionId + " is " + auction.status());
            }
            store(slot, auction.toBuilder()
                    .status(AuctionStatus.CANCELED)
                    .closedAt(Instant.now())
                    .build());
            log.info("Auction {} canceled", auctionId);
            return slot.auction;
        } finally {
            slot.lock.unlock();
        }
    }

    /**
     * Wait until the auction is decided, its window ends or the timeout passes, then close it.
     * No lock is held while waiting.
     */
    public TaskAuction awaitOutcome(String auctionId, Duration timeout) {
        AuctionSlot slot = auctions.get(auctionId);
        if (slot == null) {
            return getAuction(auctionId);
        }

        long deadline = System.nanoTime() + timeout.toNanos();
        boolean interrupted = false;

        slot.lock.lock();
        try {
            while (slot.auction.isOpen()) {
                long untilDeadline = deadline - System.nanoTime();
                long untilExpiry = Duration.between(Instant.now(), slot.auction.expiresAt()).toNanos();
                long wait = Math.min(untilDeadline, untilExpiry);
                if (wait <= 0) {
                    break;
                }
                try {
                    slot.decided.awaitNanos(wait);
                } catch (InterruptedException e) {
                    interrupted = true;
                    break;
                }
            }

            if (slot.auction.isOpen()) {
                Instant now = Instant.now();
                if (slot.auction.isExpiredAt(now)) {
                    finalizeExpired(slot, now);
                } else {
                    store(slot, decide(slot.auction, now));
                }
            }
            return slot.auction;
        } finally {
            slot.lock.unlock();
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Winning bid of a decided auction.
     *
     * @throws InsufficientBiddersException if too few bids were received
     * @throws AuctionExpiredException      if the window ended without bids
     * @throws AuctionClosedException       if the auction was canceled or is still open
     */
    public Bid requireWinner(TaskAuction auction) {
        switch (auction.status()) {
            case AWARDED:
                return auction.winningBid()
                        .orElseThrow(() -> new IllegalStateException("Awarded auction without winner: " + auction.id()));
            case INSUFFICIENT_BIDDERS:
                throw new InsufficientBiddersException("Auction " + auction.id() + " received "
                        + auction.bids().size() + " bids, need " + config.minBidders());
            case EXPIRED:
                throw new AuctionExpiredException("Auction " + auction.id() + " expired without bids");
            default:
                throw new AuctionClosedException("Auction " + auction.id() + " is " + auction.status());
        }
    }

    public TaskAuction getAuction(String auctionId) {
        AuctionSlot slot = auctions.get(auctionId);
        if (slot != null) {
            return slot.auction;
        }
        return repository.findById(auctionId)
                .orElseThrow(() -> new AuctionNotFoundException("Auction not found: " + auctionId));
    }

    public Optional<TaskAuction> findByTask(String taskId) {
        String auctionId = auctionsByTask.get(taskId);
        if (auctionId != null) {
            AuctionSlot slot = auctions.get(auctionId);
            if (slot != null) {
                return Optional.of(slot.auction);
            }
        }
        return repository.findByTaskId(taskId);
    }

    /** Auctions currently accepting bids, oldest first */
    public List<TaskAuction> openAuctions() {
        return auctions.values().stream()
                .map(slot -> slot.auction)
                .filter(TaskAuction::isOpen)
                .sorted(Comparator.comparing(TaskAuction::createdAt))
                .toList();
    }

    /**
     * Finalize auctions whose window has ended and evict decided auctions past the retention window.
     *
     * @return number of auctions finalized
     */
    public int sweepExpired() {
        Instant now = Instant.now();
        Instant evictBefore = now.minus(config.auctionRetention());
        int finalized = 0;
        int evicted = 0;

        for (Map.Entry<String, AuctionSlot> entry : auctions.entrySet()) {
            AuctionSlot slot = entry.getValue();
            TaskAuction auction = slot.auction;

            if (auction.isOpen() && auction.isExpiredAt(now)) {
                slot.lock.lock();
                try {
                    if (slot.auction.isOpen()) {
                        finalizeExpired(slot, now);
                        finalized++;
                    }
                } catch (RuntimeException e) {
                    log.error("Failed to finalize auction {}", auction.id(), e);
                } finally {
                    slot.lock.unlock();
                }
            } else if (auction.status().isDecided() && auction.closedAt() != null
                    && auction.closedAt().isBefore(evictBefore)) {
                auctions.remove(entry.getKey(), slot);
                auctionsByTask.remove(auction.taskId(), auction.id());
                evicted++;
            }
        }

        if (finalized > 0 || evicted > 0) {
            log.info("Auction sweep: {} finalized, {} evicted", finalized, evicted);
        }
        return finalized;
    }

    public AuctionStats stats() {
        List<TaskAuction> all = repository.findAll();

        Map<AuctionStatus, Long> byStatus = new EnumMap<>(AuctionStatus.class);
        for (AuctionStatus status : AuctionStatus.values()) {
            byStatus.put(status, 0L);
        }

        long totalBids = 0;
        long awarded = 0;
        BigDecimal priceSum = Money.ZERO;
        for (TaskAuction auction : all) {
            byStatus.merge(auction.status(), 1L, Long::sum);
            totalBids += auction.bids().size();
            if (auction.status() == AuctionStatus.AWARDED && auction.finalPrice() != null) {
                awarded++;
                priceSum = priceSum.add(auction.finalPrice());
            }
        }

        double averageBids = all.isEmpty() ? 0.0 : (double) totalBids / all.size();
        BigDecimal averagePrice = awarded == 0 ? Money.ZERO
                : priceSum.divide(BigDecimal.valueOf(awarded), Money.SCALE, RoundingMode.HALF_EVEN);
        return new AuctionStats(byStatus, all.size(), totalBids, averageBids, averagePrice);
    }

    /**
     * CompositeScore in [0, 1]: cheaper, more reputable, higher quality and faster bids score higher.
     */
    public static double compositeScore(BigDecimal price, BigDecimal maxPrice, double reputation,
            double quality, long estimatedTimeMs, long taskTimeoutMs) {
        double priceScore = maxPrice.signum() > 0
                ? clamp01(1.0 - price.doubleValue() / maxPrice.doubleValue())
                : 0.0;
        double speedScore = taskTimeoutMs > 0
                ? clamp01(1.0 - (double) estimatedTimeMs / taskTimeoutMs)
                : 0.0;
        return WEIGHT_PRICE * priceScore
                + WEIGHT_REPUTATION * clamp01(reputation / 100.0)
                + WEIGHT_QUALITY * clamp01(quality / 100.0)
                + WEIGHT_SPEED * speedScore;
    }

    /** Highest score wins; equal scores go to the earliest bid */
    static Bid selectWinner(List<Bid> bids) {
        Bid best = null;
        for (Bid bid : bids) {
            if (best == null
                    || bid.score() > best.score()
                    || (bid.score() == best.score() && bid.sequence() < best.sequence())) {
                best = bid;
            }
        }
        return best;
    }

    private TaskAuction decide(TaskAuction auction, Instant now) {
        List<Bid> bids = auction.bids();
        if (bids.isEmpty() || bids.size() < config.minBidders()) {
            log.warn("Auction {} closed with {} bids (minimum {})", auction.id(), bids.size(), config.minBidders());
            return auction.toBuilder()
                    .status(AuctionStatus.INSUFFICIENT_BIDDERS)
                    .closedAt(now)
                    .build();
        }

        Bid winner = selectWinner(bids);
        BigDecimal price = Money.normalize(auction.kind().clearingPrice(winner, bids, auction.reservePrice()));
        log.info("Auction {} awarded to {} at {} ({} bids, {})", auction.id(), winner.workerId(),
                price.toPlainString(), bids.size(), auction.kind());
        return auction.toBuilder()
                .status(AuctionStatus.AWARDED)
                .winningBid(winner)
                .finalPrice(price)
                .closedAt(now)
                .build();
    }

    // Caller holds the slot lock
    private void finalizeExpired(AuctionSlot slot, Instant now) {
        TaskAuction auction = slot.auction;
        if (auction.bids().isEmpty()) {
            log.info("Auction {} expired without bids", auction.id());
            store(slot, auction.toBuilder().status(AuctionStatus.EXPIRED).closedAt(now).build());
        } else {
            store(slot, decide(auction, now));
        }
    }

    // Caller holds the slot lock
    private void store(AuctionSlot slot, TaskAuction updated) {
        boolean wasOpen = slot.auction.isOpen();
        repository.save(updated);
        slot.auction = updated;

        if (wasOpen && updated.status().isDecided()) {
            switch (updated.status()) {
                case AWARDED -> metrics.auctionAwarded(updated.finalPrice());
                case INSUFFICIENT_BIDDERS -> metrics.auctionInsufficientBidders();
                case EXPIRED -> metrics.auctionExpired();
                case CANCELED -> metrics.auctionCanceled();
                default -> {
                }
            }
            slot.decided.signalAll();
        }
    }

    private AuctionSlot requireOpenSlot(String auctionId) {
        AuctionSlot slot = auctions.get(auctionId);
        if (slot != null) {
            return slot;
        }
        // Evicted auctions are always decided
        TaskAuction stored = repository.findById(auctionId)
                .orElseThrow(() -> new AuctionNotFoundException("Auction not found: " + auctionId));
        throw new AuctionClosedException("Auction " + auctionId + " is " + stored.status());
    }

    private InvalidBidException rejected(String auctionId, String reason) {
        metrics.bidRejected();
        log.warn("Bid rejected on auction {}: {}", auctionId, reason);
        return new InvalidBidException(reason);
    }

    private static void validate(AuctionSpec spec) {
        if (spec.taskId() == null || spec.taskId().isBlank()) {
            throw new InvalidAuctionSpecException("taskId is required");
        }
        if (spec.requesterId() == null || spec.requesterId().isBlank()) {
            throw new InvalidAuctionSpecException("requesterId is required");
        }
        if (!Money.isPositive(spec.maxPrice())) {
            throw new InvalidAuctionSpecException("maxPrice must be positive");
        }
        if (Money.isNegative(spec.reservePrice())) {
            throw new InvalidAuctionSpecException("reservePrice must not be negative");
        }
        if (spec.maxPrice().compareTo(spec.reservePrice()) < 0) {
            throw new InvalidAuctionSpecException("maxPrice must not be below reservePrice");
        }
        if (spec.duration() != null && (spec.duration().isNegative() || spec.duration().isZero())) {
            throw new InvalidAuctionSpecException("duration must be positive");
        }
    }

    private static double clamp01(double v) {
        return Math.max(0.0, Math.min(1.0, v));
    }

    private static final class AuctionSlot {
        final ReentrantLock lock = new ReentrantLock();
        final Condition decided = lock.newCondition();
        volatile TaskAuction auction;

        AuctionSlot(TaskAuction auction) {
            this.auction = auction;
        }
    }
}
