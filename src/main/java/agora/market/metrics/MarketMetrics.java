package agora.market.metrics;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.DoubleAdder;
import java.util.concurrent.atomic.LongAdder;

/**
 * Process-wide counters for the marketplace core.
 * One instance is created by the dependency container and shared by all services.
 */
public final class MarketMetrics {

    /** Upper bounds of the winning price histogram */
    static final double[] PRICE_BUCKETS = { 0.01, 0.1, 1.0, 10.0, 100.0 };

    // Discovery
    private final LongAdder discoveryQueries = new LongAdder();
    private final LongAdder discoveryNanos = new LongAdder();
    private final LongAdder discoveryResults = new LongAdder();

    // Health
    private final LongAdder healthChecks = new LongAdder();
    private final LongAdder healthFailures = new LongAdder();
    private final LongAdder workersDemoted = new LongAdder();

    // Auctions
    private final LongAdder auctionsCreated = new LongAdder();
    private final LongAdder auctionsAwarded = new LongAdder();
    private final LongAdder auctionsInsufficient = new LongAdder();
    private final LongAdder auctionsExpired = new LongAdder();
    private final LongAdder auctionsCanceled = new LongAdder();
    private final LongAdder bidsReceived = new LongAdder();
    private final LongAdder bidsRejected = new LongAdder();
    private final DoubleAdder winningPriceSum = new DoubleAdder();
    private final LongAdder[] winningPriceBuckets = new LongAdder[PRICE_BUCKETS.length + 1];

    // Ledger
    private final LongAdder channelsOpened = new LongAdder();
    private final LongAdder channelsClosed = new LongAdder();
    private final LongAdder escrowsLocked = new LongAdder();
    private final LongAdder escrowsReleased = new LongAdder();
    private final LongAdder escrowsRefunded = new LongAdder();
    private final DoubleAdder releasedAmount = new DoubleAdder();
    private final DoubleAdder refundedAmount = new DoubleAdder();
    private final LongAdder invariantViolations = new LongAdder();

    // Allocation
    private final LongAdder allocationsSettled = new LongAdder();
    private final LongAdder allocationsRefunded = new LongAdder();
    private final LongAdder allocationsNotAllocated = new LongAdder();

    public MarketMetrics() {
        for (int i = 0; i < winningPriceBuckets.length; i++) {
            winningPriceBuckets[i] = new LongAdder();
        }
    }

    public void discoveryQuery(long elapsedNanos, int results) {
        discoveryQueries.increment();
        discoveryNanos.add(elapsedNanos);
        discoveryResults.add(results);
    }

    public void healthCheck(boolean success) {
        healthChecks.increment();
        if (!success) {
            healthFailures.increment();
        }
    }

    public void workerDemoted() {
        workersDemoted.increment();
    }

    public void auctionCreated() {
        auctionsCreated.increment();
    }

    public void auctionAwarded(BigDecimal price) {
        auctionsAwarded.increment();
        double value = price.doubleValue();
        winningPriceSum.add(value);
        int bucket = PRICE_BUCKETS.length;
        for (int i = 0; i < PRICE_BUCKETS.length; i++) {
            if (value <= PRICE_BUCKETS[i]) {
                bucket = i;
                break;
            }
        }
        winningPriceBuckets[bucket].increment();
    }

    public void auctionInsufficientBidders() {
        auctionsInsufficient.increment();
    }

    public void auctionExpired() {
        auctionsExpired.increment();
    }

    public void auctionCanceled() {
        auctionsCanceled.increment();
    }

    public void bidReceived() {
        bidsReceived.increment();
    }

    public void bidRejected() {
        bidsRejected.increment();
    }

    public void channelOpened() {
        channelsOpened.increment();
    }

    public void channelClosed() {
        channelsClosed.increment();
    }

    public void escrowLocked() {
        escrowsLocked.increment();
    }

    public void escrowReleased(BigDecimal amount) {
        escrowsReleased.increment();
        releasedAmount.add(amount.doubleValue());
    }

    public void escrowRefunded(BigDecimal amount) {
        escrowsRefunded.increment();
        refundedAmount.add(amount.doubleValue());
    }

    public void invariantViolation() {
        invariantViolations.increment();
    }

    public void allocationSettled() {
        allocationsSettled.increment();
    }

    public void allocationRefunded() {
        allocationsRefunded.increment();
    }

    public void allocationNotAllocated() {
        allocationsNotAllocated.increment();
    }

    public long invariantViolations() {
        return invariantViolations.sum();
    }

    public long auctionsCreated() {
        return auctionsCreated.sum();
    }

    public long bidsRejected() {
        return bidsRejected.sum();
    }

    public long workersDemoted() {
        return workersDemoted.sum();
    }

    /** Counter values keyed by exported metric name, in exposition order */
    public Map<String, Number> counters() {
        Map<String, Number> out = new LinkedHashMap<>();
        out.put("agora_discovery_queries_total", discoveryQueries.sum());
        out.put("agora_discovery_latency_seconds_total", discoveryNanos.sum() / 1_000_000_000.0);
        out.put("agora_discovery_results_total", discoveryResults.sum());
        out.put("agora_health_checks_total", healthChecks.sum());
        out.put("agora_health_check_failures_total", healthFailures.sum());
        out.put("agora_workers_demoted_total", workersDemoted.sum());
        out.put("agora_auctions_created_total", auctionsCreated.sum());
        out.put("agora_auctions_awarded_total", auctionsAwarded.sum());
        out.put("agora_auctions_insufficient_bidders_total", auctionsInsufficient.sum());
        out.put("agora_auctions_expired_total", auctionsExpired.sum());
        out.put("agora_auctions_canceled_total", auctionsCanceled.sum());
        out.put("agora_bids_received_total", bidsReceived.sum());
        out.put("agora_bids_rejected_total", bidsRejected.sum());
        out.put("agora_channels_opened_total", channelsOpened.sum());
        out.put("agora_channels_closed_total", channelsClosed.sum());
        out.put("agora_escrows_locked_total", escrowsLocked.sum());
        out.put("agora_escrows_released_total", escrowsReleased.sum());
        out.put("agora_escrows_refunded_total", escrowsRefunded.sum());
        out.put("agora_escrow_released_amount_total", releasedAmount.sum());
        out.put("agora_escrow_refunded_amount_total", refundedAmount.sum());
        out.put("agora_allocations_settled_total", allocationsSettled.sum());
        out.put("agora_allocations_refunded_total", allocationsRefunded.sum());
        out.put("agora_allocations_not_allocated_total", allocationsNotAllocated.sum());
        out.put("ledger_invariant_violations_total", invariantViolations.sum());
        return out;
    }

    /** Cumulative winning-price histogram counts keyed by upper bound ("+Inf" last) */
    public Map<String, Long> winningPriceHistogram() {
        Map<String, Long> out = new LinkedHashMap<>();
        long cumulative = 0;
        for (int i = 0; i < PRICE_BUCKETS.length; i++) {
            cumulative += winningPriceBuckets[i].sum();
            out.put(Double.toString(PRICE_BUCKETS[i]), cumulative);
        }
        cumulative += winningPriceBuckets[PRICE_BUCKETS.length].sum();
        out.put("+Inf", cumulative);
        return out;
    }

    public double winningPriceSum() {
        return winningPriceSum.sum();
    }

    public long auctionsAwarded() {
        return auctionsAwarded.sum();
    }
}
