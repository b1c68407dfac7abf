package agora.market.model;

import java.math.BigDecimal;

/**
 * Result of a full allocate-and-settle flow.
 * Worker, price and channel are null when nothing was allocated.
 */
public record AllocationResult(
        AllocationStatus status,
        String taskId,
        String auctionId,
        String workerId,
        BigDecimal price,
        String channelId,
        NotAllocatedReason reason,
        String detail,
        double reputationDelta) {

    public static AllocationResult settled(String taskId, String auctionId, String workerId,
            BigDecimal price, String channelId, double reputationDelta) {
        return new AllocationResult(AllocationStatus.SETTLED, taskId, auctionId, workerId, price, channelId,
                null, null, reputationDelta);
    }

    public static AllocationResult refunded(String taskId, String auctionId, String workerId,
            BigDecimal price, String channelId, String detail, double reputationDelta) {
        return new AllocationResult(AllocationStatus.REFUNDED, taskId, auctionId, workerId, price, channelId,
                null, detail, reputationDelta);
    }

    public static AllocationResult notAllocated(String taskId, String auctionId, NotAllocatedReason reason,
            String detail) {
        return new AllocationResult(AllocationStatus.NOT_ALLOCATED, taskId, auctionId, null, null, null,
                reason, detail, 0.0);
    }
}
