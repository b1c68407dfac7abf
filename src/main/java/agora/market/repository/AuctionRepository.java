package agora.market.repository;

import agora.market.model.TaskAuction;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for auctions. Bids are stored with their auction.
 */
public interface AuctionRepository {

    /** Insert or replace the auction row */
    void save(TaskAuction auction);

    Optional<TaskAuction> findById(String auctionId);

    /** Most recent auction for the task */
    Optional<TaskAuction> findByTaskId(String taskId);

    List<TaskAuction> findAll();

    List<TaskAuction> findOpen();
}
