package agora.market.store;

import agora.market.model.AuctionKind;
import agora.market.model.AuctionStatus;
import agora.market.model.Bid;
import agora.market.model.TaskAuction;
import agora.market.repository.AuctionRepository;
import agora.market.util.Json;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * JDBC implementation of AuctionRepository.
 */
public class JdbcAuctionRepository implements AuctionRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcAuctionRepository.class);

    private static final TypeReference<List<Bid>> BID_LIST = new TypeReference<>() {
    };
    private static final TypeReference<Set<String>> STRING_SET = new TypeReference<>() {
    };

    private final Database db;

    public JdbcAuctionRepository(Database db) {
        this.db = db;
    }

    @Override
    public void save(TaskAuction auction) {
        String sql = """
                    MERGE INTO auctions (id, task_id, requester_id, kind, status, reserve_price, max_price,
                                         min_reputation, capabilities, task_timeout_ms, created_at, expires_at,
                                         closed_at, bids, winning_bid_id, final_price)
                    KEY (id)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, auction.id());
            ps.setString(2, auction.taskId());
            ps.setString(3, auction.requesterId());
            ps.setString(4, auction.kind().name());
            ps.setString(5, auction.status().name());
            ps.setBigDecimal(6, auction.reservePrice());
            ps.setBigDecimal(7, auction.maxPrice());
            ps.setDouble(8, auction.minReputation());
            ps.setString(9, toJson(auction.capabilities()));
            ps.setLong(10, auction.taskTimeoutMs());
            setTimestamp(ps, 11, auction.createdAt());
            setTimestamp(ps, 12, auction.expiresAt());
            setTimestamp(ps, 13, auction.closedAt());
            ps.setString(14, toJson(auction.bids()));
            ps.setString(15, auction.winningBid().map(Bid::id).orElse(null));
            ps.setBigDecimal(16, auction.finalPrice());

            ps.executeUpdate();
            conn.commit();

            log.debug("Saved auction: {} ({})", auction.id(), auction.status());
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save auction: " + auction.id(), e);
        }
    }

    @Override
    public Optional<TaskAuction> findById(String auctionId) {
        String sql = "SELECT * FROM auctions WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, auctionId);
            List<TaskAuction> rows = executeQuery(ps);
            return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find auction: " + auctionId, e);
        }
    }

    @Override
    public Optional<TaskAuction> findByTaskId(String taskId) {
        String sql = "SELECT * FROM auctions WHERE task_id = ? ORDER BY created_at DESC LIMIT 1";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, taskId);
            List<TaskAuction> rows = executeQuery(ps);
            return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find auction for task: " + taskId, e);
        }
    }

    @Override
    public List<TaskAuction> findAll() {
        String sql = "SELECT * FROM auctions ORDER BY created_at DESC";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list auctions", e);
        }
    }

    @Override
    public List<TaskAuction> findOpen() {
        String sql = "SELECT * FROM auctions WHERE status = ? ORDER BY expires_at";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, AuctionStatus.OPEN.name());
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list open auctions", e);
        }
    }

    private List<TaskAuction> executeQuery(PreparedStatement ps) throws SQLException {
        List<TaskAuction> results = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                results.add(mapRow(rs));
            }
        }
        return results;
    }

    private TaskAuction mapRow(ResultSet rs) throws SQLException {
        List<Bid> bids = fromJson(rs.getString("bids"), BID_LIST);
        String winningBidId = rs.getString("winning_bid_id");
        Bid winner = winningBidId == null ? null
                : bids.stream().filter(b -> b.id().equals(winningBidId)).findFirst().orElse(null);

        return TaskAuction.builder()
                .id(rs.getString("id"))
                .taskId(rs.getString("task_id"))
                .requesterId(rs.getString("requester_id"))
                .kind(AuctionKind.valueOf(rs.getString("kind")))
                .status(AuctionStatus.valueOf(rs.getString("status")))
                .reservePrice(rs.getBigDecimal("reserve_price"))
                .maxPrice(rs.getBigDecimal("max_price"))
                .minReputation(rs.getDouble("min_reputation"))
                .capabilities(fromJson(rs.getString("capabilities"), STRING_SET))
                .taskTimeoutMs(rs.getLong("task_timeout_ms"))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .expiresAt(toInstant(rs.getTimestamp("expires_at")))
                .closedAt(toInstant(rs.getTimestamp("closed_at")))
                .bids(bids)
                .winningBid(winner)
                .finalPrice(rs.getBigDecimal("final_price"))
                .build();
    }

    private static String toJson(Object value) {
        try {
            return Json.mapper().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize auction column", e);
        }
    }

    private static <T> T fromJson(String json, TypeReference<T> type) {
        if (json == null || json.isBlank()) {
            json = "[]";
        }
        try {
            return Json.mapper().readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to parse auction column", e);
        }
    }

    private static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }

    private static void setTimestamp(PreparedStatement ps, int index, Instant instant) throws SQLException {
        if (instant != null) {
            ps.setTimestamp(index, Timestamp.from(instant));
        } else {
            ps.setNull(index, Types.TIMESTAMP);
        }
    }
}
