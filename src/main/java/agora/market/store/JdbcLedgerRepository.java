package agora.market.store;

import agora.market.model.Account;
import agora.market.model.ChannelState;
import agora.market.model.ChannelTransaction;
import agora.market.model.Money;
import agora.market.model.PaymentChannel;
import agora.market.model.ReleaseResult;
import agora.market.repository.LedgerRepository;
import agora.market.util.Json;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * JDBC implementation of LedgerRepository.
 * Channel transaction logs and the last release are stored as JSON columns.
 */
public class JdbcLedgerRepository implements LedgerRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcLedgerRepository.class);

    private static final TypeReference<List<ChannelTransaction>> TX_LIST = new TypeReference<>() {
    };

    private final Database db;

    public JdbcLedgerRepository(Database db) {
        this.db = db;
    }

    @Override
    public List<Account> findAllAccounts() {
        String sql = "SELECT * FROM accounts ORDER BY owner_id";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {

            List<Account> results = new ArrayList<>();
            while (rs.next()) {
                results.add(mapAccount(rs));
            }
            return results;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load accounts", e);
        }
    }

    @Override
    public List<PaymentChannel> findAllChannels() {
        String sql = "SELECT * FROM channels ORDER BY created_at";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {

            List<PaymentChannel> results = new ArrayList<>();
            while (rs.next()) {
                results.add(mapChannel(rs));
            }
            return results;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load channels", e);
        }
    }

    @Override
    public List<PaymentChannel> findActiveChannels() {
        String sql = "SELECT * FROM channels WHERE state <> 'CLOSED' ORDER BY created_at";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {

            List<PaymentChannel> results = new ArrayList<>();
            while (rs.next()) {
                results.add(mapChannel(rs));
            }
            return results;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load active channels", e);
        }
    }

    @Override
    public List<PaymentChannel> findChannelsFor(String ownerId) {
        String sql = "SELECT * FROM channels WHERE payer_id = ? OR payee_id = ? ORDER BY created_at DESC";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, ownerId);
            ps.setString(2, ownerId);
            try (ResultSet rs = ps.executeQuery()) {
                List<PaymentChannel> results = new ArrayList<>();
                while (rs.next()) {
                    results.add(mapChannel(rs));
                }
                return results;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load channels of " + ownerId, e);
        }
    }

    @Override
    public BigDecimal settledInClosedChannels() {
        String sql = "SELECT COALESCE(SUM(total_settled), 0) FROM channels WHERE state = 'CLOSED'";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {

            return rs.next() ? Money.normalize(rs.getBigDecimal(1)) : Money.ZERO;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to sum settled amounts", e);
        }
    }

    @Override
    public Optional<Account> findAccount(String ownerId) {
        String sql = "SELECT * FROM accounts WHERE owner_id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, ownerId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapAccount(rs));
                }
                return Optional.empty();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find account: " + ownerId, e);
        }
    }

    @Override
    public Optional<PaymentChannel> findChannel(String channelId) {
        String sql = "SELECT * FROM channels WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, channelId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapChannel(rs));
                }
                return Optional.empty();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find channel: " + channelId, e);
        }
    }

    @Override
    public void saveAll(Collection<Account> accounts, PaymentChannel channel) {
        try (Connection conn = db.getConnection()) {
            try {
                for (Account account : accounts) {
                    upsertAccount(conn, account);
                }
                if (channel != null) {
                    upsertChannel(conn, channel);
                }
                conn.commit();
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            }
            log.debug("Saved {} account(s), channel={}", accounts.size(),
                    channel != null ? channel.id() : null);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save ledger state", e);
        }
    }

    private void upsertAccount(Connection conn, Account account) throws SQLException {
        String sql = """
                    MERGE INTO accounts (owner_id, balance, total_deposited, total_withdrawn, total_earned,
                                         total_spent, locked_in_channels, created_at, updated_at)
                    KEY (owner_id)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, account.ownerId());
            ps.setBigDecimal(2, account.balance());
            ps.setBigDecimal(3, account.totalDeposited());
            ps.setBigDecimal(4, account.totalWithdrawn());
            ps.setBigDecimal(5, account.totalEarned());
            ps.setBigDecimal(6, account.totalSpent());
            ps.setBigDecimal(7, account.lockedInChannels());
            setTimestamp(ps, 8, account.createdAt());
            setTimestamp(ps, 9, account.updatedAt());
            ps.executeUpdate();
        }
    }

    private void upsertChannel(Connection conn, PaymentChannel ch) throws SQLException {
        String sql = """
                    MERGE INTO channels (id, payer_id, payee_id, auction_ref, state, total_deposit, current_balance,
                                         escrowed_amount, total_settled, total_refunded, escrow_task_id,
                                         escrow_locked_at, escrow_released, last_release, seq, transactions,
                                         created_at, updated_at, closed_at)
                    KEY (id)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, ch.id());
            ps.setString(2, ch.payerId());
            ps.setString(3, ch.payeeId());
            ps.setString(4, ch.auctionRef());
            ps.setString(5, ch.state().name());
            ps.setBigDecimal(6, ch.totalDeposit());
            ps.setBigDecimal(7, ch.currentBalance());
            ps.setBigDecimal(8, ch.escrowedAmount());
            ps.setBigDecimal(9, ch.totalSettled());
            ps.setBigDecimal(10, ch.totalRefunded());
            ps.setString(11, ch.escrowTaskId());
            setTimestamp(ps, 12, ch.escrowLockedAt());
            ps.setBoolean(13, ch.escrowReleased());
            ps.setString(14, ch.lastRelease() != null ? toJson(ch.lastRelease()) : null);
            ps.setLong(15, ch.sequence());
            ps.setString(16, toJson(ch.transactions()));
            setTimestamp(ps, 17, ch.createdAt());
            setTimestamp(ps, 18, ch.updatedAt());
            setTimestamp(ps, 19, ch.closedAt());
            ps.executeUpdate();
        }
    }

    private Account mapAccount(ResultSet rs) throws SQLException {
        return Account.builder()
                .ownerId(rs.getString("owner_id"))
                .balance(rs.getBigDecimal("balance"))
                .totalDeposited(rs.getBigDecimal("total_deposited"))
                .totalWithdrawn(rs.getBigDecimal("total_withdrawn"))
                .totalEarned(rs.getBigDecimal("total_earned"))
                .totalSpent(rs.getBigDecimal("total_spent"))
                .lockedInChannels(rs.getBigDecimal("locked_in_channels"))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .updatedAt(toInstant(rs.getTimestamp("updated_at")))
                .build();
    }

    private PaymentChannel mapChannel(ResultSet rs) throws SQLException {
        String lastRelease = rs.getString("last_release");
        return PaymentChannel.builder()
                .id(rs.getString("id"))
                .payerId(rs.getString("payer_id"))
                .payeeId(rs.getString("payee_id"))
                .auctionRef(rs.getString("auction_ref"))
                .state(ChannelState.valueOf(rs.getString("state")))
                .totalDeposit(rs.getBigDecimal("total_deposit"))
                .currentBalance(rs.getBigDecimal("current_balance"))
                .escrowedAmount(rs.getBigDecimal("escrowed_amount"))
                .totalSettled(rs.getBigDecimal("total_settled"))
                .totalRefunded(rs.getBigDecimal("total_refunded"))
                .escrowTaskId(rs.getString("escrow_task_id"))
                .escrowLockedAt(toInstant(rs.getTimestamp("escrow_locked_at")))
                .escrowReleased(rs.getBoolean("escrow_released"))
                .lastRelease(lastRelease != null ? fromJson(lastRelease, ReleaseResult.class) : null)
                .sequence(rs.getLong("seq"))
                .transactions(readTransactions(rs.getString("transactions")))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .updatedAt(toInstant(rs.getTimestamp("updated_at")))
                .closedAt(toInstant(rs.getTimestamp("closed_at")))
                .build();
    }

    private static List<ChannelTransaction> readTransactions(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return Json.mapper().readValue(json, TX_LIST);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to parse channel transactions", e);
        }
    }

    private static String toJson(Object value) {
        try {
            return Json.mapper().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private static <T> T fromJson(String json, Class<T> type) {
        try {
            return Json.mapper().readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to parse " + type.getSimpleName(), e);
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
