package agora.market.repository;

import agora.market.model.Account;
import agora.market.model.PaymentChannel;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Durable store for ledger state.
 */
public interface LedgerRepository {

    List<Account> findAllAccounts();

    List<PaymentChannel> findAllChannels();

    /** Channels that are not yet CLOSED */
    List<PaymentChannel> findActiveChannels();

    /** Channels where the owner is payer or payee, in any state */
    List<PaymentChannel> findChannelsFor(String ownerId);

    /** Sum of {@code totalSettled} over CLOSED channels */
    BigDecimal settledInClosedChannels();

    Optional<Account> findAccount(String ownerId);

    Optional<PaymentChannel> findChannel(String channelId);

    /**
     * Persist the touched accounts and channel in one transaction.
     *
     * @param channel may be null when only accounts changed
     */
    void saveAll(Collection<Account> accounts, PaymentChannel channel);
}
