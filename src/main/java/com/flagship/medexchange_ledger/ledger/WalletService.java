package com.flagship.medexchange_ledger.ledger;

import com.flagship.medexchange_ledger.error.NotFoundException;
import com.flagship.medexchange_ledger.money.CurrencyCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Party wallets, accessed with plain JDBC so the row lock and the balance
 * CHECK constraint stay visible in the SQL.
 */
@Service
@Slf4j
public class WalletService {

    private static final String SELECT_WALLET =
        "SELECT user_id, balance, currency, created_at, updated_at FROM wallets WHERE user_id = ?";

    private final JdbcTemplate jdbcTemplate;

    public WalletService(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Opens an empty wallet. Opening an existing wallet is a no-op that returns it.
     */
    @Transactional
    public Wallet openWallet(String userId, CurrencyCode currency) {
        int inserted = jdbcTemplate.update(
            "INSERT INTO wallets (user_id, balance, currency) VALUES (?, 0, ?) ON CONFLICT (user_id) DO NOTHING",
            userId,
            currency.name()
        );
        if (inserted > 0) {
            log.info("Opened wallet for {} in {}", userId, currency);
        }
        return findWallet(userId).orElseThrow();
    }

    @Transactional(readOnly = true)
    public Optional<Wallet> findWallet(String userId) {
        List<Wallet> wallets = jdbcTemplate.query(SELECT_WALLET, walletRowMapper(), userId);
        return wallets.stream().findFirst();
    }

    @Transactional(readOnly = true)
    public Wallet getWallet(String userId) {
        return findWallet(userId)
            .orElseThrow(() -> new NotFoundException("Wallet not found for user " + userId));
    }

    /**
     * Re-reads the wallet under a row lock held until the surrounding
     * transaction ends. Concurrent balance mutations on the same wallet
     * serialize here.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Wallet lockWallet(String userId) {
        List<Wallet> wallets = jdbcTemplate.query(SELECT_WALLET + " FOR UPDATE", walletRowMapper(), userId);
        return wallets.stream().findFirst()
            .orElseThrow(() -> new NotFoundException("Wallet not found for user " + userId));
    }

    // Caller holds the row lock from lockWallet
    void updateBalance(String userId, long newBalance) {
        jdbcTemplate.update(
            "UPDATE wallets SET balance = ?, updated_at = CURRENT_TIMESTAMP WHERE user_id = ?",
            newBalance,
            userId
        );
    }

    private RowMapper<Wallet> walletRowMapper() {
        return (rs, rowNum) -> new Wallet(
            rs.getString("user_id"),
            rs.getLong("balance"),
            CurrencyCode.valueOf(rs.getString("currency")),
            rs.getObject("created_at", OffsetDateTime.class).toInstant(),
            rs.getObject("updated_at", OffsetDateTime.class).toInstant()
        );
    }
}
