package com.flagship.medexchange_ledger.ledger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.medexchange_ledger.error.FailedPreconditionException;
import com.flagship.medexchange_ledger.error.InsufficientBalanceException;
import com.flagship.medexchange_ledger.error.InvalidArgumentException;
import com.flagship.medexchange_ledger.money.CurrencyCode;
import com.flagship.medexchange_ledger.observability.LedgerMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Posts balance changes and their ledger entries.
 *
 * Every {@link #debit} and {@link #credit} does, in one transaction:
 * 1. Re-read the wallet under a row lock
 * 2. For a debit, reject with {@link InsufficientBalanceException} if balance < amount
 * 3. Write the new balance (the CHECK constraint rejects a negative one)
 * 4. Append one COMPLETED ledger entry
 *
 * Ledger rows are never updated or deleted; a trigger on {@code ledger_entries}
 * rejects both. Corrections are new entries (e.g. a REFUND referencing the
 * original delivery payment).
 *
 * Exactly-once semantics for external events are the caller's concern: wrap
 * the posting with {@code IdempotencyGuard} in the same transaction.
 */
@Service
@Slf4j
public class LedgerService {

    private static final String SELECT_ENTRY =
        "SELECT id, user_id, entry_type, amount, currency, status, description, reference_type, " +
        "reference_id, balance_after, metadata::text AS metadata, created_at, sequence_number " +
        "FROM ledger_entries ";

    private final JdbcTemplate jdbcTemplate;
    private final WalletService walletService;
    private final ObjectMapper objectMapper;
    private final LedgerMetrics metrics;

    public LedgerService(JdbcTemplate jdbcTemplate, WalletService walletService,
                         ObjectMapper objectMapper, LedgerMetrics metrics) {
        this.jdbcTemplate = jdbcTemplate;
        this.walletService = walletService;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
    }

    /**
     * Takes money out of a wallet.
     *
     * @throws InsufficientBalanceException if the locked balance is below the amount
     * @throws FailedPreconditionException if the wallet is held in another currency
     */
    @Transactional
    public LedgerEntry debit(PostingRequest request) {
        validate(request, LedgerEntryType.Direction.OUT);

        Wallet wallet = walletService.lockWallet(request.getUserId());
        requireSameCurrency(wallet, request.getCurrency());

        if (wallet.getBalance() < request.getAmount()) {
            metrics.recordPosting(request.getType().name(), "out", "insufficient_balance");
            throw new InsufficientBalanceException(request.getUserId(), wallet.getBalance(), request.getAmount());
        }

        long newBalance = wallet.getBalance() - request.getAmount();
        walletService.updateBalance(request.getUserId(), newBalance);
        LedgerEntry entry = insertEntry(request, LedgerEntryStatus.COMPLETED, newBalance);

        metrics.recordPosting(request.getType().name(), "out", "completed");
        log.info("Debited {} {} from {} ({}), balance={}",
                request.getAmount(), request.getCurrency(), request.getUserId(), request.getType(), newBalance);
        return entry;
    }

    /**
     * Puts money into a wallet.
     */
    @Transactional
    public LedgerEntry credit(PostingRequest request) {
        validate(request, LedgerEntryType.Direction.IN);

        Wallet wallet = walletService.lockWallet(request.getUserId());
        requireSameCurrency(wallet, request.getCurrency());

        long newBalance = Math.addExact(wallet.getBalance(), request.getAmount());
        walletService.updateBalance(request.getUserId(), newBalance);
        LedgerEntry entry = insertEntry(request, LedgerEntryStatus.COMPLETED, newBalance);

        metrics.recordPosting(request.getType().name(), "in", "completed");
        log.info("Credited {} {} to {} ({}), balance={}",
                request.getAmount(), request.getCurrency(), request.getUserId(), request.getType(), newBalance);
        return entry;
    }

    /**
     * Appends an entry that documents a request without moving money, e.g. a
     * PENDING top-up at initiation and a FAILED one when the provider declines.
     */
    @Transactional
    public LedgerEntry record(PostingRequest request, LedgerEntryStatus status) {
        if (status == LedgerEntryStatus.COMPLETED) {
            throw new IllegalArgumentException("Completed entries must go through debit or credit");
        }
        validate(request, request.getType() != null ? request.getType().getDirection() : null);
        LedgerEntry entry = insertEntry(request, status, null);
        metrics.recordPosting(request.getType().name(),
                request.getType().getDirection().name().toLowerCase(), status.name().toLowerCase());
        return entry;
    }

    @Transactional(readOnly = true)
    public List<LedgerEntry> entriesForUser(String userId, int limit) {
        return jdbcTemplate.query(
            SELECT_ENTRY + "WHERE user_id = ? ORDER BY sequence_number DESC LIMIT ?",
            ledgerEntryRowMapper(),
            userId,
            limit
        );
    }

    @Transactional(readOnly = true)
    public List<LedgerEntry> entriesForReference(String referenceType, String referenceId) {
        return jdbcTemplate.query(
            SELECT_ENTRY + "WHERE reference_type = ? AND reference_id = ? ORDER BY sequence_number",
            ledgerEntryRowMapper(),
            referenceType,
            referenceId
        );
    }

    private void validate(PostingRequest request, LedgerEntryType.Direction expected) {
        if (request.getUserId() == null || request.getUserId().isBlank()) {
            throw new InvalidArgumentException("Posting requires a user id");
        }
        if (request.getAmount() <= 0) {
            throw new InvalidArgumentException("Posting amount must be positive");
        }
        if (request.getCurrency() == null) {
            throw new InvalidArgumentException("Posting requires a currency");
        }
        if (request.getType() == null) {
            throw new InvalidArgumentException("Posting requires an entry type");
        }
        if (request.getType().getDirection() != expected) {
            throw new InvalidArgumentException(
                String.format("Entry type %s cannot be posted as %s", request.getType(), expected));
        }
    }

    private void requireSameCurrency(Wallet wallet, CurrencyCode currency) {
        if (wallet.getCurrency() != currency) {
            throw new FailedPreconditionException(
                String.format("Wallet currency %s does not match %s", wallet.getCurrency(), currency));
        }
    }

    private LedgerEntry insertEntry(PostingRequest request, LedgerEntryStatus status, Long balanceAfter) {
        UUID entryId = UUID.randomUUID();
        LedgerReference reference = request.getReference();
        jdbcTemplate.update(
            "INSERT INTO ledger_entries (id, user_id, entry_type, amount, currency, status, description, " +
            "reference_type, reference_id, balance_after, metadata, created_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, CAST(? AS jsonb), CURRENT_TIMESTAMP)",
            entryId,
            request.getUserId(),
            request.getType().name(),
            request.getAmount(),
            request.getCurrency().name(),
            status.name(),
            request.getDescription(),
            reference != null ? reference.type() : null,
            reference != null ? reference.id() : null,
            balanceAfter,
            toJson(request)
        );
        return jdbcTemplate.queryForObject(SELECT_ENTRY + "WHERE id = ?", ledgerEntryRowMapper(), entryId);
    }

    private String toJson(PostingRequest request) {
        if (request.getMetadata() == null || request.getMetadata().isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(request.getMetadata());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Ledger metadata is not serializable", e);
        }
    }

    private RowMapper<LedgerEntry> ledgerEntryRowMapper() {
        return (rs, rowNum) -> new LedgerEntry(
            rs.getObject("id", UUID.class),
            rs.getString("user_id"),
            LedgerEntryType.valueOf(rs.getString("entry_type")),
            rs.getLong("amount"),
            CurrencyCode.valueOf(rs.getString("currency")),
            LedgerEntryStatus.valueOf(rs.getString("status")),
            rs.getString("description"),
            rs.getString("reference_type"),
            rs.getString("reference_id"),
            (Long) rs.getObject("balance_after"),
            rs.getString("metadata"),
            rs.getObject("created_at", OffsetDateTime.class).toInstant(),
            rs.getLong("sequence_number")
        );
    }
}
