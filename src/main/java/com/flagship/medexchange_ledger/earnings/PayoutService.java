package com.flagship.medexchange_ledger.earnings;

import com.flagship.medexchange_ledger.audit.AuditAction;
import com.flagship.medexchange_ledger.audit.AuditService;
import com.flagship.medexchange_ledger.earnings.dto.CreatePayoutRequest;
import com.flagship.medexchange_ledger.earnings.dto.PayoutResponse;
import com.flagship.medexchange_ledger.error.AlreadyExistsException;
import com.flagship.medexchange_ledger.error.FailedPreconditionException;
import com.flagship.medexchange_ledger.error.InsufficientBalanceException;
import com.flagship.medexchange_ledger.error.InternalException;
import com.flagship.medexchange_ledger.error.InvalidArgumentException;
import com.flagship.medexchange_ledger.error.NotFoundException;
import com.flagship.medexchange_ledger.money.AmountValidation;
import com.flagship.medexchange_ledger.money.CurrencyCode;
import com.flagship.medexchange_ledger.money.MoneyNormalizer;
import com.flagship.medexchange_ledger.observability.CorrelationContext;
import com.flagship.medexchange_ledger.observability.LedgerMetrics;
import com.flagship.medexchange_ledger.provider.PaymentProviderClient;
import com.flagship.medexchange_ledger.provider.ProviderException;
import com.flagship.medexchange_ledger.provider.ProviderProperties;
import com.flagship.medexchange_ledger.provider.TransactionReferences;
import com.flagship.medexchange_ledger.provider.TransferRequest;
import com.flagship.medexchange_ledger.provider.TransferResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * Courier payouts.
 *
 * A request reserves the amount out of {@code available} and creates the
 * payout in one transaction, calls the provider outside any transaction, then
 * either records the transfer (PROCESSING) or, if the provider refused,
 * restores {@code available} and fails the payout in a compensating
 * transaction with its own audit record.
 *
 * The provider's transfer callback settles the payout later through
 * {@link #completePayout} or {@link #failPayout}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PayoutService {

    public static final String META_TYPE = "courier_payout";
    private static final String RESOURCE_TYPE = "courier_payout";

    private final CourierPayoutRepository payoutRepository;
    private final CourierEarningRepository earningRepository;
    private final CourierWalletService walletService;
    private final AuditService auditService;
    private final PaymentProviderClient providerClient;
    private final ProviderProperties providerProperties;
    private final EarningsProperties properties;
    private final TransactionTemplate transactionTemplate;
    private final LedgerMetrics metrics;
    private final Clock clock;

    public PayoutResponse requestPayout(String courierId, CreatePayoutRequest request) {
        CurrencyCode currency = CurrencyCode.fromCode(request.getCurrency())
                .orElseThrow(() -> new InvalidArgumentException("Unsupported currency: " + request.getCurrency()));
        AmountValidation validation = MoneyNormalizer.validateAmount(
                request.getAmount(), currency, properties.getMinPayoutAmount(), null);
        if (!validation.isValid()) {
            throw new InvalidArgumentException(validation.message());
        }

        PayoutDestination destination = PayoutDestination.fromWire(request.getDestinationType());
        String bankCode = resolveBankCode(destination, request);
        long amount = MoneyNormalizer.toSmallestUnit(request.getAmount(), currency);
        long fee = MoneyNormalizer.calculateFee(amount, properties.getPayoutFeePercent(), properties.getPayoutFeeCap());
        if (amount - fee <= 0) {
            throw new InvalidArgumentException("Payout amount does not cover the payout fee");
        }
        String reference = TransactionReferences.next(TransactionReferences.PAYOUT, clock);

        MDC.put(CorrelationContext.COURIER_ID_MDC_KEY, courierId);
        MDC.put(CorrelationContext.TX_REF_MDC_KEY, reference);
        try {
            CourierPayoutEntity payout = reserve(courierId, amount, fee, currency, reference,
                    destination, request.getAccountNumber(), bankCode, request.getAccountName());

            TransferResult transfer;
            try {
                transfer = providerClient.initiateTransfer(TransferRequest.builder()
                        .reference(reference)
                        .amount(MoneyNormalizer.fromSmallestUnit(payout.getNetAmount(), currency))
                        .currency(currency.name())
                        .accountNumber(payout.getAccountNumber())
                        .bankCode(payout.getBankCode())
                        .beneficiaryName(payout.getAccountName())
                        .narration("NowasteMed courier payout")
                        .meta(Map.of(
                                "source", providerProperties.getSourceTag(),
                                "type", META_TYPE,
                                "courier_id", courierId,
                                "payout_id", payout.getId().toString()))
                        .build());
            } catch (ProviderException e) {
                log.error("Provider refused payout {}: {}", reference, e.getMessage());
                transactionTemplate.executeWithoutResult(status -> revert(reference, e.getMessage()));
                metrics.recordPayout("rejected");
                throw new InternalException("Payment provider could not start the payout", e);
            }

            CourierPayoutEntity processing = transactionTemplate.execute(status -> {
                CourierPayoutEntity entity = lockByReference(reference);
                entity.markProcessing(transfer.providerTransferId());
                return entity;
            });
            metrics.recordPayout("processing");
            log.info("Payout {} submitted: amount={}, fee={}", reference,
                    MoneyNormalizer.formatForDisplay(amount, currency), MoneyNormalizer.formatForDisplay(fee, currency));
            return PayoutResponse.from(processing);
        } finally {
            MDC.remove(CorrelationContext.COURIER_ID_MDC_KEY);
            MDC.remove(CorrelationContext.TX_REF_MDC_KEY);
        }
    }

    /**
     * Provider confirmed the transfer: the money has left, so the wallet balance
     * drops and the payout is drawn from the oldest available earnings first. An
     * earning only partly covered keeps its remainder AVAILABLE.
     *
     * @return false if the payout was already settled
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public boolean completePayout(String reference, String providerTransferId) {
        CourierPayoutEntity payout = lockByReference(reference);
        if (!payout.getStatus().isOpen()) {
            log.warn("Ignoring completion of payout {}: already {}", reference, payout.getStatus());
            return false;
        }

        CourierWalletEntity wallet = walletService.lock(payout.getCourierId());
        wallet.settlePayout(payout.getAmount());

        long outstanding = payout.getAmount();
        int paidOut = 0;
        List<CourierEarningEntity> available =
                earningRepository.lockByCourierInStatus(payout.getCourierId(), CourierEarningStatus.AVAILABLE);
        for (CourierEarningEntity earning : available) {
            if (outstanding == 0) {
                break;
            }
            outstanding -= earning.drawForPayout(payout.getId(), outstanding, clock.instant());
            if (earning.getStatus() == CourierEarningStatus.PAID_OUT) {
                paidOut++;
            }
        }
        if (outstanding > 0) {
            log.error("Payout {} exceeds the available earnings of courier {} by {}",
                    reference, payout.getCourierId(), outstanding);
        }

        payout.markCompleted(providerTransferId, clock.instant());
        auditService.recordAs(payout.getCourierId(), AuditAction.PAYOUT_COMPLETED, RESOURCE_TYPE, payout.getId(),
                Map.of(
                        "reference", reference,
                        "amount", payout.getAmount(),
                        "earningsPaidOut", paidOut));
        metrics.recordPayout("completed");
        log.info("Payout {} completed for courier {}, {} earnings marked paid out",
                reference, payout.getCourierId(), paidOut);
        return true;
    }

    /**
     * Provider reported the transfer failed: the reserved amount goes back to {@code available}.
     *
     * @return false if the payout was already settled
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public boolean failPayout(String reference, String reason) {
        CourierPayoutEntity payout = lockByReference(reference);
        if (!payout.getStatus().isOpen()) {
            log.warn("Ignoring failure of payout {}: already {}", reference, payout.getStatus());
            return false;
        }
        revert(payout, reason);
        return true;
    }

    @Transactional(readOnly = true)
    public List<CourierPayoutEntity> recentPayouts(String courierId) {
        return payoutRepository.findTop20ByCourierIdOrderByRequestedAtDesc(courierId);
    }

    private CourierPayoutEntity reserve(String courierId, long amount, long fee, CurrencyCode currency,
                                        String reference, PayoutDestination destination,
                                        String accountNumber, String bankCode, String accountName) {
        try {
            return transactionTemplate.execute(status -> {
                CourierWalletEntity wallet = walletService.lock(courierId);
                if (wallet.getCurrency() != currency) {
                    throw new FailedPreconditionException(
                            String.format("Courier wallet is held in %s, not %s", wallet.getCurrency(), currency));
                }
                if (payoutRepository.existsByCourierIdAndStatusIn(courierId, PayoutStatus.OPEN)) {
                    throw new AlreadyExistsException("A payout is already in progress for this courier");
                }
                if (wallet.getAvailable() < amount) {
                    throw new InsufficientBalanceException(courierId, wallet.getAvailable(), amount);
                }

                wallet.reserveForPayout(amount);
                CourierPayoutEntity payout = payoutRepository.saveAndFlush(CourierPayoutEntity.create(
                        courierId, amount, fee, currency, reference, destination, accountNumber, bankCode,
                        accountName));

                auditService.recordAs(courierId, AuditAction.PAYOUT_REQUESTED, RESOURCE_TYPE, payout.getId(), Map.of(
                        "reference", reference,
                        "amount", amount,
                        "fee", fee,
                        "netAmount", payout.getNetAmount(),
                        "currency", currency.name()));
                return payout;
            });
        } catch (DataIntegrityViolationException e) {
            // Lost the race on the one-open-payout index
            throw new AlreadyExistsException("A payout is already in progress for this courier");
        }
    }

    private void revert(String reference, String reason) {
        revert(lockByReference(reference), reason);
    }

    private void revert(CourierPayoutEntity payout, String reason) {
        CourierWalletEntity wallet = walletService.lock(payout.getCourierId());
        wallet.restoreReservation(payout.getAmount());
        payout.markFailed(reason);

        auditService.recordAs(payout.getCourierId(), AuditAction.PAYOUT_REVERTED, RESOURCE_TYPE, payout.getId(),
                Map.of(
                        "reference", payout.getReference(),
                        "amount", payout.getAmount(),
                        "reason", reason != null ? reason : "unknown"));
        metrics.recordPayout("failed");
        log.warn("Payout {} failed, {} restored to courier {}: {}",
                payout.getReference(), payout.getAmount(), payout.getCourierId(), reason);
    }

    private String resolveBankCode(PayoutDestination destination, CreatePayoutRequest request) {
        if (destination == PayoutDestination.MOBILE_MONEY) {
            String network = providerProperties.getNetworks().get(request.getProviderId());
            if (network == null) {
                throw new InvalidArgumentException("Unknown mobile money provider: " + request.getProviderId());
            }
            return network;
        }
        if (request.getBankCode() == null || request.getBankCode().isBlank()) {
            throw new InvalidArgumentException("Bank code is required for bank transfers");
        }
        return request.getBankCode();
    }

    private CourierPayoutEntity lockByReference(String reference) {
        return payoutRepository.findByReferenceForUpdate(reference)
                .orElseThrow(() -> new NotFoundException("Payout not found: " + reference));
    }
}
