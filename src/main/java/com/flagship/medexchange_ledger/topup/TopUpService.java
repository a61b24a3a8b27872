package com.flagship.medexchange_ledger.topup;

import com.flagship.medexchange_ledger.audit.AuditAction;
import com.flagship.medexchange_ledger.audit.AuditService;
import com.flagship.medexchange_ledger.error.FailedPreconditionException;
import com.flagship.medexchange_ledger.error.InternalException;
import com.flagship.medexchange_ledger.error.InvalidArgumentException;
import com.flagship.medexchange_ledger.error.NotFoundException;
import com.flagship.medexchange_ledger.ledger.LedgerEntryStatus;
import com.flagship.medexchange_ledger.ledger.LedgerEntryType;
import com.flagship.medexchange_ledger.ledger.LedgerReference;
import com.flagship.medexchange_ledger.ledger.LedgerService;
import com.flagship.medexchange_ledger.ledger.PostingRequest;
import com.flagship.medexchange_ledger.ledger.Wallet;
import com.flagship.medexchange_ledger.ledger.WalletService;
import com.flagship.medexchange_ledger.money.AmountValidation;
import com.flagship.medexchange_ledger.money.CurrencyCode;
import com.flagship.medexchange_ledger.money.MoneyNormalizer;
import com.flagship.medexchange_ledger.observability.CorrelationContext;
import com.flagship.medexchange_ledger.provider.ChargeRequest;
import com.flagship.medexchange_ledger.provider.ChargeResult;
import com.flagship.medexchange_ledger.provider.PaymentProviderClient;
import com.flagship.medexchange_ledger.provider.ProviderException;
import com.flagship.medexchange_ledger.provider.ProviderProperties;
import com.flagship.medexchange_ledger.provider.TransactionReferences;
import com.flagship.medexchange_ledger.topup.dto.CreateTopUpRequest;
import com.flagship.medexchange_ledger.topup.dto.TopUpResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.util.Map;

/**
 * Wallet top-ups: initiation against the provider, and resolution when the
 * provider's notification arrives.
 *
 * Initiation runs in three short transactions around the provider call so no
 * database transaction is held open across the network:
 * 1. Create the PENDING request and its PENDING ledger marker
 * 2. Call the provider (no transaction)
 * 3. Store the provider reference, or mark the request FAILED
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TopUpService {

    public static final String META_TYPE = "wallet_topup";
    private static final String RESOURCE_TYPE = "topup_request";

    private final TopUpRequestRepository repository;
    private final WalletService walletService;
    private final LedgerService ledgerService;
    private final AuditService auditService;
    private final PaymentProviderClient providerClient;
    private final ProviderProperties providerProperties;
    private final TopUpProperties properties;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public TopUpResponse requestTopUp(String userId, CreateTopUpRequest request) {
        CurrencyCode currency = CurrencyCode.fromCode(request.getCurrency())
                .filter(code -> providerProperties.supportsCurrency(code.name()))
                .orElseThrow(() -> new InvalidArgumentException("Unsupported currency: " + request.getCurrency()));

        AmountValidation validation = MoneyNormalizer.validateAmount(
                request.getAmount(), currency, properties.getMinAmount(), properties.getMaxAmount());
        if (!validation.isValid()) {
            throw new InvalidArgumentException(validation.message());
        }

        PaymentMethod method = PaymentMethod.fromWire(request.getPaymentMethod());
        String network = null;
        if (method == PaymentMethod.MOBILE_MONEY) {
            if (request.getPhoneNumber() == null || request.getPhoneNumber().isBlank()) {
                throw new InvalidArgumentException("Phone number is required for mobile money");
            }
            network = providerProperties.getNetworks().get(request.getMobileProviderId());
            if (network == null) {
                throw new InvalidArgumentException("Unknown mobile money provider: " + request.getMobileProviderId());
            }
        }

        Wallet wallet = walletService.getWallet(userId);
        if (wallet.getCurrency() != currency) {
            throw new FailedPreconditionException(
                    String.format("Wallet is held in %s, cannot top up in %s", wallet.getCurrency(), currency));
        }

        long amount = MoneyNormalizer.toSmallestUnit(request.getAmount(), currency);
        String txRef = TransactionReferences.next(TransactionReferences.TOPUP, clock);
        String mobileNetwork = network;

        MDC.put(CorrelationContext.TX_REF_MDC_KEY, txRef);
        try {
            TopUpRequestEntity created = transactionTemplate.execute(status -> {
                TopUpRequestEntity entity = repository.save(TopUpRequestEntity.create(
                        txRef, userId, amount, currency, method, request.getPhoneNumber(), mobileNetwork,
                        clock.instant().plus(properties.getRequestExpiry())));
                ledgerService.record(posting(entity, "Wallet top-up initiated"), LedgerEntryStatus.PENDING);
                return entity;
            });

            ChargeResult result;
            try {
                result = charge(created, request.getRedirectUrl());
            } catch (ProviderException e) {
                log.error("Provider refused top-up {}: {}", txRef, e.getMessage());
                transactionTemplate.executeWithoutResult(status ->
                        failTopUp(txRef, "Provider rejected charge: " + e.getMessage()));
                throw new InternalException("Payment provider could not start the top-up", e);
            }

            TopUpRequestEntity initiated = transactionTemplate.execute(status -> {
                TopUpRequestEntity entity = lockByTxRef(txRef);
                entity.attachProviderResponse(result.providerReference(), result.paymentLink());
                auditService.recordAs(userId, AuditAction.TOPUP_INITIATED, RESOURCE_TYPE, txRef, Map.of(
                        "amount", amount,
                        "currency", currency.name(),
                        "paymentMethod", method.getWireValue()));
                return entity;
            });

            log.info("Top-up initiated: user={}, amount={}, method={}",
                    userId, MoneyNormalizer.formatForDisplay(amount, currency), method.getWireValue());
            return TopUpResponse.from(initiated);
        } finally {
            MDC.remove(CorrelationContext.TX_REF_MDC_KEY);
        }
    }

    /**
     * Credits the wallet for a verified, successful charge and completes the request.
     * Runs inside the notification's idempotency-guarded transaction.
     *
     * @return false if this charge already completed the request, as when two
     *         copies of one notification race past the idempotency check
     * @throws InvalidArgumentException if the charged amount or currency differs from the request
     * @throws FailedPreconditionException if the request is no longer pending
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public boolean settleTopUp(String txRef, String providerTxId, long chargedAmount, CurrencyCode chargedCurrency) {
        TopUpRequestEntity entity = lockByTxRef(txRef);

        if (entity.getStatus() == TopUpStatus.COMPLETED && providerTxId.equals(entity.getProviderReference())) {
            log.info("Top-up {} already completed by charge {}", txRef, providerTxId);
            return false;
        }
        if (!entity.isPending()) {
            throw new FailedPreconditionException("Top-up " + txRef + " is already " + entity.getStatus());
        }
        if (entity.getAmount() != chargedAmount || entity.getCurrency() != chargedCurrency) {
            throw new InvalidArgumentException(String.format(
                    "Charged %s does not match top-up %s",
                    MoneyNormalizer.formatForDisplay(chargedAmount, chargedCurrency),
                    MoneyNormalizer.formatForDisplay(entity.getAmount(), entity.getCurrency())));
        }
        if (clock.instant().isAfter(entity.getExpiresAt())) {
            // The provider still collected the money, so it is credited
            log.warn("Top-up {} settled after its expiry at {}", txRef, entity.getExpiresAt());
        }

        ledgerService.credit(PostingRequest.builder()
                .userId(entity.getUserId())
                .amount(entity.getAmount())
                .currency(entity.getCurrency())
                .type(LedgerEntryType.TOPUP)
                .description("Wallet top-up")
                .reference(LedgerReference.of(LedgerReference.TOPUP_REQUEST, txRef))
                .meta("providerTxId", providerTxId)
                .meta("paymentMethod", entity.getPaymentMethod().getWireValue())
                .build());
        entity.markCompleted(providerTxId);

        auditService.record(AuditAction.TOPUP_COMPLETED, RESOURCE_TYPE, txRef, Map.of(
                "userId", entity.getUserId(),
                "amount", entity.getAmount(),
                "providerTxId", providerTxId));
        log.info("Top-up {} completed for {}", txRef, entity.getUserId());
        return true;
    }

    /**
     * Marks a pending top-up failed and appends a FAILED ledger marker. No balance effect.
     *
     * @return false if the request had already left PENDING
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public boolean failTopUp(String txRef, String reason) {
        TopUpRequestEntity entity = lockByTxRef(txRef);
        if (!entity.isPending()) {
            log.warn("Ignoring failure of top-up {}: already {}", txRef, entity.getStatus());
            return false;
        }

        entity.markFailed(reason);
        ledgerService.record(posting(entity, "Wallet top-up failed"), LedgerEntryStatus.FAILED);
        auditService.record(AuditAction.TOPUP_FAILED, RESOURCE_TYPE, txRef, Map.of(
                "userId", entity.getUserId(),
                "reason", reason));
        log.warn("Top-up {} failed: {}", txRef, reason);
        return true;
    }

    private ChargeResult charge(TopUpRequestEntity entity, String redirectUrl) {
        ChargeRequest charge = ChargeRequest.builder()
                .txRef(entity.getTxRef())
                .amount(MoneyNormalizer.fromSmallestUnit(entity.getAmount(), entity.getCurrency()))
                .currency(entity.getCurrency().name())
                .phoneNumber(entity.getPhoneNumber())
                .network(entity.getMobileNetwork())
                .customerId(entity.getUserId())
                .redirectUrl(redirectUrl != null ? redirectUrl : providerProperties.getRedirectUrl())
                .title("Wallet top-up")
                .meta(Map.of("source", providerProperties.getSourceTag(), "type", META_TYPE))
                .build();

        return entity.getPaymentMethod() == PaymentMethod.MOBILE_MONEY
                ? providerClient.chargeMobileMoney(charge)
                : providerClient.createPaymentLink(charge);
    }

    private TopUpRequestEntity lockByTxRef(String txRef) {
        return repository.findByTxRefForUpdate(txRef)
                .orElseThrow(() -> new NotFoundException("Top-up request not found: " + txRef));
    }

    private PostingRequest posting(TopUpRequestEntity entity, String description) {
        return PostingRequest.builder()
                .userId(entity.getUserId())
                .amount(entity.getAmount())
                .currency(entity.getCurrency())
                .type(LedgerEntryType.TOPUP)
                .description(description)
                .reference(LedgerReference.of(LedgerReference.TOPUP_REQUEST, entity.getTxRef()))
                .build();
    }
}
