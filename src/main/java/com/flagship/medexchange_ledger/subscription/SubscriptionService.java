package com.flagship.medexchange_ledger.subscription;

import com.flagship.medexchange_ledger.audit.AuditAction;
import com.flagship.medexchange_ledger.audit.AuditService;
import com.flagship.medexchange_ledger.error.AlreadyExistsException;
import com.flagship.medexchange_ledger.error.FailedPreconditionException;
import com.flagship.medexchange_ledger.error.InternalException;
import com.flagship.medexchange_ledger.error.InvalidArgumentException;
import com.flagship.medexchange_ledger.error.NotFoundException;
import com.flagship.medexchange_ledger.idempotency.IdempotencyGuard;
import com.flagship.medexchange_ledger.idempotency.IdempotencyKey;
import com.flagship.medexchange_ledger.ledger.LedgerEntryType;
import com.flagship.medexchange_ledger.ledger.LedgerReference;
import com.flagship.medexchange_ledger.ledger.LedgerService;
import com.flagship.medexchange_ledger.ledger.PostingRequest;
import com.flagship.medexchange_ledger.ledger.Wallet;
import com.flagship.medexchange_ledger.ledger.WalletService;
import com.flagship.medexchange_ledger.money.CurrencyCode;
import com.flagship.medexchange_ledger.money.MoneyNormalizer;
import com.flagship.medexchange_ledger.provider.ChargeRequest;
import com.flagship.medexchange_ledger.provider.ChargeResult;
import com.flagship.medexchange_ledger.provider.PaymentProviderClient;
import com.flagship.medexchange_ledger.provider.ProviderException;
import com.flagship.medexchange_ledger.provider.ProviderProperties;
import com.flagship.medexchange_ledger.provider.TransactionReferences;
import com.flagship.medexchange_ledger.subscription.dto.ActivateSubscriptionRequest;
import com.flagship.medexchange_ledger.subscription.dto.SubscriptionPaymentRequestResponse;
import com.flagship.medexchange_ledger.subscription.dto.SubscriptionResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Plan activation and the external payment requests that fund it.
 *
 * Free plans activate at once. Wallet-funded plans debit the wallet under an
 * idempotency key scoped to user, plan and calendar day, so a retried call on
 * the same day charges once while a renewal on a later day charges again.
 * Externally funded plans consume a request the provider has already
 * confirmed through its notification; each paid request activates a plan once.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SubscriptionService {

    public static final String META_TYPE = "subscription_payment";
    private static final String RESOURCE_TYPE = "subscription";
    private static final String REQUEST_RESOURCE_TYPE = "subscription_request";
    private static final Set<SubscriptionRequestStatus> PAID_STATUSES =
            EnumSet.of(SubscriptionRequestStatus.COMPLETED, SubscriptionRequestStatus.CONSUMED);

    private final SubscriptionPlanRepository planRepository;
    private final SubscriptionRepository subscriptionRepository;
    private final SubscriptionRequestRepository requestRepository;
    private final WalletService walletService;
    private final LedgerService ledgerService;
    private final IdempotencyGuard idempotencyGuard;
    private final AuditService auditService;
    private final PaymentProviderClient providerClient;
    private final ProviderProperties providerProperties;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public SubscriptionResponse activate(String userId, ActivateSubscriptionRequest request) {
        SubscriptionPlanEntity plan = planRepository.findByIdAndActiveTrue(request.getPlanId())
                .orElseThrow(() -> new NotFoundException("Subscription plan not found: " + request.getPlanId()));

        if (plan.isFree()) {
            return transactionTemplate.execute(status ->
                    SubscriptionResponse.from(activatePlan(userId, plan, SubscriptionFunding.FREE, null)));
        }

        SubscriptionFunding funding = SubscriptionFunding.fromWire(request.getPaymentMethod());
        return funding == SubscriptionFunding.WALLET
                ? activateFromWallet(userId, plan)
                : activateFromExternalPayment(userId, plan, request.getPaymentReference());
    }

    private SubscriptionResponse activateFromWallet(String userId, SubscriptionPlanEntity plan) {
        IdempotencyKey key = IdempotencyKey.walletSubscription(userId, plan.getId(), LocalDate.now(clock));

        return transactionTemplate.execute(status -> {
            Wallet wallet = walletService.lockWallet(userId);
            if (wallet.getCurrency() != plan.getCurrency()) {
                throw new FailedPreconditionException(String.format(
                        "Wallet is held in %s, plan %s is priced in %s",
                        wallet.getCurrency(), plan.getId(), plan.getCurrency()));
            }

            Optional<SubscriptionEntity> activated = idempotencyGuard.runOnce(key,
                    Map.of("userId", userId, "planId", plan.getId(), "amount", plan.getPrice()),
                    () -> {
                        ledgerService.debit(PostingRequest.builder()
                                .userId(userId)
                                .amount(plan.getPrice())
                                .currency(plan.getCurrency())
                                .type(LedgerEntryType.SUBSCRIPTION_PAYMENT)
                                .description("Subscription: " + plan.getName())
                                .reference(LedgerReference.of(LedgerReference.SUBSCRIPTION, userId))
                                .meta("planId", plan.getId())
                                .build());
                        return activatePlan(userId, plan, SubscriptionFunding.WALLET, null);
                    });

            if (activated.isEmpty()) {
                log.info("Wallet subscription {} for {} already charged today", plan.getId(), userId);
                SubscriptionEntity current = subscriptionRepository.findById(userId)
                        .orElseThrow(() -> new NotFoundException("Subscription not found for " + userId));
                if (!current.getPlanId().equals(plan.getId())) {
                    throw new FailedPreconditionException(String.format(
                            "Plan %s was already charged today but %s is now active", plan.getId(), current.getPlanId()));
                }
                return SubscriptionResponse.from(current);
            }
            return SubscriptionResponse.from(activated.get());
        });
    }

    private SubscriptionResponse activateFromExternalPayment(String userId, SubscriptionPlanEntity plan,
                                                             String paymentReference) {
        if (paymentReference == null || paymentReference.isBlank()) {
            throw new InvalidArgumentException("Payment reference is required for external payment");
        }

        return transactionTemplate.execute(status -> {
            SubscriptionRequestEntity paid = requestRepository
                    .lockByUserAndReference(userId, paymentReference, PAID_STATUSES)
                    .orElseThrow(() -> new NotFoundException("No completed payment found for " + paymentReference));

            if (!paid.getPlanId().equals(plan.getId())) {
                throw new FailedPreconditionException(String.format(
                        "Payment %s was made for plan %s, not %s", paymentReference, paid.getPlanId(), plan.getId()));
            }

            if (paid.getStatus() == SubscriptionRequestStatus.CONSUMED) {
                Optional<SubscriptionEntity> current = subscriptionRepository.findByIdForUpdate(userId);
                if (current.isPresent()
                        && current.get().getPlanId().equals(plan.getId())
                        && Objects.equals(current.get().getProviderReference(), paid.getProviderReference())) {
                    log.info("Payment {} already activated plan {} for {}", paymentReference, plan.getId(), userId);
                    return SubscriptionResponse.from(current.get());
                }
                throw new FailedPreconditionException("Payment " + paymentReference + " has already been used");
            }

            paid.markConsumed();
            return SubscriptionResponse.from(
                    activatePlan(userId, plan, SubscriptionFunding.EXTERNAL, paid.getProviderReference()));
        });
    }

    /**
     * Opens a pending request and a hosted payment link for a paid plan. The
     * request completes when the provider notifies the successful charge.
     */
    public SubscriptionPaymentRequestResponse requestExternalPayment(String userId, String planId) {
        SubscriptionPlanEntity plan = planRepository.findByIdAndActiveTrue(planId)
                .orElseThrow(() -> new NotFoundException("Subscription plan not found: " + planId));
        if (plan.isFree()) {
            throw new InvalidArgumentException("Plan " + planId + " is free and needs no payment");
        }

        String txRef = TransactionReferences.next(TransactionReferences.SUBSCRIPTION, clock);
        SubscriptionRequestEntity created;
        try {
            created = transactionTemplate.execute(status -> {
                if (requestRepository.existsByUserIdAndPlanIdAndStatus(userId, planId, SubscriptionRequestStatus.PENDING)) {
                    throw new AlreadyExistsException("A payment for plan " + planId + " is already pending");
                }
                return requestRepository.saveAndFlush(SubscriptionRequestEntity.create(userId, plan, txRef));
            });
        } catch (DataIntegrityViolationException e) {
            throw new AlreadyExistsException("A payment for plan " + planId + " is already pending");
        }

        ChargeResult result;
        try {
            result = providerClient.createPaymentLink(ChargeRequest.builder()
                    .txRef(txRef)
                    .amount(MoneyNormalizer.fromSmallestUnit(plan.getPrice(), plan.getCurrency()))
                    .currency(plan.getCurrency().name())
                    .customerId(userId)
                    .redirectUrl(providerProperties.getRedirectUrl())
                    .title("Subscription: " + plan.getName())
                    .meta(Map.of("source", providerProperties.getSourceTag(), "type", META_TYPE))
                    .build());
        } catch (ProviderException e) {
            log.error("Provider refused subscription payment {}: {}", txRef, e.getMessage());
            transactionTemplate.executeWithoutResult(status ->
                    failPaymentRequest(txRef, "Provider rejected charge: " + e.getMessage()));
            throw new InternalException("Payment provider could not start the subscription payment", e);
        }

        SubscriptionRequestEntity initiated = transactionTemplate.execute(status -> {
            SubscriptionRequestEntity entity = lockByTxRef(txRef);
            entity.attachPaymentLink(result.providerReference(), result.paymentLink());
            auditService.recordAs(userId, AuditAction.SUBSCRIPTION_PAYMENT_REQUESTED, REQUEST_RESOURCE_TYPE, txRef,
                    Map.of("planId", planId, "amount", plan.getPrice(), "currency", plan.getCurrency().name()));
            return entity;
        });

        log.info("Subscription payment requested: user={}, plan={}, txRef={}", userId, planId, created.getTxRef());
        return SubscriptionPaymentRequestResponse.from(initiated);
    }

    /**
     * Marks a pending request paid after a verified charge. No wallet effect;
     * the caller activates the plan afterwards with the payment reference.
     *
     * @return false if this charge already completed the request
     * @throws InvalidArgumentException if the charged amount or currency differs from the plan price
     * @throws FailedPreconditionException if the request is no longer pending
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public boolean completePaymentRequest(String txRef, String providerTxId, long chargedAmount, CurrencyCode chargedCurrency) {
        SubscriptionRequestEntity entity = lockByTxRef(txRef);
        if (PAID_STATUSES.contains(entity.getStatus()) && providerTxId.equals(entity.getProviderReference())) {
            log.info("Subscription request {} already completed by charge {}", txRef, providerTxId);
            return false;
        }
        if (!entity.isPending()) {
            throw new FailedPreconditionException("Subscription request " + txRef + " is already " + entity.getStatus());
        }
        if (entity.getAmount() != chargedAmount || entity.getCurrency() != chargedCurrency) {
            throw new InvalidArgumentException(String.format(
                    "Charged %s does not match subscription price %s",
                    MoneyNormalizer.formatForDisplay(chargedAmount, chargedCurrency),
                    MoneyNormalizer.formatForDisplay(entity.getAmount(), entity.getCurrency())));
        }

        entity.markCompleted(providerTxId, clock.instant());
        auditService.record(AuditAction.SUBSCRIPTION_PAYMENT_COMPLETED, REQUEST_RESOURCE_TYPE, txRef, Map.of(
                "userId", entity.getUserId(),
                "planId", entity.getPlanId(),
                "providerTxId", providerTxId));
        log.info("Subscription payment {} completed for {}", txRef, entity.getUserId());
        return true;
    }

    /**
     * @return false if the request had already left PENDING
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public boolean failPaymentRequest(String txRef, String reason) {
        SubscriptionRequestEntity entity = lockByTxRef(txRef);
        if (!entity.isPending()) {
            log.warn("Ignoring failure of subscription request {}: already {}", txRef, entity.getStatus());
            return false;
        }
        entity.markFailed(reason);
        auditService.record(AuditAction.SUBSCRIPTION_PAYMENT_FAILED, REQUEST_RESOURCE_TYPE, txRef, Map.of(
                "userId", entity.getUserId(),
                "reason", reason));
        log.warn("Subscription payment {} failed: {}", txRef, reason);
        return true;
    }

    @Transactional(readOnly = true)
    public Optional<SubscriptionEntity> currentSubscription(String userId) {
        return subscriptionRepository.findById(userId);
    }

    @Transactional(readOnly = true)
    public List<SubscriptionPlanEntity> activePlans() {
        return planRepository.findByActiveTrueOrderByPriceAsc();
    }

    private SubscriptionEntity activatePlan(String userId, SubscriptionPlanEntity plan,
                                            SubscriptionFunding funding, String providerReference) {
        Instant now = clock.instant();
        SubscriptionEntity subscription = subscriptionRepository.findByIdForUpdate(userId)
                .orElseGet(() -> SubscriptionEntity.forUser(userId));
        subscription.activate(plan, funding, providerReference, now);
        SubscriptionEntity saved = subscriptionRepository.save(subscription);

        auditService.recordAs(userId, AuditAction.SUBSCRIPTION_ACTIVATED, RESOURCE_TYPE, userId, Map.of(
                "planId", plan.getId(),
                "tier", plan.getTier().name(),
                "paymentMethod", funding.name(),
                "expiresAt", saved.getExpiresAt().toString()));
        log.info("Subscription {} activated for {} via {}, expires {}",
                plan.getId(), userId, funding, saved.getExpiresAt());
        return saved;
    }

    private SubscriptionRequestEntity lockByTxRef(String txRef) {
        return requestRepository.findByTxRefForUpdate(txRef)
                .orElseThrow(() -> new NotFoundException("Subscription request not found: " + txRef));
    }
}
