package com.flagship.medexchange_ledger.webhook;

import com.flagship.medexchange_ledger.earnings.PayoutService;
import com.flagship.medexchange_ledger.error.InvalidArgumentException;
import com.flagship.medexchange_ledger.idempotency.DuplicateOperationException;
import com.flagship.medexchange_ledger.idempotency.IdempotencyGuard;
import com.flagship.medexchange_ledger.idempotency.IdempotencyKey;
import com.flagship.medexchange_ledger.money.CurrencyCode;
import com.flagship.medexchange_ledger.money.MoneyNormalizer;
import com.flagship.medexchange_ledger.observability.CorrelationContext;
import com.flagship.medexchange_ledger.observability.LedgerMetrics;
import com.flagship.medexchange_ledger.provider.PaymentProviderClient;
import com.flagship.medexchange_ledger.provider.ProviderProperties;
import com.flagship.medexchange_ledger.provider.VerifiedTransaction;
import com.flagship.medexchange_ledger.subscription.SubscriptionService;
import com.flagship.medexchange_ledger.topup.TopUpService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Triage of authenticated provider callbacks.
 *
 * Steps after the controller has checked the signature and shape:
 * 1. Ignore callbacks not tagged with our source (the provider account is shared)
 * 2. For charge.completed, re-read the transaction from the provider and trust that answer
 * 3. In one transaction: idempotency check, dispatch to the ledger operation, idempotency mark
 * 4. Record a receipt with the outcome
 *
 * Nothing here throws to the caller except a failure to write the receipt
 * itself; every other failure becomes a FAILED receipt flagged for reconciliation.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentNotificationProcessor {

    private static final Set<String> HANDLED_EVENTS = Set.of(
            PaymentNotification.CHARGE_COMPLETED,
            PaymentNotification.CHARGE_FAILED,
            PaymentNotification.TRANSFER_COMPLETED,
            PaymentNotification.TRANSFER_FAILED);

    private static final Set<String> CHARGE_PURPOSES = Set.of(
            TopUpService.META_TYPE,
            SubscriptionService.META_TYPE);

    private final PaymentProviderClient providerClient;
    private final ProviderProperties providerProperties;
    private final IdempotencyGuard idempotencyGuard;
    private final TopUpService topUpService;
    private final SubscriptionService subscriptionService;
    private final PayoutService payoutService;
    private final NotificationReceiptService receiptService;
    private final TransactionTemplate transactionTemplate;
    private final LedgerMetrics metrics;

    public NotificationOutcome process(PaymentNotification notification) {
        String provider = providerClient.name();
        String event = notification.getEvent();
        String providerTxId = notification.getData().getId();

        MDC.put(CorrelationContext.TX_REF_MDC_KEY, String.valueOf(notification.ourReference()));
        try {
            if (!providerProperties.getSourceTag().equals(notification.source())) {
                log.info("Ignoring {} for {}: not originated by this system", event, providerTxId);
                return finish(provider, notification, NotificationOutcome.IGNORED, "Foreign source");
            }
            if (!HANDLED_EVENTS.contains(event)) {
                log.info("Ignoring unhandled event {} for {}", event, providerTxId);
                return finish(provider, notification, NotificationOutcome.IGNORED, "Unhandled event");
            }
            if (isCharge(event) && !CHARGE_PURPOSES.contains(notification.purpose())) {
                log.warn("Ignoring {} for {}: unknown purpose {}", event, providerTxId, notification.purpose());
                return finish(provider, notification, NotificationOutcome.IGNORED, "Unknown purpose");
            }

            // Network call stays outside the transaction
            VerifiedTransaction verified = PaymentNotification.CHARGE_COMPLETED.equals(event)
                    ? verify(notification)
                    : null;

            IdempotencyKey key = IdempotencyKey.notification(provider, providerTxId, event);
            Map<String, Object> metadata = Map.of(
                    "event", event,
                    "reference", String.valueOf(notification.ourReference()));

            Optional<NotificationOutcome> outcome = transactionTemplate.execute(status ->
                    idempotencyGuard.runOnce(key, metadata, () -> dispatch(notification, verified)));

            if (outcome == null || outcome.isEmpty()) {
                log.warn("Duplicate {} for {} acknowledged without effect", event, providerTxId);
                return finish(provider, notification, NotificationOutcome.DUPLICATE, null);
            }
            return finish(provider, notification, outcome.get(), null);

        } catch (DuplicateOperationException e) {
            log.warn("Concurrent duplicate {} for {} lost the race", event, providerTxId);
            return finish(provider, notification, NotificationOutcome.DUPLICATE, null);
        } catch (RuntimeException e) {
            log.error("Failed to process {} for {}: {}", event, providerTxId, e.getMessage(), e);
            return finish(provider, notification, NotificationOutcome.FAILED, e.getMessage());
        } finally {
            MDC.remove(CorrelationContext.TX_REF_MDC_KEY);
        }
    }

    /**
     * The callback proves who sent it, not that the charge succeeded.
     */
    private VerifiedTransaction verify(PaymentNotification notification) {
        PaymentNotification.Payload data = notification.getData();
        VerifiedTransaction verified = providerClient.verifyTransaction(data.getId());

        if (!verified.isSuccessful()) {
            throw new InvalidArgumentException("Provider reports transaction status " + verified.status());
        }
        if (verified.txRef() != null && !verified.txRef().equals(data.getTxRef())) {
            throw new InvalidArgumentException("Verified reference " + verified.txRef()
                    + " does not match callback reference " + data.getTxRef());
        }
        if (data.getAmount() != null && verified.amount() != null
                && verified.amount().compareTo(data.getAmount()) != 0) {
            throw new InvalidArgumentException("Callback amount differs from verified amount");
        }
        if (data.getCurrency() != null && !data.getCurrency().equalsIgnoreCase(verified.currency())) {
            throw new InvalidArgumentException("Callback currency differs from verified currency");
        }
        return verified;
    }

    private NotificationOutcome dispatch(PaymentNotification notification, VerifiedTransaction verified) {
        PaymentNotification.Payload data = notification.getData();
        String reference = notification.ourReference();

        switch (notification.getEvent()) {
            case PaymentNotification.CHARGE_COMPLETED: {
                CurrencyCode currency = CurrencyCode.fromCode(verified.currency())
                        .orElseThrow(() -> new InvalidArgumentException("Unsupported currency " + verified.currency()));
                long amount = MoneyNormalizer.toSmallestUnit(verified.amount(), currency);

                boolean settled = TopUpService.META_TYPE.equals(notification.purpose())
                        ? topUpService.settleTopUp(reference, data.getId(), amount, currency)
                        : subscriptionService.completePaymentRequest(reference, data.getId(), amount, currency);
                return settled ? NotificationOutcome.PROCESSED : NotificationOutcome.DUPLICATE;
            }
            case PaymentNotification.CHARGE_FAILED: {
                String reason = "Payment failed at provider";
                boolean changed = TopUpService.META_TYPE.equals(notification.purpose())
                        ? topUpService.failTopUp(reference, reason)
                        : subscriptionService.failPaymentRequest(reference, reason);
                return changed ? NotificationOutcome.PROCESSED : NotificationOutcome.IGNORED;
            }
            case PaymentNotification.TRANSFER_COMPLETED: {
                // The provider reports failed transfers under transfer.completed too
                boolean changed = "FAILED".equalsIgnoreCase(data.getStatus())
                        ? payoutService.failPayout(reference, failureMessage(data))
                        : payoutService.completePayout(reference, data.getId());
                return changed ? NotificationOutcome.PROCESSED : NotificationOutcome.IGNORED;
            }
            case PaymentNotification.TRANSFER_FAILED: {
                boolean changed = payoutService.failPayout(reference, failureMessage(data));
                return changed ? NotificationOutcome.PROCESSED : NotificationOutcome.IGNORED;
            }
            default:
                return NotificationOutcome.IGNORED;
        }
    }

    private NotificationOutcome finish(String provider, PaymentNotification notification,
                                       NotificationOutcome outcome, String errorMessage) {
        receiptService.record(provider, notification, outcome, errorMessage);
        metrics.recordNotification(notification.getEvent(), outcome.name());
        return outcome;
    }

    private static boolean isCharge(String event) {
        return PaymentNotification.CHARGE_COMPLETED.equals(event) || PaymentNotification.CHARGE_FAILED.equals(event);
    }

    private static String failureMessage(PaymentNotification.Payload data) {
        return data.getCompleteMessage() != null ? data.getCompleteMessage() : "Transfer failed at provider";
    }
}
