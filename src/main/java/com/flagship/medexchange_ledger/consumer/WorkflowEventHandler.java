package com.flagship.medexchange_ledger.consumer;

import com.flagship.medexchange_ledger.earnings.EarningsService;
import com.flagship.medexchange_ledger.idempotency.IdempotencyGuard;
import com.flagship.medexchange_ledger.idempotency.IdempotencyKey;
import com.flagship.medexchange_ledger.money.CurrencyCode;
import com.flagship.medexchange_ledger.error.InvalidArgumentException;
import com.flagship.medexchange_ledger.workflow.DeliveryService;
import com.flagship.medexchange_ledger.workflow.event.DeliveryCompletedEvent;
import com.flagship.medexchange_ledger.workflow.event.ExchangeAcceptedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Map;

/**
 * Reactions to workflow events. Each event takes effect at most once per
 * consumer group: the idempotency record commits with the effect.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WorkflowEventHandler {

    private final IdempotencyGuard guard;
    private final DeliveryService deliveryService;
    private final EarningsService earningsService;

    /**
     * An accepted exchange gets its delivery.
     *
     * @return false if the event was already handled
     */
    @Transactional
    public boolean onExchangeAccepted(ExchangeAcceptedEvent event, String consumerGroup) {
        return guard.runOnce(
                IdempotencyKey.workflowEvent(event.getEventId(), consumerGroup),
                Map.of("eventType", event.getEventType(), "exchangeId", event.getExchangeId().toString()),
                () -> deliveryService.createForAcceptedExchange(event.getExchangeId())
        ).isPresent();
    }

    /**
     * A completed delivery credits the courier's pending earning.
     *
     * @return false if the event was already handled
     */
    @Transactional
    public boolean onDeliveryCompleted(DeliveryCompletedEvent event, String consumerGroup) {
        CurrencyCode currency = CurrencyCode.fromCode(event.getCurrency())
                .orElseThrow(() -> new InvalidArgumentException("Unsupported currency " + event.getCurrency()));
        return guard.runOnce(
                IdempotencyKey.workflowEvent(event.getEventId(), consumerGroup),
                Map.of("eventType", event.getEventType(), "deliveryId", event.getDeliveryId().toString()),
                () -> earningsService.recordEarning(event.getDeliveryId(), event.getCourierId(), event.getFee(), currency)
        ).isPresent();
    }
}
