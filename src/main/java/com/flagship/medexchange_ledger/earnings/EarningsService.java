package com.flagship.medexchange_ledger.earnings;

import com.flagship.medexchange_ledger.audit.AuditAction;
import com.flagship.medexchange_ledger.audit.AuditService;
import com.flagship.medexchange_ledger.error.FailedPreconditionException;
import com.flagship.medexchange_ledger.error.InvalidArgumentException;
import com.flagship.medexchange_ledger.money.CurrencyCode;
import com.flagship.medexchange_ledger.money.MoneyNormalizer;
import com.flagship.medexchange_ledger.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Creates held earnings when deliveries complete.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EarningsService {

    private final CourierEarningRepository earningRepository;
    private final CourierWalletService walletService;
    private final AuditService auditService;
    private final EarningsProperties properties;
    private final Clock clock;

    /**
     * Records the courier's share of a delivery fee as a PENDING earning.
     *
     * At most one earning exists per delivery: a repeat call returns the first
     * one unchanged. The wallet's pending and balance grow by the net amount.
     */
    @Transactional
    public CourierEarningEntity recordEarning(UUID deliveryId, String courierId, long deliveryFee,
                                              CurrencyCode currency) {
        Optional<CourierEarningEntity> existing = earningRepository.findByDeliveryId(deliveryId);
        if (existing.isPresent()) {
            log.info("Earning for delivery {} already recorded, skipping", deliveryId);
            return existing.get();
        }
        if (deliveryFee <= 0) {
            throw new InvalidArgumentException("Delivery " + deliveryId + " has no fee to earn from");
        }

        MDC.put(CorrelationContext.DELIVERY_ID_MDC_KEY, deliveryId.toString());
        MDC.put(CorrelationContext.COURIER_ID_MDC_KEY, courierId);
        try {
            CourierWalletEntity wallet = walletService.lockOrOpen(courierId, currency);
            if (wallet.getCurrency() != currency) {
                throw new FailedPreconditionException(String.format(
                        "Courier wallet is held in %s, delivery was paid in %s", wallet.getCurrency(), currency));
            }

            long commission = MoneyNormalizer.calculateFee(deliveryFee, properties.getCommissionPercent(), null);
            Instant earnedAt = clock.instant();
            CourierEarningEntity earning = earningRepository.save(CourierEarningEntity.create(
                    courierId, deliveryId, deliveryFee, commission, currency,
                    earnedAt, earnedAt.plus(properties.getReleaseDelay())));
            wallet.recordEarning(earning.getAmount());

            auditService.recordAs(courierId, AuditAction.EARNING_CREATED, "courier_earning", deliveryId, Map.of(
                    "deliveryFee", deliveryFee,
                    "commission", commission,
                    "amount", earning.getAmount(),
                    "currency", currency.name()));
            log.info("Courier {} earned {} for delivery {}, available at {}",
                    courierId, MoneyNormalizer.formatForDisplay(earning.getAmount(), currency),
                    deliveryId, earning.getAvailableAt());
            return earning;
        } finally {
            MDC.remove(CorrelationContext.DELIVERY_ID_MDC_KEY);
            MDC.remove(CorrelationContext.COURIER_ID_MDC_KEY);
        }
    }

    @Transactional(readOnly = true)
    public List<CourierEarningEntity> recentEarnings(String courierId) {
        return earningRepository.findTop50ByCourierIdOrderByEarnedAtDesc(courierId);
    }
}
