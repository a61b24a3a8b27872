package com.flagship.medexchange_ledger.earnings;

import com.flagship.medexchange_ledger.audit.AuditAction;
import com.flagship.medexchange_ledger.audit.AuditService;
import com.flagship.medexchange_ledger.error.NotFoundException;
import com.flagship.medexchange_ledger.money.CurrencyCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Locked access to courier wallets and the per-courier release step.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CourierWalletService {

    private final CourierWalletRepository walletRepository;
    private final CourierEarningRepository earningRepository;
    private final AuditService auditService;

    @Transactional(propagation = Propagation.MANDATORY)
    public CourierWalletEntity lock(String courierId) {
        return walletRepository.findByIdForUpdate(courierId)
                .orElseThrow(() -> new NotFoundException("Courier wallet not found for " + courierId));
    }

    /**
     * Locks the wallet, creating an empty one in {@code currency} first if the courier has none.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public CourierWalletEntity lockOrOpen(String courierId, CurrencyCode currency) {
        if (walletRepository.insertIfAbsent(courierId, currency.name()) > 0) {
            log.info("Opened courier wallet for {} in {}", courierId, currency);
        }
        return lock(courierId);
    }

    @Transactional(readOnly = true)
    public Optional<CourierWalletEntity> find(String courierId) {
        return walletRepository.findById(courierId);
    }

    /**
     * Matures one courier's share of a release batch in its own transaction.
     *
     * The wallet lock serializes overlapping runs for this courier; the earnings
     * are then re-read and only those still PENDING are released, so a second
     * run over the same batch credits nothing.
     *
     * @return number of earnings moved to AVAILABLE
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public int releaseForCourier(String courierId, Collection<UUID> earningIds, Instant releasedAt) {
        CourierWalletEntity wallet = lock(courierId);
        List<CourierEarningEntity> earnings =
                earningRepository.lockByIdsInStatus(courierId, earningIds, CourierEarningStatus.PENDING);
        if (earnings.isEmpty()) {
            log.debug("Nothing left to release for courier {}", courierId);
            return 0;
        }

        long total = 0;
        for (CourierEarningEntity earning : earnings) {
            if (earning.getCurrency() != wallet.getCurrency()) {
                throw new IllegalStateException(String.format("Earning %s is in %s but wallet of %s is in %s",
                        earning.getId(), earning.getCurrency(), courierId, wallet.getCurrency()));
            }
            earning.markAvailable(releasedAt);
            total = Math.addExact(total, earning.getAmount());
        }
        wallet.release(total);

        auditService.record(AuditAction.EARNINGS_RELEASED, "courier_wallet", courierId, Map.of(
                "earnings", earnings.size(),
                "amount", total,
                "currency", wallet.getCurrency().name()));
        log.info("Released {} earnings ({}) for courier {}", earnings.size(), total, courierId);
        return earnings.size();
    }
}
