package com.flagship.medexchange_ledger.earnings;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Courier earnings and payout settings.
 *
 * <pre>
 * earnings:
 *   release-delay: 24h
 *   release-batch-size: 500
 *   release-cron: "0 0 * * * *"
 *   min-payout-amount: 1000      # display units
 *   payout-fee-percent: 1.0
 *   payout-fee-cap:              # smallest units, unset = uncapped
 *   commission-percent: 15
 * </pre>
 */
@Data
@ConfigurationProperties(prefix = "earnings")
public class EarningsProperties {

    private Duration releaseDelay = Duration.ofHours(24);

    private int releaseBatchSize = 500;

    private String releaseCron = "0 0 * * * *";

    private BigDecimal minPayoutAmount = new BigDecimal("1000");

    private BigDecimal payoutFeePercent = new BigDecimal("1.0");

    private Long payoutFeeCap;

    /**
     * Platform share of the delivery fee; the courier earns the rest.
     */
    private BigDecimal commissionPercent = new BigDecimal("15");
}
