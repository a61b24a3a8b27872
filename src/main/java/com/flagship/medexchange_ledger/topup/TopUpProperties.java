package com.flagship.medexchange_ledger.topup;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Limits for wallet top-ups, in display units of the requested currency.
 */
@Data
@ConfigurationProperties(prefix = "top-up")
public class TopUpProperties {

    private BigDecimal minAmount = new BigDecimal("100");

    private BigDecimal maxAmount = new BigDecimal("1000000");

    /**
     * How long the provider charge stays payable.
     */
    private Duration requestExpiry = Duration.ofMinutes(30);
}
