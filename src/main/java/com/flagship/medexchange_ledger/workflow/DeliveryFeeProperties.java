package com.flagship.medexchange_ledger.workflow;

import com.flagship.medexchange_ledger.money.CurrencyCode;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Delivery base fee per country, in display units of the country's currency.
 *
 * <pre>
 * delivery:
 *   fees:
 *     default-fee: { amount: 500, currency: XAF }
 *     countries:
 *       KE: { amount: 100, currency: KES }
 * </pre>
 */
@Data
@ConfigurationProperties(prefix = "delivery.fees")
public class DeliveryFeeProperties {

    private Fee defaultFee = new Fee(new BigDecimal("500"), CurrencyCode.XAF);

    private Map<String, Fee> countries = new HashMap<>();

    /**
     * Verification codes shown to the parties, entered by the courier.
     */
    private int codeLength = 6;

    public Fee feeFor(String countryCode) {
        if (countryCode == null) {
            return defaultFee;
        }
        return countries.getOrDefault(countryCode.toUpperCase(Locale.ROOT), defaultFee);
    }

    @Data
    public static class Fee {
        private BigDecimal amount;
        private CurrencyCode currency;

        public Fee() {
        }

        public Fee(BigDecimal amount, CurrencyCode currency) {
            this.amount = amount;
            this.currency = currency;
        }
    }
}
