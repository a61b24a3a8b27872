package com.flagship.medexchange_ledger.webhook;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Callback body posted by the payment provider.
 *
 * Charges carry our {@code tx_ref}; transfers carry our payout {@code reference}.
 * {@code data.meta} holds the tags we attached when creating the charge or transfer.
 */
@Data
@NoArgsConstructor
public class PaymentNotification {

    public static final String CHARGE_COMPLETED = "charge.completed";
    public static final String CHARGE_FAILED = "charge.failed";
    public static final String TRANSFER_COMPLETED = "transfer.completed";
    public static final String TRANSFER_FAILED = "transfer.failed";

    @JsonProperty("event")
    private String event;

    @JsonProperty("data")
    private Payload data;

    @Data
    @NoArgsConstructor
    public static class Payload {

        @JsonProperty("id")
        private String id;

        @JsonProperty("tx_ref")
        private String txRef;

        @JsonProperty("flw_ref")
        private String flwRef;

        @JsonProperty("reference")
        private String reference;

        @JsonProperty("amount")
        private BigDecimal amount;

        @JsonProperty("currency")
        private String currency;

        @JsonProperty("status")
        private String status;

        @JsonProperty("payment_type")
        private String paymentType;

        @JsonProperty("complete_message")
        private String completeMessage;

        @JsonProperty("meta")
        private Meta meta;
    }

    @Data
    @NoArgsConstructor
    public static class Meta {

        @JsonProperty("source")
        private String source;

        @JsonProperty("type")
        private String type;
    }

    /**
     * Minimal shape check: an event name and a provider transaction id.
     */
    public boolean isWellFormed() {
        return event != null && !event.isBlank()
                && data != null
                && data.getId() != null && !data.getId().isBlank();
    }

    public String source() {
        return data != null && data.getMeta() != null ? data.getMeta().getSource() : null;
    }

    public String purpose() {
        return data != null && data.getMeta() != null ? data.getMeta().getType() : null;
    }

    /**
     * The reference we chose: tx_ref for charges, reference for transfers.
     */
    public String ourReference() {
        if (data == null) {
            return null;
        }
        return data.getTxRef() != null ? data.getTxRef() : data.getReference();
    }
}
