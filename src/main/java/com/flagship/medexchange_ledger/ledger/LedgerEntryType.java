package com.flagship.medexchange_ledger.ledger;

/**
 * Kind of monetary movement a ledger entry records. The direction decides
 * whether a completed entry lowers or raises the wallet balance.
 */
public enum LedgerEntryType {
    CREDIT(Direction.IN),
    DEBIT(Direction.OUT),
    REFUND(Direction.IN),
    SUBSCRIPTION_PAYMENT(Direction.OUT),
    EXCHANGE_FEE(Direction.OUT),
    DELIVERY_PAYMENT(Direction.OUT),
    TOPUP(Direction.IN);

    public enum Direction { IN, OUT }

    private final Direction direction;

    LedgerEntryType(Direction direction) {
        this.direction = direction;
    }

    public Direction getDirection() {
        return direction;
    }
}
