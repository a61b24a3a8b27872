package com.flagship.medexchange_ledger.workflow;

public enum ItemSide {
    /** Medicines the requester wants. */
    REQUESTED,
    /** Medicines the requester gives in return. */
    OFFERED
}
