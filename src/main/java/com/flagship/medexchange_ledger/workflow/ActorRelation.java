package com.flagship.medexchange_ledger.workflow;

/**
 * How a caller relates to an exchange or delivery. Transitions name the
 * relation they require rather than a user id.
 */
public enum ActorRelation {
    /** Created the exchange. */
    REQUESTER,
    /** Attached responder, or while none is attached, any other party in the exchange's city. */
    RESPONDER,
    /** Any courier; further preconditions decide. */
    COURIER,
    /** The courier the delivery was assigned to. */
    ASSIGNED_COURIER,
    /** Either party that owes half of the delivery fee. */
    PAYING_PARTY,
    ADMINISTRATOR
}
