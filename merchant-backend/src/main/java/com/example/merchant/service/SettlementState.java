package com.example.merchant.service;

/**
 * Progress of a delegated checkout. Only {@link #SETTLED} allows an order to be created.
 */
public enum SettlementState {

    CART,
    QUOTED,
    SETTLEMENT_REQUESTED,
    SETTLED,
    SETTLEMENT_DENIED,
    FACILITATOR_UNREACHABLE;

    public boolean canMoveTo(SettlementState next) {
        return switch (this) {
            case CART -> next == QUOTED;
            case QUOTED -> next == SETTLEMENT_REQUESTED;
            case SETTLEMENT_REQUESTED -> next == SETTLED || next == SETTLEMENT_DENIED || next == FACILITATOR_UNREACHABLE;
            case SETTLED, SETTLEMENT_DENIED, FACILITATOR_UNREACHABLE -> false;
        };
    }

    /**
     * @throws IllegalStateException if the transition is not allowed
     */
    public SettlementState moveTo(SettlementState next) {
        if (!canMoveTo(next)) {
            throw new IllegalStateException("Illegal settlement transition " + this + " -> " + next);
        }
        return next;
    }

}
