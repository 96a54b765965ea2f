package com.folio.backend.model;

/**
 * Lifecycle of a single trade request. Any failure before RECORDING ends in
 * REJECTED with nothing written.
 */
public enum TradeState {
    VALIDATING,
    RECORDING,
    UPDATING,
    SETTLING,
    DONE,
    REJECTED;

    public boolean canTransitionTo(TradeState target) {
        if (target == null) return false;

        return switch (this) {
            case VALIDATING -> target == RECORDING || target == REJECTED;
            case RECORDING -> target == UPDATING;
            case UPDATING -> target == SETTLING;
            case SETTLING -> target == DONE;
            default -> false;
        };
    }
}
