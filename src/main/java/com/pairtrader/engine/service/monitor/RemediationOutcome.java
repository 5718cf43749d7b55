package com.pairtrader.engine.service.monitor;

import com.pairtrader.engine.model.Order;

public record RemediationOutcome(Action action, Order replacement, String message) {

    public enum Action {
        SKIPPED_COOLDOWN,
        CANCEL_FAILED,
        ALREADY_FILLED,
        CANCELED_ONLY,
        RECREATED,
        RECREATION_FAILED
    }

    static RemediationOutcome of(Action action, Order replacement, String message) {
        return new RemediationOutcome(action, replacement, message);
    }
}
