package org.pokerroom.service.poker.engine;

import org.pokerroom.model.poker.ActionType;

public record ActionResult(boolean accepted, ActionType action, long amount, RejectReason reason) {

    public static ActionResult accepted(ActionType action, long amount) {
        return new ActionResult(true, action, amount, null);
    }

    public static ActionResult rejected(RejectReason reason) {
        return new ActionResult(false, null, 0, reason);
    }
}
