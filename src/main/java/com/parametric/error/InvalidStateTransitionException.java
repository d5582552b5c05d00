package com.parametric.error;

public class InvalidStateTransitionException extends SettlementException {

    public InvalidStateTransitionException(String entity, String id, Object from, Object to) {
        super("INVALID_STATE_TRANSITION",
            entity + " " + id + " cannot move from " + from + " to " + to);
    }
}
