package com.parametric.error;

public class NotFoundException extends SettlementException {

    public NotFoundException(String entity, String id) {
        super("NOT_FOUND", entity + " not found: " + id);
    }
}
