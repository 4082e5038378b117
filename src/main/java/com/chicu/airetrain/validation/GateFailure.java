package com.chicu.airetrain.validation;

import java.util.Locale;

public record GateFailure(ValidationGate gate, String detail) {

    @Override
    public String toString() {
        return gate.name().toLowerCase(Locale.ROOT) + ": " + detail;
    }
}
