package com.jay.valuator.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ValuationMethod {
    COMPS("comps"),
    DCF("dcf"),
    LAST_ROUND("last_round");

    private final String key;

    ValuationMethod(String key) {
        this.key = key;
    }

    @JsonValue
    public String key() {
        return key;
    }

    /** Accepts the wire key ("last_round") or the enum name; null if unrecognised. */
    @JsonCreator
    public static ValuationMethod fromKey(String value) {
        if (value == null) return null;
        String v = value.trim();
        for (ValuationMethod m : values()) {
            if (m.key.equalsIgnoreCase(v) || m.name().equalsIgnoreCase(v)) return m;
        }
        return null;
    }
}
