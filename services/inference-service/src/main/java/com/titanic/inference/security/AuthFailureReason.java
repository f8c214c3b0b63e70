package com.titanic.inference.security;

import java.util.Locale;

public enum AuthFailureReason {
    MISSING,
    MALFORMED,
    EXPIRED,
    BAD_SIGNATURE,
    ISSUER_MISMATCH,
    AUDIENCE_MISMATCH;

    public String wire() {
        return name().toLowerCase(Locale.ROOT);
    }
}
