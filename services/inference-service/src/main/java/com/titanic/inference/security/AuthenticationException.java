package com.titanic.inference.security;

public class AuthenticationException extends RuntimeException {
    private final AuthFailureReason reason;

    public AuthenticationException(AuthFailureReason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public AuthenticationException(AuthFailureReason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public AuthFailureReason getReason() {
        return reason;
    }
}
