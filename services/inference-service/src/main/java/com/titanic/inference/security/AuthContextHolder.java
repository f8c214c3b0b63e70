package com.titanic.inference.security;

public final class AuthContextHolder {
    private static final ThreadLocal<CallerIdentity> CONTEXT = new ThreadLocal<>();

    private AuthContextHolder() {
    }

    public static void set(CallerIdentity identity) {
        CONTEXT.set(identity);
    }

    public static CallerIdentity get() {
        return CONTEXT.get();
    }

    public static void clear() {
        CONTEXT.remove();
    }
}
