package com.titanic.inference.common;

public final class RequestContextHolder {
    private static final ThreadLocal<RequestContext> CONTEXT = new ThreadLocal<>();

    private RequestContextHolder() {
    }

    public static void set(RequestContext context) {
        CONTEXT.set(context);
    }

    public static RequestContext get() {
        return CONTEXT.get();
    }

    public static String currentRequestId() {
        RequestContext context = CONTEXT.get();
        return context == null ? null : context.getRequestId();
    }

    public static String currentTraceId() {
        RequestContext context = CONTEXT.get();
        return context == null ? null : context.getTraceId();
    }

    public static void clear() {
        CONTEXT.remove();
    }
}
