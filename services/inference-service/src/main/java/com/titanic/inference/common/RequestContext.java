package com.titanic.inference.common;

public class RequestContext {
    private final String requestId;
    private final String traceId;
    private final long startedAtNs;

    public RequestContext(String requestId, String traceId, long startedAtNs) {
        this.requestId = requestId;
        this.traceId = traceId;
        this.startedAtNs = startedAtNs;
    }

    public String getRequestId() {
        return requestId;
    }

    public String getTraceId() {
        return traceId;
    }

    public long getStartedAtNs() {
        return startedAtNs;
    }

    public long elapsedMs() {
        return (System.nanoTime() - startedAtNs) / 1_000_000L;
    }
}
