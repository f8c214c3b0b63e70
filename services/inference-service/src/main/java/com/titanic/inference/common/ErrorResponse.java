package com.titanic.inference.common;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {
    private ErrorDetail error;

    @JsonProperty("trace_id")
    private String traceId;

    @JsonProperty("request_id")
    private String requestId;

    public ErrorResponse() {
    }

    public ErrorResponse(String code, String message, String traceId, String requestId) {
        this.error = new ErrorDetail(code, message);
        this.traceId = traceId;
        this.requestId = requestId;
    }

    public static ErrorResponse of(String code, String message) {
        return new ErrorResponse(
            code,
            message,
            RequestContextHolder.currentTraceId(),
            RequestContextHolder.currentRequestId()
        );
    }

    public ErrorResponse withReason(String reason) {
        error.setReason(reason);
        return this;
    }

    public ErrorResponse withFieldErrors(Map<String, List<String>> fieldErrors) {
        error.setFieldErrors(fieldErrors);
        return this;
    }

    public ErrorDetail getError() {
        return error;
    }

    public void setError(ErrorDetail error) {
        this.error = error;
    }

    public String getTraceId() {
        return traceId;
    }

    public void setTraceId(String traceId) {
        this.traceId = traceId;
    }

    public String getRequestId() {
        return requestId;
    }

    public void setRequestId(String requestId) {
        this.requestId = requestId;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ErrorDetail {
        private String code;
        private String message;
        private String reason;

        @JsonProperty("field_errors")
        private Map<String, List<String>> fieldErrors;

        public ErrorDetail() {
        }

        public ErrorDetail(String code, String message) {
            this.code = code;
            this.message = message;
        }

        public String getCode() {
            return code;
        }

        public void setCode(String code) {
            this.code = code;
        }

        public String getMessage() {
            return message;
        }

        public void setMessage(String message) {
            this.message = message;
        }

        public String getReason() {
            return reason;
        }

        public void setReason(String reason) {
            this.reason = reason;
        }

        public Map<String, List<String>> getFieldErrors() {
            return fieldErrors;
        }

        public void setFieldErrors(Map<String, List<String>> fieldErrors) {
            this.fieldErrors = fieldErrors;
        }
    }
}
