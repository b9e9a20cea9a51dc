package com.openrangelabs.blacklist.collector.model;

/**
 * Classification of a failed collection run, persisted as {@link #getCode()}.
 */
public enum ErrorKind {

    CREDENTIAL_NOT_FOUND("credential_not_found", true),
    CREDENTIAL_DISABLED("credential_disabled", true),
    CREDENTIAL_REJECTED("credential_rejected", true),
    SESSION_EXCHANGE_FAILED("session_exchange_failed", false),
    RATE_LIMIT_TIMEOUT("rate_limit_timeout", false),
    NETWORK_TIMEOUT("timeout", false),
    CONNECTION_REFUSED("connection_refused", false),
    UNEXPECTED_STATUS("unexpected_status", false),
    PARSE_PRIMARY_FORMAT("primary_format", false),
    PARSE_FALLBACK_FORMAT("fallback_format", false),
    SINK_ERROR("sink_error", false),
    INTERNAL("internal", false);

    private final String code;
    private final boolean requiresOperator;

    ErrorKind(String code, boolean requiresOperator) {
        this.code = code;
        this.requiresOperator = requiresOperator;
    }

    public String getCode() {
        return code;
    }

    /**
     * Whether retrying on the normal backoff schedule cannot fix this error.
     */
    public boolean requiresOperator() {
        return requiresOperator;
    }

    public static ErrorKind fromCode(String code) {
        for (ErrorKind kind : values()) {
            if (kind.code.equals(code)) {
                return kind;
            }
        }
        return INTERNAL;
    }
}
