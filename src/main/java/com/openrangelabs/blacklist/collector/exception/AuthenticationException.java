package com.openrangelabs.blacklist.collector.exception;

import com.openrangelabs.blacklist.collector.model.ErrorKind;

/**
 * Authentication against a source portal failed.
 *
 * <p>Stage one failures ({@link Reason#CREDENTIAL_REJECTED}) mean the username or
 * password is wrong. Stage two failures ({@link Reason#SESSION_EXCHANGE_FAILED})
 * happen after the credentials were accepted and are usually transient.
 *
 * @author OpenRange Labs
 * @version 1.0
 * @since 2025-01
 */
public class AuthenticationException extends CollectionException {

    public enum Reason {
        CREDENTIAL_REJECTED(ErrorKind.CREDENTIAL_REJECTED),
        SESSION_EXCHANGE_FAILED(ErrorKind.SESSION_EXCHANGE_FAILED);

        private final ErrorKind errorKind;

        Reason(ErrorKind errorKind) {
            this.errorKind = errorKind;
        }

        public ErrorKind getErrorKind() {
            return errorKind;
        }
    }

    private final Reason reason;

    public AuthenticationException(Reason reason, String sourceName, String message) {
        super(reason.getErrorKind(), sourceName, message);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
