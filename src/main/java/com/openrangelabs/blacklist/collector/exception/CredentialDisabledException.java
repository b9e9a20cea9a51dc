package com.openrangelabs.blacklist.collector.exception;

import com.openrangelabs.blacklist.collector.model.ErrorKind;

/**
 * Thrown when the stored credential for a source has been deactivated.
 *
 * @author OpenRange Labs
 * @version 1.0
 * @since 2025-01
 */
public class CredentialDisabledException extends CollectionException {

    public CredentialDisabledException(String sourceName) {
        super(ErrorKind.CREDENTIAL_DISABLED, sourceName,
                String.format("Credential for source %s is disabled", sourceName));
    }
}
