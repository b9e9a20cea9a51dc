package com.openrangelabs.blacklist.collector.exception;

import com.openrangelabs.blacklist.collector.model.ErrorKind;

/**
 * Thrown when no stored credential exists for a source.
 *
 * @author OpenRange Labs
 * @version 1.0
 * @since 2025-01
 */
public class CredentialNotFoundException extends CollectionException {

    public CredentialNotFoundException(String sourceName) {
        super(ErrorKind.CREDENTIAL_NOT_FOUND, sourceName,
                String.format("Credential not found for source: %s", sourceName));
    }
}
