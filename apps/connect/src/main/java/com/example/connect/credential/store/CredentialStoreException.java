package com.example.connect.credential.store;

import com.example.connect.common.error.OAuthError;
import com.example.connect.common.error.OAuthErrorType;
import com.example.connect.common.error.OAuthException;

/**
 * The secret backend could not be reached or answered unexpectedly.
 * Distinct from "not found", which is an empty result.
 */
public class CredentialStoreException extends OAuthException {

    public CredentialStoreException(String message, Throwable cause) {
        super(OAuthError.of(OAuthErrorType.STORE_UNAVAILABLE, message), cause);
    }
}
