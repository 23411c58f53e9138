package com.example.connect.flow.state;

import com.example.connect.common.error.OAuthError;
import com.example.connect.common.error.OAuthErrorType;
import com.example.connect.common.error.OAuthException;

public class StateStoreException extends OAuthException {

    public StateStoreException(String message, Throwable cause) {
        super(OAuthError.of(OAuthErrorType.STORE_UNAVAILABLE, message), cause);
    }
}
