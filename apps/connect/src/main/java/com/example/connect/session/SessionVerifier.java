package com.example.connect.session;

import org.springframework.lang.NonNull;
import reactor.core.publisher.Mono;

/**
 * Maps a session credential presented by the caller to the platform user id.
 * The id is opaque to the rest of the service.
 */
public interface SessionVerifier {

    /**
     * @return the user id, or empty when the session is missing, expired or inactive
     */
    @NonNull
    Mono<String> verify(@NonNull String sessionCredential);
}
