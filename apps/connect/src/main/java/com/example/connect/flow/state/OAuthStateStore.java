package com.example.connect.flow.state;

import org.springframework.lang.NonNull;
import reactor.core.publisher.Mono;

/**
 * TTL-bearing storage of CSRF state entries.
 * Implementations can use Redis (shared across instances) or in-memory (single pod) storage.
 */
public interface OAuthStateStore {

    /**
     * Stores a new entry.
     *
     * @return false if an entry with the same state token already exists
     */
    @NonNull
    Mono<Boolean> save(@NonNull OAuthStateEntry entry);

    /**
     * Removes and returns the entry in one atomic step, so that of any number of
     * concurrent callers at most one receives it. Completes empty when the entry is
     * absent, already consumed or past its TTL.
     */
    @NonNull
    Mono<OAuthStateEntry> consume(@NonNull String state);
}
