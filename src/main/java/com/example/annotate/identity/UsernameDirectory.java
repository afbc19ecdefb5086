package com.example.annotate.identity;

import reactor.core.publisher.Mono;

/**
 * Identity-to-username mapping. Completes empty when the user has not reserved a username.
 */
public interface UsernameDirectory {
    Mono<String> findUsername(String uid);
}
