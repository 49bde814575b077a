package com.stock.pulse.engine.service.upstream;

import java.time.Instant;

/**
 * Result of one credential exchange.
 */
public record IssuedToken(String token, Instant expiresAt) {

    @Override
    public String toString() {
        return "IssuedToken[expiresAt=" + expiresAt + "]";
    }
}
