package com.linlay.chatrunner.security;

import java.time.Instant;

public record AuthenticatedUser(
        String subject,
        String scope,
        Instant issuedAt,
        Instant expiresAt
) {
}
