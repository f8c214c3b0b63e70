package com.titanic.inference.security;

import java.time.Instant;

public record CallerIdentity(String userId, Instant issuedAt, Instant expiresAt, String issuer, String audience) {
}
