package com.titanic.inference.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.SecurityException;
import java.io.IOException;
import java.security.interfaces.RSAPublicKey;
import java.time.Clock;
import java.time.Instant;
import java.util.Base64;
import java.util.Collection;
import java.util.Date;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Verifies RS256 bearer tokens against the configured public key.
 */
@Component
public class TokenAuthenticator {
    private static final String ALGORITHM = "RS256";
    private static final ObjectMapper HEADER_MAPPER = new ObjectMapper();

    private final JwtParser parser;
    private final String issuer;
    private final String audience;

    @Autowired
    public TokenAuthenticator(JwtProperties properties, Clock clock) {
        this(PemKeys.parseRsaPublicKey(properties.getPublicKey()), properties, clock);
    }

    public TokenAuthenticator(RSAPublicKey publicKey, JwtProperties properties, Clock clock) {
        this.issuer = properties.getIssuer();
        this.audience = properties.getAudience();
        long skewSeconds = properties.getClockSkew() == null ? 0L : properties.getClockSkew().toSeconds();
        this.parser = Jwts.parserBuilder()
            .setSigningKey(publicKey)
            .setClock(() -> Date.from(clock.instant()))
            .setAllowedClockSkewSeconds(skewSeconds)
            .build();
    }

    public CallerIdentity verify(String token) {
        if (token == null || token.isBlank()) {
            throw new AuthenticationException(AuthFailureReason.MISSING, "Authorization token missing");
        }
        String[] segments = token.trim().split("\\.", -1);
        if (segments.length != 3 || segments[0].isEmpty() || segments[1].isEmpty() || segments[2].isEmpty()) {
            throw new AuthenticationException(AuthFailureReason.MALFORMED, "Token is not a signed JWT");
        }
        requireAlgorithm(segments[0]);

        Claims claims;
        try {
            claims = parser.parseClaimsJws(token.trim()).getBody();
        } catch (ExpiredJwtException ex) {
            throw new AuthenticationException(AuthFailureReason.EXPIRED, "Token has expired", ex);
        } catch (SecurityException ex) {
            throw new AuthenticationException(AuthFailureReason.BAD_SIGNATURE, "Token signature is invalid", ex);
        } catch (JwtException | IllegalArgumentException ex) {
            throw new AuthenticationException(AuthFailureReason.MALFORMED, "Token could not be decoded", ex);
        }

        if (claims.getExpiration() == null) {
            throw new AuthenticationException(AuthFailureReason.MALFORMED, "Token has no expiry");
        }
        if (!issuer.equals(claims.getIssuer())) {
            throw new AuthenticationException(AuthFailureReason.ISSUER_MISMATCH, "Token issuer is not accepted");
        }
        if (!audienceMatches(claims.get(Claims.AUDIENCE))) {
            throw new AuthenticationException(AuthFailureReason.AUDIENCE_MISMATCH, "Token audience is not accepted");
        }
        String userId = userId(claims);
        if (userId == null) {
            throw new AuthenticationException(AuthFailureReason.MALFORMED, "Token has no user id");
        }
        return new CallerIdentity(
            userId,
            toInstant(claims.getIssuedAt()),
            toInstant(claims.getExpiration()),
            claims.getIssuer(),
            audience
        );
    }

    private void requireAlgorithm(String encodedHeader) {
        JsonNode header;
        try {
            header = HEADER_MAPPER.readTree(Base64.getUrlDecoder().decode(encodedHeader));
        } catch (IllegalArgumentException | IOException ex) {
            throw new AuthenticationException(AuthFailureReason.MALFORMED, "Token header could not be decoded", ex);
        }
        if (header == null || !header.isObject()) {
            throw new AuthenticationException(AuthFailureReason.MALFORMED, "Token header could not be decoded");
        }
        if (!ALGORITHM.equals(header.path("alg").asText(null))) {
            throw new AuthenticationException(AuthFailureReason.BAD_SIGNATURE, "Token must be signed with " + ALGORITHM);
        }
    }

    private boolean audienceMatches(Object claim) {
        if (claim instanceof String value) {
            return audience.equals(value);
        }
        if (claim instanceof Collection<?> values) {
            return values.contains(audience);
        }
        return false;
    }

    private static String userId(Claims claims) {
        Object raw = claims.get("user_id");
        if (raw == null) {
            raw = claims.getSubject();
        }
        if (raw == null) {
            return null;
        }
        String value = raw.toString().trim();
        return value.isEmpty() ? null : value;
    }

    private static Instant toInstant(Date date) {
        return date == null ? null : date.toInstant();
    }
}
