package com.titanic.inference.security;

import io.jsonwebtoken.JwtBuilder;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.nio.charset.StandardCharsets;
import java.security.NoSuchAlgorithmException;
import java.security.PublicKey;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Date;

public final class TestTokens {
    public static final String ISSUER = "titanic-ml-frontend";
    public static final String AUDIENCE = "titanic-ml-service";

    private static final KeyPair KEYS = generate();
    private static final KeyPair OTHER_KEYS = generate();

    private TestTokens() {
    }

    public static KeyPair keys() {
        return KEYS;
    }

    public static KeyPair otherKeys() {
        return OTHER_KEYS;
    }

    public static String publicKeyPem() {
        return toPem(KEYS.getPublic());
    }

    public static String valid(String userId) {
        Instant now = Instant.now();
        return builder(userId, now, now.plus(Duration.ofHours(1))).compact();
    }

    public static String expired(String userId) {
        Instant now = Instant.now();
        return builder(userId, now.minus(Duration.ofHours(2)), now.minus(Duration.ofHours(1))).compact();
    }

    public static JwtBuilder builder(String userId, Instant issuedAt, Instant expiresAt) {
        JwtBuilder builder = Jwts.builder()
            .setIssuer(ISSUER)
            .setAudience(AUDIENCE)
            .setIssuedAt(Date.from(issuedAt))
            .setExpiration(Date.from(expiresAt))
            .signWith(KEYS.getPrivate(), SignatureAlgorithm.RS256);
        if (userId != null) {
            builder.claim("user_id", userId);
        }
        return builder;
    }

    public static String toPem(PublicKey key) {
        byte[] lineSeparator = "\n".getBytes(StandardCharsets.US_ASCII);
        String encoded = Base64.getMimeEncoder(64, lineSeparator).encodeToString(key.getEncoded());
        return "-----BEGIN PUBLIC KEY-----\n" + encoded + "\n-----END PUBLIC KEY-----\n";
    }

    private static KeyPair generate() {
        try {
            KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
            generator.initialize(2048);
            return generator.generateKeyPair();
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException(ex);
        }
    }
}
