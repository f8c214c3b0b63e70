package com.titanic.inference.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import java.nio.charset.StandardCharsets;
import java.security.interfaces.RSAPublicKey;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Base64;
import java.util.Date;
import java.util.List;
import org.junit.jupiter.api.Test;

class TokenAuthenticatorTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private final JwtProperties properties = properties(Duration.ZERO);
    private final TokenAuthenticator authenticator = authenticator(properties);

    @Test
    void acceptsValidToken() {
        String token = TestTokens.builder("passenger-42", NOW.minusSeconds(60), NOW.plusSeconds(3600)).compact();

        CallerIdentity identity = authenticator.verify(token);

        assertThat(identity.userId()).isEqualTo("passenger-42");
        assertThat(identity.issuer()).isEqualTo(TestTokens.ISSUER);
        assertThat(identity.audience()).isEqualTo(TestTokens.AUDIENCE);
        assertThat(identity.issuedAt()).isEqualTo(NOW.minusSeconds(60));
        assertThat(identity.expiresAt()).isEqualTo(NOW.plusSeconds(3600));
    }

    @Test
    void fallsBackToSubjectForUserId() {
        String token = TestTokens.builder(null, NOW, NOW.plusSeconds(60)).setSubject("subject-7").compact();

        assertThat(authenticator.verify(token).userId()).isEqualTo("subject-7");
    }

    @Test
    void rejectsExpiredTokenEvenWhenSignatureIsValid() {
        String token = TestTokens.builder("u1", NOW.minusSeconds(7200), NOW.minusSeconds(1)).compact();

        assertReason(token, AuthFailureReason.EXPIRED);
    }

    @Test
    void rejectsExpiredTokenWithForeignSignature() {
        String token = Jwts.builder()
            .setIssuer(TestTokens.ISSUER)
            .setAudience(TestTokens.AUDIENCE)
            .claim("user_id", "u1")
            .setExpiration(Date.from(NOW.minusSeconds(1)))
            .signWith(TestTokens.otherKeys().getPrivate(), SignatureAlgorithm.RS256)
            .compact();

        assertThatThrownBy(() -> authenticator.verify(token)).isInstanceOf(AuthenticationException.class);
    }

    @Test
    void clockSkewToleratesRecentExpiry() {
        TokenAuthenticator lenient = authenticator(properties(Duration.ofSeconds(60)));
        String token = TestTokens.builder("u1", NOW.minusSeconds(600), NOW.minusSeconds(30)).compact();

        assertThat(lenient.verify(token).userId()).isEqualTo("u1");
    }

    @Test
    void rejectsMissingToken() {
        assertReason(null, AuthFailureReason.MISSING);
        assertReason("  ", AuthFailureReason.MISSING);
    }

    @Test
    void rejectsMalformedTokens() {
        assertReason("not-a-token", AuthFailureReason.MALFORMED);
        assertReason("a.b", AuthFailureReason.MALFORMED);
        assertReason("%%%.@@@.!!!", AuthFailureReason.MALFORMED);
    }

    @Test
    void rejectsTokenSignedByAnotherKey() {
        String token = Jwts.builder()
            .setIssuer(TestTokens.ISSUER)
            .setAudience(TestTokens.AUDIENCE)
            .claim("user_id", "u1")
            .setExpiration(Date.from(NOW.plusSeconds(600)))
            .signWith(TestTokens.otherKeys().getPrivate(), SignatureAlgorithm.RS256)
            .compact();

        assertReason(token, AuthFailureReason.BAD_SIGNATURE);
    }

    @Test
    void rejectsTamperedPayload() {
        String token = TestTokens.builder("u1", NOW, NOW.plusSeconds(600)).compact();
        String[] parts = token.split("\\.");
        String forged = Base64.getUrlEncoder().withoutPadding().encodeToString(
            ("{\"iss\":\"titanic-ml-frontend\",\"aud\":\"titanic-ml-service\",\"user_id\":\"admin\",\"exp\":"
                + NOW.plusSeconds(600).getEpochSecond() + "}").getBytes(StandardCharsets.UTF_8));

        assertReason(parts[0] + "." + forged + "." + parts[2], AuthFailureReason.BAD_SIGNATURE);
    }

    @Test
    void rejectsSymmetricAlgorithm() {
        String token = Jwts.builder()
            .setIssuer(TestTokens.ISSUER)
            .setAudience(TestTokens.AUDIENCE)
            .claim("user_id", "u1")
            .setExpiration(Date.from(NOW.plusSeconds(600)))
            .signWith(Keys.hmacShaKeyFor("0123456789abcdef0123456789abcdef".getBytes(StandardCharsets.UTF_8)),
                SignatureAlgorithm.HS256)
            .compact();

        assertReason(token, AuthFailureReason.BAD_SIGNATURE);
    }

    @Test
    void rejectsWrongIssuer() {
        String token = TestTokens.builder("u1", NOW, NOW.plusSeconds(600)).setIssuer("someone-else").compact();

        assertReason(token, AuthFailureReason.ISSUER_MISMATCH);
    }

    @Test
    void rejectsWrongAudience() {
        String token = TestTokens.builder("u1", NOW, NOW.plusSeconds(600)).setAudience("billing").compact();

        assertReason(token, AuthFailureReason.AUDIENCE_MISMATCH);
    }

    @Test
    void acceptsAudienceList() {
        String token = TestTokens.builder("u1", NOW, NOW.plusSeconds(600))
            .claim("aud", List.of("billing", TestTokens.AUDIENCE))
            .compact();

        assertThat(authenticator.verify(token).userId()).isEqualTo("u1");
    }

    @Test
    void rejectsTokenWithoutUserId() {
        String token = TestTokens.builder(null, NOW, NOW.plusSeconds(600)).compact();

        assertReason(token, AuthFailureReason.MALFORMED);
    }

    @Test
    void rejectsTokenWithoutExpiry() {
        String token = Jwts.builder()
            .setIssuer(TestTokens.ISSUER)
            .setAudience(TestTokens.AUDIENCE)
            .claim("user_id", "u1")
            .signWith(TestTokens.keys().getPrivate(), SignatureAlgorithm.RS256)
            .compact();

        assertReason(token, AuthFailureReason.MALFORMED);
    }

    private void assertReason(String token, AuthFailureReason reason) {
        assertThatThrownBy(() -> authenticator.verify(token))
            .isInstanceOf(AuthenticationException.class)
            .extracting("reason")
            .isEqualTo(reason);
    }

    private static TokenAuthenticator authenticator(JwtProperties properties) {
        return new TokenAuthenticator(
            (RSAPublicKey) TestTokens.keys().getPublic(),
            properties,
            Clock.fixed(NOW, ZoneOffset.UTC)
        );
    }

    private static JwtProperties properties(Duration skew) {
        JwtProperties properties = new JwtProperties();
        properties.setIssuer(TestTokens.ISSUER);
        properties.setAudience(TestTokens.AUDIENCE);
        properties.setPublicKey(TestTokens.publicKeyPem());
        properties.setClockSkew(skew);
        return properties;
    }
}
