package com.titanic.inference.security;

import com.titanic.inference.config.ConfigurationException;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PublicKey;
import java.security.interfaces.RSAPublicKey;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;

public final class PemKeys {
    private static final String BEGIN = "-----BEGIN PUBLIC KEY-----";
    private static final String END = "-----END PUBLIC KEY-----";

    private PemKeys() {
    }

    public static RSAPublicKey parseRsaPublicKey(String pem) {
        if (pem == null || pem.isBlank()) {
            throw new ConfigurationException("jwt public key required");
        }
        if (pem.contains("PRIVATE KEY")) {
            throw new ConfigurationException("jwt public key must be a public key, not a private key");
        }
        String body = pem.replace(BEGIN, "").replace(END, "").replaceAll("\\s", "");
        try {
            byte[] der = Base64.getDecoder().decode(body);
            PublicKey key = KeyFactory.getInstance("RSA").generatePublic(new X509EncodedKeySpec(der));
            return (RSAPublicKey) key;
        } catch (IllegalArgumentException | GeneralSecurityException ex) {
            throw new ConfigurationException("jwt public key is not a valid RSA public key", ex);
        }
    }
}
