package com.collegeportal.backend.modules.auth.infrastructure.jwt;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * HMAC key used to sign access tokens. The configured secret is read as Base64 when it decodes,
 * otherwise as raw UTF-8.
 */
@Component
public class JwtTokenProvider {

    private static final String HMAC_SHA_256 = "HmacSHA256";

    private final SecretKey secretKey;

    public JwtTokenProvider(@Value("${jwt.secret}") String secretString) {
        this.secretKey = new SecretKeySpec(decode(secretString), HMAC_SHA_256);
    }

    static byte[] decode(String secretString) {
        try {
            return Base64.getDecoder().decode(secretString);
        } catch (IllegalArgumentException ex) {
            return secretString.getBytes(StandardCharsets.UTF_8);
        }
    }

    public SecretKey getSecretKey() {
        return secretKey;
    }
}
