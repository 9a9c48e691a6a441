package com.ragplatform.auth.config;

import com.ragplatform.auth.exception.ConfigurationException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.SignatureAlgorithm;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.nio.charset.StandardCharsets;

/**
 * JWT signing configuration, bound from the {@code jwt.*} properties.
 *
 * <pre>
 * jwt:
 *   secret: ${JWT_SECRET}          # required, at least as long as the algorithm's key size
 *   algorithm: ${JWT_ALG:HS256}    # HS256, HS384 or HS512
 *   expiration-minutes: ${JWT_EXP_MIN:30}
 * </pre>
 *
 * A bad value stops the application context from starting instead of
 * surfacing on the first login. Presence and range are checked by bean
 * validation; the constructor checks what needs JJWT (algorithm family and
 * key size).
 *
 * @param secret            HMAC signing secret (UTF-8 bytes are the key)
 * @param algorithm         JWS algorithm name
 * @param expirationMinutes default access token lifetime
 */
@Validated
@ConfigurationProperties(prefix = "jwt")
public record JwtProperties(
        @NotBlank(message = "jwt.secret is not set; refusing to start without a signing secret") String secret,
        @NotBlank @DefaultValue("HS256") String algorithm,
        @Positive @DefaultValue("30") long expirationMinutes) {

    public JwtProperties {
        SignatureAlgorithm resolved = resolve(algorithm);
        // a missing secret is reported by @NotBlank
        if (secret != null && !secret.isBlank()) {
            int keyBits = secret.getBytes(StandardCharsets.UTF_8).length * 8;
            if (keyBits < resolved.getMinKeyLength()) {
                throw new ConfigurationException("jwt.secret is " + keyBits + " bits; " + resolved.getValue()
                        + " requires at least " + resolved.getMinKeyLength() + " bits");
            }
        }
    }

    /**
     * The configured algorithm as a JJWT {@link SignatureAlgorithm}.
     */
    public SignatureAlgorithm signatureAlgorithm() {
        return resolve(algorithm);
    }

    /**
     * Hides the secret from logs and actuator-style dumps.
     */
    @Override
    public String toString() {
        return "JwtProperties[secret=****, algorithm=" + algorithm + ", expirationMinutes=" + expirationMinutes + "]";
    }

    private static SignatureAlgorithm resolve(String name) {
        SignatureAlgorithm resolved;
        try {
            resolved = SignatureAlgorithm.forName(name);
        } catch (JwtException e) {
            throw new ConfigurationException("jwt.algorithm '" + name + "' is not a known JWS algorithm", e);
        }
        if (!resolved.isHmac()) {
            throw new ConfigurationException("jwt.algorithm must be an HMAC algorithm (HS256/HS384/HS512), got " + name);
        }
        return resolved;
    }
}
