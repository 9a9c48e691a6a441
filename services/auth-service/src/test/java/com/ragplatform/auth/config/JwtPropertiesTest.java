package com.ragplatform.auth.config;

import com.ragplatform.auth.exception.ConfigurationException;
import io.jsonwebtoken.SignatureAlgorithm;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.validation.ValidationAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class JwtPropertiesTest {

    private static final String SECRET_32 = "0123456789abcdef0123456789abcdef";

    private Validator validator;

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(ValidationAutoConfiguration.class))
            .withUserConfiguration(JwtPropertiesConfiguration.class);

    @Configuration(proxyBeanMethods = false)
    @EnableConfigurationProperties(JwtProperties.class)
    static class JwtPropertiesConfiguration {
    }

    @BeforeEach
    void setUp() {
        validator = Validation.buildDefaultValidatorFactory().getValidator();
    }

    @Test
    @DisplayName("Should accept a 256-bit secret for HS256")
    void testValid() {
        JwtProperties properties = new JwtProperties(SECRET_32, "HS256", 30);

        assertEquals(SignatureAlgorithm.HS256, properties.signatureAlgorithm());
        assertEquals(30, properties.expirationMinutes());
        assertTrue(validator.validate(properties).isEmpty());
    }

    @Test
    @DisplayName("Should flag a missing or blank secret")
    void testMissingSecret() {
        for (String secret : new String[]{null, "", "   "}) {
            Set<ConstraintViolation<JwtProperties>> violations = validator.validate(new JwtProperties(secret, "HS256", 30));

            assertEquals(1, violations.size(), "Secret '" + secret + "' should be rejected");
            assertEquals("secret", violations.iterator().next().getPropertyPath().toString());
        }
    }

    @Test
    @DisplayName("Should refuse a secret shorter than the algorithm's key size")
    void testWeakSecret() {
        assertThrows(ConfigurationException.class, () -> new JwtProperties("change_me", "HS256", 30));
        assertThrows(ConfigurationException.class, () -> new JwtProperties(SECRET_32, "HS512", 30));
    }

    @Test
    @DisplayName("Should refuse unknown and non-HMAC algorithms")
    void testAlgorithm() {
        assertThrows(ConfigurationException.class, () -> new JwtProperties(SECRET_32, "HS999", 30));
        assertThrows(ConfigurationException.class, () -> new JwtProperties(SECRET_32, "RS256", 30));
        assertThrows(ConfigurationException.class, () -> new JwtProperties(SECRET_32, "none", 30));
    }

    @Test
    @DisplayName("Should flag a non-positive token lifetime")
    void testLifetime() {
        assertFalse(validator.validate(new JwtProperties(SECRET_32, "HS256", 0)).isEmpty());
        assertFalse(validator.validate(new JwtProperties(SECRET_32, "HS256", -1)).isEmpty());
    }

    @Test
    @DisplayName("Should not print the secret")
    void testToStringMasksSecret() {
        assertFalse(new JwtProperties(SECRET_32, "HS256", 30).toString().contains(SECRET_32));
    }

    @Test
    @DisplayName("Should bind defaults when only the secret is configured")
    void testBindsDefaults() {
        contextRunner
                .withPropertyValues("jwt.secret=" + SECRET_32)
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    JwtProperties properties = context.getBean(JwtProperties.class);
                    assertThat(properties.algorithm()).isEqualTo("HS256");
                    assertThat(properties.expirationMinutes()).isEqualTo(30);
                });
    }

    @Test
    @DisplayName("Should refuse to start without a signing secret")
    void testStartupFailsWithoutSecret() {
        contextRunner
                .withPropertyValues("jwt.secret=")
                .run(context -> assertThat(context).hasFailed());
        contextRunner
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    @DisplayName("Should refuse to start with a non-positive lifetime")
    void testStartupFailsWithBadLifetime() {
        contextRunner
                .withPropertyValues("jwt.secret=" + SECRET_32, "jwt.expiration-minutes=0")
                .run(context -> assertThat(context).hasFailed());
    }
}
