package com.ragplatform.auth.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.time.Clock;

/**
 * Shared infrastructure beans for the identity components.
 */
@Configuration
public class IdentityConfig {

    /**
     * Single time source for token issuance and expiry checks. Tests replace it
     * with {@link Clock#fixed} to exercise expiry deterministically.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * BCrypt with the default strength (10). Salted and deliberately slow.
     */
    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder();
    }
}
