package com.ragplatform.auth.repository;

import com.ragplatform.auth.model.CredentialRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryCredentialRepositoryTest {

    private BCryptPasswordEncoder passwordEncoder;
    private InMemoryCredentialRepository repository;

    @BeforeEach
    void setUp() {
        passwordEncoder = new BCryptPasswordEncoder(4);
        repository = new InMemoryCredentialRepository(passwordEncoder);
    }

    @Test
    @DisplayName("Should find the seeded admin with its roles in seeding order")
    void testAdminAccount() {
        Optional<CredentialRecord> admin = repository.findByEmail("admin@example.com");

        assertTrue(admin.isPresent());
        assertEquals(List.of("admin", "moderator", "expert", "user"), List.copyOf(admin.get().roles()));
    }

    @Test
    @DisplayName("Should store salted hashes, never plaintext")
    void testPasswordsHashed() {
        CredentialRecord user = repository.findByEmail("user@example.com").orElseThrow();

        assertNotEquals("user123", user.passwordHash());
        assertTrue(passwordEncoder.matches("user123", user.passwordHash()));
    }

    @Test
    @DisplayName("Should return empty for unknown, differently-cased and null identifiers")
    void testUnknown() {
        assertTrue(repository.findByEmail("nobody@example.com").isEmpty());
        assertTrue(repository.findByEmail("ADMIN@example.com").isEmpty());
        assertTrue(repository.findByEmail(null).isEmpty());
    }
}
