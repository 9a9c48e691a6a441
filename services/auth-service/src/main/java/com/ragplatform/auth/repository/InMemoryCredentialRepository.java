package com.ragplatform.auth.repository;

import com.ragplatform.auth.model.CredentialRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Repository;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Fixed demo account table, hashed once at startup and read-only afterwards.
 *
 * <table>
 *   <tr><th>email</th><th>roles</th></tr>
 *   <tr><td>admin@example.com</td><td>admin, moderator, expert, user</td></tr>
 *   <tr><td>expert@example.com</td><td>expert, user</td></tr>
 *   <tr><td>user@example.com</td><td>user</td></tr>
 * </table>
 */
@Slf4j
@Repository
public class InMemoryCredentialRepository implements CredentialRepository {

    private final Map<String, CredentialRecord> accounts;

    public InMemoryCredentialRepository(PasswordEncoder passwordEncoder) {
        Map<String, CredentialRecord> seeded = new LinkedHashMap<>();
        seed(seeded, passwordEncoder, "admin@example.com", "admin123",
                "admin", "moderator", "expert", "user");
        seed(seeded, passwordEncoder, "expert@example.com", "expert123",
                "expert", "user");
        seed(seeded, passwordEncoder, "user@example.com", "user123",
                "user");
        this.accounts = Map.copyOf(seeded);
        log.info("Loaded {} demo accounts into the in-memory credential store", accounts.size());
    }

    @Override
    public Optional<CredentialRecord> findByEmail(String email) {
        if (email == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(accounts.get(email));
    }

    private static void seed(Map<String, CredentialRecord> target, PasswordEncoder encoder,
                             String email, String password, String... roles) {
        target.put(email, new CredentialRecord(email, encoder.encode(password), new LinkedHashSet<>(List.of(roles))));
    }
}
