package ch.mudcore.mudcorebackend.service.auth;

import ch.mudcore.mudcorebackend.domain.PlayerRecord;
import ch.mudcore.mudcorebackend.service.user.UserStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Verifies login credentials and migrates legacy plaintext passwords on first use.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PasswordAuthenticator {

    private final UserStore userStore;
    private final PasswordHasher passwordHasher;

    /**
     * Checks a username/password pair.
     *
     * <p>A record that still carries a plaintext password is compared directly; on success
     * the plaintext is replaced by a fresh hash and salt and the record is persisted before
     * this method returns. Failed attempts leave the record untouched.
     *
     * @return {@code true} if the user exists and the password matches
     */
    public boolean authenticate(String username, String password) {
        Optional<PlayerRecord> found = userStore.getUser(username);
        if (found.isEmpty()) {
            log.debug("Authentication failed, unknown user '{}'", username);
            return false;
        }
        PlayerRecord record = found.get();

        if (record.hasLegacyPassword()) {
            if (!record.getPassword().equals(password)) {
                return false;
            }
            userStore.replaceCredential(record.getUsername(), passwordHasher.hash(password)).join();
            log.info("Migrated user {} to hashed password", record.getUsername());
            return true;
        }

        return passwordHasher.verify(password, record.getPasswordHash(), record.getSalt());
    }

    /**
     * Sets a new password, replacing any existing credential.
     *
     * @return {@code false} if no such user exists
     */
    public boolean changePassword(String username, String newPassword) {
        if (!userStore.userExists(username)) {
            log.warn("Cannot change password of unknown user '{}'", username);
            return false;
        }
        boolean changed = userStore.replaceCredential(username, passwordHasher.hash(newPassword)).join();
        if (changed) {
            log.info("Password changed for user {}", username);
        }
        return changed;
    }
}
