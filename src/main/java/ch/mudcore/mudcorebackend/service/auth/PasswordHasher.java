package ch.mudcore.mudcorebackend.service.auth;

import ch.mudcore.mudcorebackend.domain.HashedPassword;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.PBEKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.HexFormat;

/**
 * Salted PBKDF2 password hashing.
 *
 * <p>Parameters: HMAC-SHA512, 16 byte random salt, 64 byte derived key, both hex encoded.
 * The iteration count is fixed per deployment ({@code mudcore.password.iterations},
 * default 10000) because stored hashes do not record it.
 */
@Component
public class PasswordHasher {

    private static final String ALGORITHM = "PBKDF2WithHmacSHA512";
    private static final int SALT_BYTES = 16;
    private static final int KEY_BYTES = 64;
    private static final HexFormat HEX = HexFormat.of();

    private final SecureRandom random = new SecureRandom();
    private final int iterations;

    public PasswordHasher(@Value("${mudcore.password.iterations:10000}") int iterations) {
        if (iterations < 1) {
            throw new IllegalArgumentException("Iteration count must be positive: " + iterations);
        }
        this.iterations = iterations;
    }

    /**
     * Hashes a password with a fresh random salt.
     */
    public HashedPassword hash(String password) {
        byte[] salt = new byte[SALT_BYTES];
        random.nextBytes(salt);
        String saltHex = HEX.formatHex(salt);
        return new HashedPassword(derive(password, saltHex), saltHex);
    }

    /**
     * Checks a password against a stored hash and salt in constant time.
     *
     * @return {@code false} if hash or salt is missing or does not match
     */
    public boolean verify(String password, String hash, String salt) {
        if (hash == null || hash.isEmpty() || salt == null || salt.isEmpty()) {
            return false;
        }
        String candidate = derive(password, salt);
        return MessageDigest.isEqual(
                candidate.getBytes(StandardCharsets.US_ASCII),
                hash.getBytes(StandardCharsets.US_ASCII)
        );
    }

    /**
     * The PBKDF2 salt is the UTF-8 encoding of the hex salt string, as in existing player files.
     */
    private String derive(String password, String salt) {
        PBEKeySpec spec = new PBEKeySpec(
                (password == null ? "" : password).toCharArray(),
                salt.getBytes(StandardCharsets.UTF_8),
                iterations,
                KEY_BYTES * 8
        );
        try {
            SecretKeyFactory factory = SecretKeyFactory.getInstance(ALGORITHM);
            return HEX.formatHex(factory.generateSecret(spec).getEncoded());
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to derive password hash", e);
        } finally {
            spec.clearPassword();
        }
    }
}
