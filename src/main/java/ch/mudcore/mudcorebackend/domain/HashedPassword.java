package ch.mudcore.mudcorebackend.domain;

/**
 * Result of hashing a password: hex encoded derived key plus the hex encoded salt used.
 *
 * @param hash derived key
 * @param salt random salt
 */
public record HashedPassword(String hash, String salt) {
}
