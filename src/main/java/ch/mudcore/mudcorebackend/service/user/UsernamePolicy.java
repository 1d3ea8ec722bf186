package ch.mudcore.mudcorebackend.service.user;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Username normalization and shape rules.
 *
 * <p>Usernames are letters only, 3 to 12 characters, and stored lower-case. Every lookup
 * normalizes first, so lookups are case-insensitive.
 */
public final class UsernamePolicy {

    public static final int MIN_LENGTH = 3;
    public static final int MAX_LENGTH = 12;

    private static final Pattern LETTERS_ONLY = Pattern.compile("^[a-zA-Z]+$");

    private UsernamePolicy() {
        // utility class
    }

    public static String normalize(String username) {
        return username == null ? "" : username.trim().toLowerCase(Locale.ROOT);
    }

    public static boolean isValid(String username) {
        return username != null
                && username.length() >= MIN_LENGTH
                && username.length() <= MAX_LENGTH
                && LETTERS_ONLY.matcher(username).matches();
    }
}
