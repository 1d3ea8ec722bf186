package ch.mudcore.mudcorebackend.web.api.dto;

import java.util.List;

/**
 * DTO returned after a flag was added or removed.
 *
 * @param username player the flags belong to
 * @param flags flags after the change
 * @param changed whether the request actually changed anything
 */
public record FlagsDto(
        String username,
        List<String> flags,
        boolean changed
) {
}
