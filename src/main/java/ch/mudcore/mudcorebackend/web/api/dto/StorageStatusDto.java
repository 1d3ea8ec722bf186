package ch.mudcore.mudcorebackend.web.api.dto;

import ch.mudcore.mudcorebackend.domain.enums.StorageBackend;

/**
 * DTO representing the current persistence configuration.
 *
 * @param backend active backend mode
 * @param testMode whether writes are currently suppressed
 * @param usersFile path of the flat users file
 * @param userCount number of records held in memory
 */
public record StorageStatusDto(
        StorageBackend backend,
        boolean testMode,
        String usersFile,
        int userCount
) {
}
