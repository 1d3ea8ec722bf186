package ch.mudcore.mudcorebackend.web.api.dto;

/**
 * DTO returned by manual storage operations.
 *
 * @param message human readable summary
 * @param userCount number of users affected
 */
public record StorageActionResultDto(
        String message,
        int userCount
) {
}
