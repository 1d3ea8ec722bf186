package ch.mudcore.mudcorebackend.web.api.dto;

/**
 * Request body naming a snapshot file on the server.
 *
 * @param path file path, relative paths resolve against the configured data directory
 */
public record SnapshotRequest(String path) {
}
