package ch.mudcore.mudcorebackend.service.persistence;

import ch.mudcore.mudcorebackend.domain.PlayerRecord;

import java.util.List;

/**
 * Synchronous whole-collection storage of player records in a single file.
 */
public interface FlatFileBackend {

    boolean exists();

    /**
     * @return all stored records, empty if the file does not exist
     * @throws PlayerStorageException if the file cannot be read or parsed
     */
    List<PlayerRecord> loadAll();

    /**
     * Replaces the stored collection.
     *
     * @throws PlayerStorageException if the file cannot be written
     */
    void saveAll(List<PlayerRecord> records);
}
