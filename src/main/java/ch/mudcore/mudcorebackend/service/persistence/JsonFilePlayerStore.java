package ch.mudcore.mudcorebackend.service.persistence;

import ch.mudcore.mudcorebackend.config.StorageSettings;
import ch.mudcore.mudcorebackend.domain.PlayerRecord;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

/**
 * Flat file backend: all player records in one pretty-printed JSON array.
 *
 * <p>Dates are written as ISO-8601 strings. Writes go to a temporary sibling file that is
 * then moved over the target, so a crash mid-write leaves the previous file intact.
 */
@Component
@Slf4j
public class JsonFilePlayerStore implements FlatFileBackend {

    private static final TypeReference<List<PlayerRecord>> RECORD_LIST_TYPE = new TypeReference<>() { };

    private final ObjectMapper objectMapper;
    private final Path usersFile;

    @Autowired
    public JsonFilePlayerStore(ObjectMapper objectMapper, StorageSettings settings) {
        this(objectMapper, settings.getUsersFile());
    }

    public JsonFilePlayerStore(ObjectMapper objectMapper, Path usersFile) {
        this.objectMapper = objectMapper.copy()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.usersFile = usersFile;
    }

    @Override
    public boolean exists() {
        return Files.exists(usersFile);
    }

    @Override
    public List<PlayerRecord> loadAll() {
        return readFrom(usersFile);
    }

    @Override
    public void saveAll(List<PlayerRecord> records) {
        writeTo(usersFile, records);
    }

    /**
     * Reads a player array from an arbitrary file (snapshot import).
     *
     * @return parsed records, empty if the file does not exist
     * @throws PlayerStorageException if the file is unreadable or not a JSON array
     */
    public List<PlayerRecord> readFrom(Path file) {
        if (!Files.exists(file)) {
            log.info("Users file not found at {}, returning empty list", file);
            return List.of();
        }
        try {
            List<PlayerRecord> records = objectMapper.readValue(file.toFile(), RECORD_LIST_TYPE);
            log.info("Loaded {} users from {}", records.size(), file);
            return records;
        } catch (IOException e) {
            throw new PlayerStorageException("Failed to read users from " + file, e);
        }
    }

    /**
     * Writes a player array to an arbitrary file (snapshot export), creating parent
     * directories as needed.
     */
    public void writeTo(Path file, List<PlayerRecord> records) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            objectMapper.writeValue(tmp.toFile(), records);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            log.debug("Saved {} users to {}", records.size(), file);
        } catch (IOException e) {
            throw new PlayerStorageException("Failed to write users to " + file, e);
        }
    }
}
