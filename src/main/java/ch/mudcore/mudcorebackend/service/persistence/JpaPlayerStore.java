package ch.mudcore.mudcorebackend.service.persistence;

import ch.mudcore.mudcorebackend.domain.PlayerRecord;
import ch.mudcore.mudcorebackend.domain.PlayerRecordEntity;
import ch.mudcore.mudcorebackend.repository.PlayerRecordRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Relational backend on top of Spring Data JPA.
 *
 * <p>All database work runs on the single-threaded {@code persistenceExecutor}, which acts
 * as the write-behind queue: writes are applied in submission order and never block the
 * caller. The row is mapped on the calling thread so the queued write holds a snapshot of
 * the record, not a live reference.
 */
@Component
@Slf4j
public class JpaPlayerStore implements RelationalBackend {

    private final PlayerRecordRepository repository;
    private final PlayerRecordMapper mapper;
    private final Executor executor;

    public JpaPlayerStore(PlayerRecordRepository repository,
                          PlayerRecordMapper mapper,
                          @Qualifier("persistenceExecutor") Executor executor) {
        this.repository = repository;
        this.mapper = mapper;
        this.executor = executor;
    }

    @Override
    public CompletableFuture<List<PlayerRecord>> loadAll() {
        return CompletableFuture.supplyAsync(() -> {
            List<PlayerRecord> records = repository.findAll().stream()
                    .map(mapper::toRecord)
                    .toList();
            log.info("Loaded {} users from database", records.size());
            return records;
        }, executor);
    }

    @Override
    public CompletableFuture<Void> upsertOne(PlayerRecord record) {
        PlayerRecordEntity row = mapper.toEntity(record);
        return CompletableFuture.runAsync(() -> repository.save(row), executor);
    }
}
