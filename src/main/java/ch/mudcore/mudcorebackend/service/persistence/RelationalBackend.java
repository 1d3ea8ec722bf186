package ch.mudcore.mudcorebackend.service.persistence;

import ch.mudcore.mudcorebackend.domain.PlayerRecord;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Asynchronous row-per-player storage.
 *
 * <p>Implementations capture the record's state when {@link #upsertOne(PlayerRecord)} is
 * called; later mutations of the record do not leak into the queued write.
 */
public interface RelationalBackend {

    CompletableFuture<List<PlayerRecord>> loadAll();

    /**
     * Inserts the record or replaces the existing row with the same username.
     */
    CompletableFuture<Void> upsertOne(PlayerRecord record);
}
