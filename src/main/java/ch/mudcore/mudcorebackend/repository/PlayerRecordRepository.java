package ch.mudcore.mudcorebackend.repository;

import ch.mudcore.mudcorebackend.domain.PlayerRecordEntity;
import org.springframework.data.jpa.repository.JpaRepository;

/**
 * Repository for {@link PlayerRecordEntity} rows, keyed by username.
 *
 * <p>{@code save} merges by primary key, which gives the full-row insert-or-replace
 * semantics the relational backend relies on.
 */
public interface PlayerRecordRepository extends JpaRepository<PlayerRecordEntity, String> {
}
