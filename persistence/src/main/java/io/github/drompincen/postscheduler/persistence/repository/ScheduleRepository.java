package io.github.drompincen.postscheduler.persistence.repository;

import io.github.drompincen.postscheduler.persistence.document.ScheduleDocument;

import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Durable key-value store of schedule records. Knows nothing about timers.
 * Failures to read or write the backing storage surface as {@link ScheduleStoreException}.
 */
public interface ScheduleRepository {

    List<ScheduleDocument> findAll();

    Optional<ScheduleDocument> findById(String id);

    /** Inserts or replaces the record stored under {@code doc.getId()}. */
    ScheduleDocument save(ScheduleDocument doc);

    /** @return whether a record existed under {@code id} */
    boolean deleteById(String id);

    /**
     * Applies {@code mutator} to the stored record and writes it back in one locked
     * read-modify-write. Does nothing when no record exists under {@code id}.
     */
    Optional<ScheduleDocument> update(String id, Consumer<ScheduleDocument> mutator);
}
